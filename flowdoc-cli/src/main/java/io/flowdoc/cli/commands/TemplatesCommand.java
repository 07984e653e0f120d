package io.flowdoc.cli.commands;

import io.flowdoc.core.template.TemplateRegistry;
import io.flowdoc.core.template.WorkflowTemplate;
import picocli.CommandLine;

/// CLI command for listing the built-in workflow templates and their placeholders.
///
/// ### Usage
/// ```bash
/// flowdoc templates
/// ```
@CommandLine.Command(name = "templates", description = "List workflow templates")
class TemplatesCommand extends FlowdocCommand {

    @Override
    protected void execute() {
        TemplateRegistry registry = getEngine().getTemplateRegistry();
        System.out.println(" Categories: " + String.join(", ", registry.categories()));
        System.out.println();
        for (WorkflowTemplate template : registry.list()) {
            System.out.println(" " + template.id() + " - " + template.name());
            System.out.println("   " + template.description() + " [" + template.category() + "]");
            System.out.println("   Parameters: " + String.join(", ", template.placeholders()));
        }
    }
}

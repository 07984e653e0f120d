package io.flowdoc.cli.commands;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the Flowdoc CLI application.
///
/// Registers all available subcommands:
/// - `validate` - Check a document against the validation rules
/// - `metadata` - Show block counts, type histogram and complexity
/// - `diff` - Compare two documents, optionally with a generated summary
/// - `layout` - Compute block positions and write them into the document
/// - `templates` - List the built-in templates
/// - `template` - Instantiate a template with parameters
/// - `describe` - Generate a document from a natural-language description
///
/// @see ValidateCommand
/// @see MetadataCommand
/// @see DiffCommand
/// @see LayoutCommand
/// @see TemplatesCommand
/// @see TemplateCommand
/// @see DescribeCommand
@Command(
        name = "flowdoc",
        description = "Flowdoc Workflow Document Engine",
        mixinStandardHelpOptions = true,
        version = "flowdoc 1.0.0",
        subcommands = {
            ValidateCommand.class,
            MetadataCommand.class,
            DiffCommand.class,
            LayoutCommand.class,
            TemplatesCommand.class,
            TemplateCommand.class,
            DescribeCommand.class
        })
public class FlowdocCLI {

    public static void main(String[] args) {
        System.exit(new CommandLine(new FlowdocCLI()).execute(args));
    }
}

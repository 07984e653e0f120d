package io.flowdoc.cli.commands;

import io.flowdoc.cli.exception.DocumentLoadException;
import io.flowdoc.core.FlowdocEngine;
import io.flowdoc.core.FlowdocFactory;
import io.flowdoc.core.document.ParseResult;
import io.flowdoc.core.document.WorkflowDocument;
import io.flowdoc.serialization.YamlDocumentCodec;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import picocli.CommandLine.Option;

/// Base class for all Flowdoc CLI commands.
///
/// Owns the banner display, logging setup and the {@link #run()} / {@link #execute()}
/// contract. Subclasses provide command-specific options and implement {@link #execute()}.
///
/// ### Engine Resolution
/// The engine is created on first use with the YAML codec, credentials from the
/// environment and every text generator provider found on the classpath. Commands
/// that never generate text therefore run without any API key.
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see ValidateCommand
/// @see DiffCommand
/// @see DescribeCommand
public abstract class FlowdocCommand implements Runnable {

    private static final String LOGGING_CONFIG = "/logging.properties";

    private static final String[] BANNER = {
        "",
        "   __ _                   _",
        "  / _| | _____      ____| | ___   ___",
        " | |_| |/ _ \\ \\ /\\ / / _` |/ _ \\ / __|",
        " |  _| | (_) \\ V  V / (_| | (_) | (__",
        " |_| |_|\\___/ \\_/\\_/ \\__,_|\\___/ \\___|",
        "",
        " The Workflow Document Engine",
        ""
    };

    @Option(
            names = {"-v", "--verbose"},
            description = "Log engine activity to stderr")
    protected boolean verbose;

    private FlowdocEngine engine;

    @Override
    public final void run() {
        configureLogging(verbose);
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        execute();
    }

    protected abstract void execute();

    /// Returns whether the banner is printed before the command output.
    ///
    /// Commands that emit machine-readable output override this to keep stdout clean.
    protected boolean showBanner() {
        return true;
    }

    /// Returns the engine, creating it on first use.
    protected FlowdocEngine getEngine() {
        if (engine == null) {
            engine =
                    FlowdocFactory.builder()
                            .codec(new YamlDocumentCodec())
                            .credentials(FlowdocFactory.loadCredentialsFromEnvironment())
                            .discoverProviders()
                            .build();
        }
        return engine;
    }

    /// Reads a file as UTF-8 text.
    ///
    /// @param path file to read, not null
    /// @return file content, never null
    /// @throws DocumentLoadException if the file is missing or unreadable
    protected String readText(Path path) throws DocumentLoadException {
        if (!Files.isRegularFile(path)) {
            throw new DocumentLoadException("File not found: " + path);
        }
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new DocumentLoadException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    /// Reads and parses a document file.
    ///
    /// @param path file to read, not null
    /// @return parsed document, never null
    /// @throws DocumentLoadException if the file is unreadable or does not parse
    protected WorkflowDocument loadDocument(Path path) throws DocumentLoadException {
        ParseResult result = getEngine().getParser().parse(readText(path));
        if (result instanceof ParseResult.Failed failed) {
            throw new DocumentLoadException(path + ": " + failed.error().message());
        }
        return result.document().orElseThrow();
    }

    /// Writes text to a file, or to stdout when no file is given.
    ///
    /// @param text content to write, not null
    /// @param output target file, may be null
    /// @throws DocumentLoadException if the file cannot be written
    protected void emit(String text, Path output) throws DocumentLoadException {
        if (output == null) {
            System.out.println(text);
            return;
        }
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, text);
        } catch (IOException e) {
            throw new DocumentLoadException("Cannot write " + output + ": " + e.getMessage(), e);
        }
        System.out.println(" [OK] Written to " + output);
    }

    private static void configureLogging(boolean verbose) {
        try (InputStream in = FlowdocCommand.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println(" [WARN] Cannot load logging configuration: " + e.getMessage());
        }
        if (verbose) {
            Logger root = Logger.getLogger("io.flowdoc");
            root.setLevel(Level.FINE);
            for (var handler : Logger.getLogger("").getHandlers()) {
                handler.setLevel(Level.FINE);
            }
        }
    }
}

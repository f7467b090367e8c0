package org.pylexer.cli.commands;

import com.typesafe.config.Config;
import org.pylexer.cli.CommandLineInterface;
import org.pylexer.cli.output.OutputFormat;
import org.pylexer.cli.output.TokenPrinter;
import org.pylexer.diagnostics.DiagnosticsEngine;
import org.pylexer.lexer.Lexer;
import org.pylexer.lexer.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "tokenize", description = "Prints the tokens of a source file, one per line.")
public class TokenizeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenizeCommand.class);

    /** Exit code when the file could not be read. */
    static final int EXIT_IO_ERROR = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", description = "The source file to tokenize.")
    private File file;

    @Option(names = {"-f", "--format"}, description = "Output format: ${COMPLETION-CANDIDATES} (default from configuration).")
    private OutputFormat format;

    @Option(names = {"-e", "--encoding"}, description = "Source file encoding (default from configuration).")
    private String encoding;

    @Option(names = {"--no-errors"}, description = "Omit lexer errors from the output.")
    private boolean hideErrors;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final Config config = parent.getConfig();
        final OutputFormat outputFormat = format != null
                ? format
                : config.getEnum(OutputFormat.class, "pylexer.output.format");
        final Charset charset = resolveCharset(encoding != null ? encoding : config.getString("pylexer.input.encoding"));
        final boolean showErrors = !hideErrors && config.getBoolean("pylexer.output.show-errors");

        final String source;
        try {
            source = Files.readString(file.toPath(), charset);
        } catch (IOException e) {
            LOGGER.error("Failed to read {}: {}", file, e.getMessage());
            spec.commandLine().getErr().println("Cannot read " + file + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        final List<ScanResult> results = new ArrayList<>();
        new Lexer(source, file.getName()).forEachRemaining(result -> {
            results.add(result);
            if (result.isError()) {
                diagnostics.report(result.error(), file.getName(), result.line());
            }
        });
        LOGGER.info("Tokenized {}: {} items, {} errors", file.getName(), results.size(), diagnostics.errorCount());

        new TokenPrinter(outputFormat, showErrors).print(results, spec.commandLine().getOut());
        if (diagnostics.hasErrors()) {
            spec.commandLine().getErr().println(diagnostics.summary());
            return 1;
        }
        return 0;
    }

    private Charset resolveCharset(final String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Unsupported encoding: " + name, e);
        }
    }
}

package org.corvid.cli.commands;

import org.corvid.cli.CommandLineInterface;
import org.corvid.compiler.api.CompilationException;
import org.corvid.compiler.diagnostics.DiagnosticReporter;
import org.corvid.compiler.diagnostics.normalize.ErrorPrefix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
    name = "normalize",
    description = "Turns a raw parser failure into the diagnostic the compiler would raise."
)
public class NormalizeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NormalizeCommand.class);

    @Option(names = {"-f", "--file"}, description = "File the failure occurred in (default: nofile)")
    private String file = "nofile";

    @Option(names = {"-l", "--line"}, description = "Line of the failure (default: none)")
    private Integer line;

    @Option(names = {"-p", "--prefix"}, required = true, description = "Error text reported by the parser")
    private String prefix;

    @Option(names = {"-s", "--suffix"}, description = "Text following the token; the token is inserted between prefix and suffix")
    private String suffix;

    @Option(names = {"-t", "--token"}, description = "Offending token, empty if the input ended (default: empty)")
    private String token = "";

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final DiagnosticReporter reporter = DiagnosticReporter.create(parent.getDiagnosticsSettings(), null);
        final ErrorPrefix errorPrefix = suffix == null ? ErrorPrefix.of(prefix) : ErrorPrefix.surrounding(prefix, suffix);
        try {
            reporter.parseError(line, file, errorPrefix, token);
        } catch (CompilationException e) {
            LOGGER.debug("Normalized failure in {} to {}", file, e.kind());
            spec.commandLine().getOut().println("** (" + e.kind().displayName() + ") " + e.getMessage());
            spec.commandLine().getOut().flush();
            return 1;
        }
        throw new IllegalStateException("Parse error was not raised");
    }
}

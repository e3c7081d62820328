package org.corvid.cli.commands;

import org.corvid.cli.CommandLineInterface;
import org.corvid.compiler.diagnostics.DiagnosticReporter;
import org.corvid.compiler.diagnostics.WarningCollector;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
    name = "warn",
    description = "Prints a compiler warning, with a location if a file is given."
)
public class WarnCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, description = "File the warning refers to")
    private String file;

    @Option(names = {"-l", "--line"}, description = "Line the warning refers to (default: none)")
    private Integer line;

    @Parameters(index = "0", description = "Warning text")
    private String text;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        if (line != null && file == null) {
            throw new ParameterException(spec.commandLine(), "--line requires --file");
        }
        final WarningCollector collector = new WarningCollector();
        final DiagnosticReporter reporter = DiagnosticReporter.create(parent.getDiagnosticsSettings(), collector);
        if (file != null) {
            reporter.warn(line, file, text);
        } else {
            reporter.warn(text);
        }
        spec.commandLine().getOut().println(collector.warningCount() + " warning(s) reported");
        spec.commandLine().getOut().flush();
        return 0;
    }
}

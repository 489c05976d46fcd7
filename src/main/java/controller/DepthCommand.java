package controller;

import model.ReportOptions;
import model.Stat;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import utils.ReportFormat;
import utils.SourceParseException;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

@Command(
        name = "javadepth",
        mixinStandardHelpOptions = true,
        version = "javadepth 1.0",
        description = "Calculate maximum depth of Java methods and constructors.",
        footer = {
                "",
                "The output fields for each line are:",
                "<depth> <package> <function> <file:row:column>"
        }
)
public class DepthCommand implements Callable<Integer> {

    private static final Logger LOGGER = Logger.getLogger(DepthCommand.class.getName());

    @Spec
    private CommandSpec spec;

    @Option(names = {"-over", "--over"}, paramLabel = "N", defaultValue = "0",
            description = "Show functions with depth > N only and return exit code 1 if the output is non-empty.")
    private int over;

    @Option(names = {"-top", "--top"}, paramLabel = "N", defaultValue = "-1",
            description = "Show the top N deepest functions only.")
    private int top;

    @Option(names = {"-avg", "--avg"},
            description = "Show the average depth over all functions, not depending on whether -over or -top are set.")
    private boolean avg;

    @Option(names = {"-format", "--format"}, paramLabel = "FORMAT", defaultValue = "text",
            description = "Output format: text, csv or json (default: ${DEFAULT-VALUE}).")
    private String format;

    @Option(names = {"-v", "--verbose"}, description = "Log analyzed files to stderr.")
    private boolean verbose;

    @Parameters(paramLabel = "<Java file or directory>", arity = "1..*",
            description = "Files or directories to analyze.")
    private List<Path> paths;

    @Override
    public Integer call() throws IOException {
        if (verbose) {
            Logger.getLogger("").setLevel(Level.INFO);
        }
        ReportOptions options = buildOptions();

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        List<Stat> stats;
        try {
            stats = new SourceAnalyzer().analyze(paths);
        } catch (SourceParseException e) {
            LOGGER.log(Level.FINE, "Analysis aborted", e);
            err.println(e.getMessage());
            err.flush();
            return 1;
        }

        StatReporter reporter = new StatReporter(options);
        int written = reporter.report(stats, out);
        return reporter.isThresholdViolated(written) ? 1 : 0;
    }

    ReportOptions buildOptions() {
        if (top < ReportOptions.NO_LIMIT) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Invalid value for option '-top': " + top + " (must be >= 0)");
        }
        ReportFormat reportFormat;
        try {
            reportFormat = ReportFormat.fromString(format);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
        return new ReportOptions(top, over, avg, reportFormat);
    }
}

package com.codesurvey;

import com.codesurvey.cli.ReportCommand;
import com.codesurvey.cli.RunCommand;
import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;

/**
 * Main CLI entry point for CodeSurvey.
 *
 * <p>CodeSurvey samples repositories from configured sources, counts feature occurrences
 * with configured analyzers, and keeps the results in a resumable SQLite database.
 *
 * <p>The verbosity options are inherited by every subcommand and applied to the Logback
 * root logger before the selected command executes.
 *
 * <pre>{@code
 * codesurvey run -c surveys/python --max-repos 20 -v
 * codesurvey report -c surveys/python --tree
 * }</pre>
 */
@Command(
    name = "codesurvey",
    mixinStandardHelpOptions = true,
    version = "CodeSurvey " + CodeSurveyCLI.VERSION,
    description = "Survey code repositories for the occurrence of features",
    subcommands = {
        RunCommand.class,
        ReportCommand.class
    }
)
public class CodeSurveyCLI implements Runnable {

    public static final String VERSION = "1.0.0-SNAPSHOT";

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Log at DEBUG level", scope = CommandLine.ScopeType.INHERIT)
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Only log errors; wins over --verbose",
        scope = CommandLine.ScopeType.INHERIT)
    private boolean quiet;

    /**
     * Builds the command line used by {@link #main(String[])}: the command tree plus an
     * execution strategy that configures logging before running the last parsed command.
     *
     * @return command line ready for {@link CommandLine#execute(String...)}
     */
    public static CommandLine commandLine() {
        CodeSurveyCLI cli = new CodeSurveyCLI();
        return new CommandLine(cli).setExecutionStrategy(parseResult -> cli.execute(parseResult));
    }

    private int execute(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /** Prints usage when no subcommand is given. */
    @Override
    public void run() {
        if (!quiet) {
            spec.commandLine().usage(spec.commandLine().getOut());
        }
    }

    /**
     * Sets the Logback root level: ERROR when quiet, DEBUG when verbose, INFO otherwise.
     */
    public void configureLogging() {
        Level level = quiet ? Level.ERROR : verbose ? Level.DEBUG : Level.INFO;
        ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME)).setLevel(level);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}

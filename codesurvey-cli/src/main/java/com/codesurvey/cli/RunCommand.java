package com.codesurvey.cli;

import com.codesurvey.core.config.ConfigLoader;
import com.codesurvey.core.config.SurveyConfig;
import com.codesurvey.core.config.SurveyFactory;
import com.codesurvey.core.exception.SurveyConfigurationException;
import com.codesurvey.core.exception.SurveyException;
import com.codesurvey.core.exception.SurveyInterruptedException;
import com.codesurvey.core.survey.CancellationToken;
import com.codesurvey.core.survey.CodeSurvey;
import com.codesurvey.core.survey.RunOptions;
import com.codesurvey.core.survey.SurveyRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command to run the survey described by a configuration file.
 *
 * <p>Ctrl-C cancels the run; in-flight repositories are cleaned up before the JVM exits.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codesurvey run -c codesurvey.yaml --max-repos 10 --max-codes 500
 * }</pre>
 */
@Command(
    name = "run",
    description = "Run a survey and store its results",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIGURATION = 2;
    static final int EXIT_INTERRUPTED = 130;

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file, or directory holding codesurvey.yaml (default: codesurvey.yaml)"
    )
    private Path configPath = Path.of(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--max-repos"}, description = "Stop after this many repositories (overrides config)")
    private Integer maxRepos;

    @Option(names = {"--max-codes"}, description = "Stop after this many analyzed files (overrides config)")
    private Integer maxCodes;

    @Override
    public Integer call() {
        CancellationToken token = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            token.cancel();
            try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "codesurvey-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            return runSurvey(token);
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }
    }

    int runSurvey(CancellationToken token) {
        SurveyConfig config = ConfigLoader.load(configPath);
        try (CodeSurvey survey = SurveyFactory.create(config)) {
            SurveyRunSummary summary = survey.run(runOptions(config, token));
            System.out.printf("Completed %d repos and %d files (%d failures)%n",
                summary.completedRepoCount(), summary.completedCodeCount(), summary.failureCount());
            summary.featureRepoCounts().forEach((feature, repos) ->
                System.out.printf("  %s: found in %d repos%n", feature, repos));
            return 0;
        } catch (SurveyConfigurationException e) {
            log.error("Invalid configuration in {}: {}", configPath, e.getMessage());
            System.err.println("✗ Invalid configuration: " + e.getMessage());
            return EXIT_CONFIGURATION;
        } catch (SurveyInterruptedException e) {
            log.warn("Survey was interrupted");
            System.err.println("✗ Survey interrupted");
            return EXIT_INTERRUPTED;
        } catch (SurveyException e) {
            log.error("Survey failed", e);
            System.err.println("✗ Survey failed: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Survey halted by failure", e);
            System.err.println("✗ Survey halted: " + e);
            return EXIT_FAILURE;
        }
    }

    private RunOptions runOptions(SurveyConfig config, CancellationToken token) {
        RunOptions options = SurveyFactory.runOptions(config).withCancellationToken(token);
        if (maxRepos != null) {
            options = options.withMaxRepos(maxRepos);
        }
        if (maxCodes != null) {
            options = options.withMaxCodes(maxCodes);
        }
        return options;
    }

    private static void removeShutdownHook(Thread shutdownHook) {
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down, keeping shutdown hook");
        }
    }
}

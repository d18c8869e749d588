package com.taskweave.dispatch.cli;

import com.taskweave.core.model.CancellationToken;
import com.taskweave.core.model.JobCallbacks;
import com.taskweave.core.model.JobConfigOverrides;
import com.taskweave.core.model.JobContext;
import com.taskweave.core.model.SubTask;
import com.taskweave.jobs.digest.ChunkDigest;
import com.taskweave.jobs.digest.DigestRequest;
import com.taskweave.jobs.digest.DigestService;
import com.taskweave.jobs.digest.DocumentDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: taskweave digest &lt;file&gt;
 * <p>
 * Summarizes a text file. Large files are split into chunks that are digested in
 * concurrent waves; progress is printed as sub-tasks start and finish.
 */
@Command(name = "digest", mixinStandardHelpOptions = true, description = "Summarize a text document")
@Component
public class DigestCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DigestCommand.class);

    @Parameters(index = "0", description = "Path of the text file to summarize")
    private Path file;

    @Option(names = {"--title", "-t"}, description = "Document title (default: file name)")
    private String title;

    @Option(names = {"--concurrency", "-c"}, description = "Maximum sub-tasks in flight")
    private Integer concurrency;

    @Option(names = {"--retries", "-r"}, description = "Extra attempts per sub-task")
    private Integer retries;

    @Option(names = {"--profile", "-p"}, description = "Execution profile")
    private String profile;

    @Option(names = "--fail-fast", description = "Abort as soon as a sub-task exhausts its retries")
    private boolean failFast;

    private final DigestService digestService;

    public DigestCommand(DigestService digestService) {
        this.digestService = digestService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String invalid = validateOptions();
        if (invalid != null) {
            ConsoleOutput.error(invalid);
            return 2;
        }

        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 2;
        }
        if (text.isBlank()) {
            ConsoleOutput.error(file + " is empty");
            return 2;
        }

        var overrides = JobConfigOverrides.builder();
        if (concurrency != null) overrides.concurrencyLimit(concurrency);
        if (retries != null) overrides.retryBudget(retries);
        if (profile != null) overrides.executionProfile(profile);
        if (failFast) overrides.continueOnError(false);

        var token = CancellationToken.create();
        Thread shutdownHook = new Thread(token::cancel, "taskweave-cancel");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        String documentTitle = title != null ? title : file.getFileName().toString();
        ConsoleOutput.info("Digesting " + documentTitle + " (" + text.length() + " chars)");

        DocumentDigest digest;
        try {
            digest = digestService.digest(
                    new DigestRequest(documentTitle, text),
                    JobContext.of(System.getProperty("user.name", "cli"), token),
                    progressPrinter(),
                    overrides.build());
        } catch (Exception e) {
            ConsoleOutput.error("Digest failed: " + rootCauseMessage(e));
            return 1;
        } finally {
            removeHook(shutdownHook);
        }

        ConsoleOutput.digest(digest);
        if (token.isCancellationRequested()) {
            ConsoleOutput.info("Cancelled, result is partial.");
        } else {
            ConsoleOutput.success("Digest complete.");
        }
        return 0;
    }

    private String validateOptions() {
        if (concurrency != null && concurrency < 1) {
            return "--concurrency must be at least 1, was " + concurrency;
        }
        if (retries != null && retries < 0) {
            return "--retries must not be negative, was " + retries;
        }
        if (profile != null && profile.isBlank()) {
            return "--profile must not be blank";
        }
        return null;
    }

    private static JobCallbacks<ChunkDigest> progressPrinter() {
        return new JobCallbacks<>() {
            @Override
            public void onJobStart(int totalTasks) {
                ConsoleOutput.jobStarted(totalTasks);
            }

            @Override
            public void onSubTaskStart(SubTask<ChunkDigest> task, int index, int total) {
                ConsoleOutput.subTaskStarted(task.name(), index, total);
            }

            @Override
            public void onSubTaskComplete(SubTask<ChunkDigest> task, ChunkDigest output, int index) {
                ConsoleOutput.subTaskProgress(task.name(), true, output.keyPoints().size() + " key points");
            }

            @Override
            public void onSubTaskError(SubTask<ChunkDigest> task, Throwable error, int index) {
                ConsoleOutput.subTaskProgress(task.name(), false, error.getMessage());
            }
        };
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM shutting down, cancel hook already running");
        }
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

package github.sarthakdev143.photo_framer.cli;

import github.sarthakdev143.photo_framer.config.PhotoFramerProperties;
import github.sarthakdev143.photo_framer.model.BatchRunOutcome;
import github.sarthakdev143.photo_framer.model.BatchRunRequest;
import github.sarthakdev143.photo_framer.model.BatchRunStatus;
import github.sarthakdev143.photo_framer.model.FileError;
import github.sarthakdev143.photo_framer.model.RunStatistics;
import github.sarthakdev143.photo_framer.scheduler.BatchListener;
import github.sarthakdev143.photo_framer.service.BatchProcessingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

@Component
@Order(10)
@ConditionalOnProperty(name = "photo-framer.cli.enabled", havingValue = "true", matchIfMissing = true)
public class BatchCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_STOPPED = 2;
    static final int EXIT_FATAL = 3;

    private static final Logger logger = LoggerFactory.getLogger(BatchCommandLineRunner.class);
    private static final String USAGE = "Usage: --input=<dir> --output=<dir> [--concurrency=N]";

    private final BatchProcessingService batchProcessingService;
    private final PhotoFramerProperties properties;
    private int exitCode = EXIT_OK;

    public BatchCommandLineRunner(BatchProcessingService batchProcessingService, PhotoFramerProperties properties) {
        this.batchProcessingService = batchProcessingService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        Optional<String> input = option(args, "input");
        if (input.isEmpty()) {
            logger.info("No input directory given, nothing to do. {}", USAGE);
            return;
        }
        Optional<String> output = option(args, "output");
        if (output.isEmpty()) {
            logger.error("Missing --output. {}", USAGE);
            exitCode = EXIT_FATAL;
            return;
        }

        Integer concurrency;
        try {
            concurrency = option(args, "concurrency").map(Integer::valueOf).orElse(null);
        } catch (NumberFormatException e) {
            logger.error("--concurrency must be a whole number. {}", USAGE);
            exitCode = EXIT_FATAL;
            return;
        }

        String runId;
        try {
            runId = batchProcessingService.submitRun(
                    new BatchRunRequest(Path.of(input.get()), Path.of(output.get()), concurrency),
                    properties.toProcessingConfig(),
                    new ProgressLogger());
        } catch (IllegalArgumentException e) {
            logger.error("Invalid run request: {}", e.getMessage());
            exitCode = EXIT_FATAL;
            return;
        }

        BatchRunStatus status = awaitRun(runId);
        exitCode = exitCodeFor(status.outcome());
        logSummary(status);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private BatchRunStatus awaitRun(String runId) throws InterruptedException {
        long pollMillis = Math.max(10L, properties.getBatch().getStatsPollInterval().toMillis());
        try {
            while (true) {
                BatchRunStatus status = batchProcessingService.getRunStatus(runId)
                        .orElseThrow(() -> new IllegalStateException("Run " + runId + " is not registered."));
                if (status.isTerminal()) {
                    return status;
                }
                Thread.sleep(pollMillis);
            }
        } catch (InterruptedException e) {
            batchProcessingService.cancelRun(runId);
            throw e;
        }
    }

    private void logSummary(BatchRunStatus status) {
        RunStatistics statistics = status.statistics();
        BatchRunOutcome outcome = status.outcome() == null ? BatchRunOutcome.FATAL : status.outcome();
        switch (outcome) {
            case SUCCEEDED -> logger.info(
                    "All {} photos processed into {}",
                    statistics.completed(),
                    status.outputDir());
            case COMPLETED_WITH_FAILURES -> {
                logger.warn(
                        "Completed with {} failures ({} of {} photos written to {})",
                        statistics.failed(),
                        statistics.completed(),
                        statistics.total(),
                        status.outputDir());
                List<FileError> errors = status.errors();
                errors.forEach(error -> logger.warn("  {}: {}", error.fileName(), error.message()));
            }
            case STOPPED -> logger.warn(
                    "Run stopped: completed={} failed={} skipped={}",
                    statistics.completed(),
                    statistics.failed(),
                    statistics.queued());
            case FATAL -> logger.error("Run could not complete: {}", status.message());
        }
    }

    static int exitCodeFor(BatchRunOutcome outcome) {
        if (outcome == null) {
            return EXIT_FATAL;
        }
        return switch (outcome) {
            case SUCCEEDED -> EXIT_OK;
            case COMPLETED_WITH_FAILURES -> EXIT_FAILURES;
            case STOPPED -> EXIT_STOPPED;
            case FATAL -> EXIT_FATAL;
        };
    }

    private static Optional<String> option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static final class ProgressLogger implements BatchListener {

        @Override
        public void onProgress(int percent) {
            logger.info("Progress {}%", percent);
        }

        @Override
        public void onFileError(FileError error) {
            logger.warn("Failed {}: {}", error.fileName(), error.message());
        }
    }
}

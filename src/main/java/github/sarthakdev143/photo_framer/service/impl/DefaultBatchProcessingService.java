package github.sarthakdev143.photo_framer.service.impl;

import github.sarthakdev143.photo_framer.config.PhotoFramerProperties;
import github.sarthakdev143.photo_framer.model.BatchRunOutcome;
import github.sarthakdev143.photo_framer.model.BatchRunRequest;
import github.sarthakdev143.photo_framer.model.BatchRunState;
import github.sarthakdev143.photo_framer.model.BatchRunStatus;
import github.sarthakdev143.photo_framer.model.FileError;
import github.sarthakdev143.photo_framer.model.ProcessingConfig;
import github.sarthakdev143.photo_framer.model.RunStatistics;
import github.sarthakdev143.photo_framer.processor.ProcessorChain;
import github.sarthakdev143.photo_framer.processor.ProcessorChainBuilder;
import github.sarthakdev143.photo_framer.scheduler.BatchJob;
import github.sarthakdev143.photo_framer.scheduler.BatchListener;
import github.sarthakdev143.photo_framer.scheduler.BatchScheduler;
import github.sarthakdev143.photo_framer.service.BatchProcessingService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Service
public class DefaultBatchProcessingService implements BatchProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultBatchProcessingService.class);

    static final String REJECTED_MESSAGE = "Run rejected: too many batch runs are already queued.";

    private final PhotoFramerProperties properties;
    private final ProcessorChainBuilder chainBuilder;
    private final TaskExecutor taskExecutor;
    private final Map<String, BatchRunStatus> runs = new ConcurrentHashMap<>();
    private final Map<String, BatchScheduler> activeSchedulers = new ConcurrentHashMap<>();
    private final Counter runsStartedCounter;
    private final Counter filesCompletedCounter;
    private final Counter filesFailedCounter;
    private final Counter runsStoppedCounter;
    private final Counter runsFatalCounter;

    public DefaultBatchProcessingService(
            PhotoFramerProperties properties,
            ProcessorChainBuilder chainBuilder,
            @Qualifier("batchCoordinatorExecutor") TaskExecutor taskExecutor,
            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.chainBuilder = chainBuilder;
        this.taskExecutor = taskExecutor;
        this.runsStartedCounter = meterRegistry.counter("photo_framer.runs.started");
        this.filesCompletedCounter = meterRegistry.counter("photo_framer.files.completed");
        this.filesFailedCounter = meterRegistry.counter("photo_framer.files.failed");
        this.runsStoppedCounter = meterRegistry.counter("photo_framer.runs.stopped");
        this.runsFatalCounter = meterRegistry.counter("photo_framer.runs.fatal");
    }

    @Override
    public String submitRun(BatchRunRequest request) {
        return submitRun(request, properties.toProcessingConfig(), BatchListener.NO_OP);
    }

    @Override
    public String submitRun(BatchRunRequest request, ProcessingConfig config, BatchListener listener) {
        if (request == null || request.inputDir() == null) {
            throw new IllegalArgumentException("An input directory is required.");
        }
        if (request.outputDir() == null) {
            throw new IllegalArgumentException("An output directory is required.");
        }
        if (config == null) {
            throw new IllegalArgumentException("A processing configuration is required.");
        }

        int concurrency = request.concurrency() != null
                ? request.concurrency()
                : properties.getBatch().getConcurrency();
        ProcessorChain chain = chainBuilder.build(config);
        BatchJob job = new BatchJob(
                request.inputDir(),
                request.outputDir(),
                chain,
                config.quality(),
                config.useEquivalentFocalLength(),
                concurrency);

        String runId = UUID.randomUUID().toString();
        BatchScheduler scheduler = new BatchScheduler(properties.getBatch().getStatsPollInterval());
        Instant now = Instant.now();
        runs.put(runId, new BatchRunStatus(
                runId,
                BatchRunState.QUEUED,
                "Run queued.",
                now,
                now,
                job.inputDir(),
                job.outputDir(),
                RunStatistics.initial(0),
                0,
                List.of(),
                null));
        activeSchedulers.put(runId, scheduler);

        logger.info(
                "Accepted batch run {} input={} output={} concurrency={} chain={}",
                runId,
                job.inputDir(),
                job.outputDir(),
                concurrency,
                chain.names());

        BatchListener safeListener = listener == null ? BatchListener.NO_OP : listener;
        runsStartedCounter.increment();
        try {
            taskExecutor.execute(() -> executeRun(runId, scheduler, job, safeListener));
        } catch (TaskRejectedException e) {
            activeSchedulers.remove(runId);
            runsFatalCounter.increment();
            logger.error("Batch run {} rejected by the coordinator executor", runId, e);
            updateRun(runId, current -> withOutcome(
                    current,
                    BatchRunState.FAILED,
                    REJECTED_MESSAGE,
                    BatchRunOutcome.FATAL));
            safeListener.onFatalError(REJECTED_MESSAGE, e);
        }
        return runId;
    }

    @Override
    public Optional<BatchRunStatus> getRunStatus(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public boolean cancelRun(String runId) {
        BatchScheduler scheduler = activeSchedulers.get(runId);
        if (scheduler == null) {
            return false;
        }
        scheduler.cancel();
        logger.info("Cancellation requested for batch run {}", runId);
        return true;
    }

    @PreDestroy
    public void cancelActiveRuns() {
        if (!activeSchedulers.isEmpty()) {
            logger.info("Stopping {} active batch runs", activeSchedulers.size());
        }
        activeSchedulers.values().forEach(BatchScheduler::cancel);
    }

    private void executeRun(String runId, BatchScheduler scheduler, BatchJob job, BatchListener listener) {
        updateRun(runId, current -> withState(current, BatchRunState.RUNNING, "Processing photos."));
        try {
            BatchRunOutcome outcome = scheduler.run(job, new StatusRecordingListener(runId, listener));
            markRunEnded(runId, outcome);
            logger.info("Batch run {} ended with outcome {}", runId, outcome);
        } catch (Exception e) {
            runsFatalCounter.increment();
            logger.error("Batch run {} failed", runId, e);
            updateRun(runId, current -> withOutcome(
                    current,
                    BatchRunState.FAILED,
                    "Batch run failed. Check logs.",
                    BatchRunOutcome.FATAL));
        } finally {
            activeSchedulers.remove(runId);
        }
    }

    private void markRunEnded(String runId, BatchRunOutcome outcome) {
        switch (outcome) {
            case SUCCEEDED -> updateRun(runId, current -> withOutcome(
                    current, BatchRunState.FINISHED, "All photos processed successfully.", outcome));
            case COMPLETED_WITH_FAILURES -> updateRun(runId, current -> withOutcome(
                    current,
                    BatchRunState.FINISHED,
                    "Completed with " + current.statistics().failed() + " failures.",
                    outcome));
            case STOPPED -> {
                runsStoppedCounter.increment();
                updateRun(runId, current -> withOutcome(current, BatchRunState.STOPPED, "Run stopped.", outcome));
            }
            case FATAL -> {
                runsFatalCounter.increment();
                updateRun(runId, current -> withOutcome(
                        current,
                        BatchRunState.FAILED,
                        current.message() == null ? "Run could not start." : current.message(),
                        outcome));
            }
        }
    }

    private void updateRun(String runId, UnaryOperator<BatchRunStatus> update) {
        runs.computeIfPresent(runId, (ignored, current) -> update.apply(current));
    }

    private static BatchRunStatus withState(BatchRunStatus current, BatchRunState state, String message) {
        return new BatchRunStatus(
                current.runId(),
                state,
                message,
                current.createdAt(),
                Instant.now(),
                current.inputDir(),
                current.outputDir(),
                current.statistics(),
                current.progressPercent(),
                current.errors(),
                current.outcome());
    }

    private static BatchRunStatus withOutcome(
            BatchRunStatus current,
            BatchRunState state,
            String message,
            BatchRunOutcome outcome) {
        return new BatchRunStatus(
                current.runId(),
                state,
                message,
                current.createdAt(),
                Instant.now(),
                current.inputDir(),
                current.outputDir(),
                current.statistics(),
                current.progressPercent(),
                current.errors(),
                outcome);
    }

    private final class StatusRecordingListener implements BatchListener {

        private final String runId;
        private final BatchListener delegate;

        private StatusRecordingListener(String runId, BatchListener delegate) {
            this.runId = runId;
            this.delegate = delegate;
        }

        @Override
        public void onStatistics(RunStatistics statistics) {
            updateRun(runId, current -> new BatchRunStatus(
                    current.runId(),
                    current.state(),
                    current.message(),
                    current.createdAt(),
                    Instant.now(),
                    current.inputDir(),
                    current.outputDir(),
                    statistics,
                    current.progressPercent(),
                    current.errors(),
                    current.outcome()));
            delegate.onStatistics(statistics);
        }

        @Override
        public void onProgress(int percent) {
            updateRun(runId, current -> new BatchRunStatus(
                    current.runId(),
                    current.state(),
                    current.message(),
                    current.createdAt(),
                    Instant.now(),
                    current.inputDir(),
                    current.outputDir(),
                    current.statistics(),
                    percent,
                    current.errors(),
                    current.outcome()));
            delegate.onProgress(percent);
        }

        @Override
        public void onFileCompleted(Path file) {
            filesCompletedCounter.increment();
            delegate.onFileCompleted(file);
        }

        @Override
        public void onFileError(FileError error) {
            filesFailedCounter.increment();
            updateRun(runId, current -> {
                List<FileError> errors = new ArrayList<>(current.errors());
                errors.add(error);
                return new BatchRunStatus(
                        current.runId(),
                        current.state(),
                        current.message(),
                        current.createdAt(),
                        Instant.now(),
                        current.inputDir(),
                        current.outputDir(),
                        current.statistics(),
                        current.progressPercent(),
                        errors,
                        current.outcome());
            });
            delegate.onFileError(error);
        }

        @Override
        public void onFinished(RunStatistics statistics) {
            delegate.onFinished(statistics);
        }

        @Override
        public void onStopped(RunStatistics statistics) {
            delegate.onStopped(statistics);
        }

        @Override
        public void onFatalError(String message, Throwable cause) {
            updateRun(runId, current -> withState(current, current.state(), message));
            delegate.onFatalError(message, cause);
        }
    }
}

package github.sarthakdev143.photo_framer.service.impl;

import github.sarthakdev143.photo_framer.config.PhotoFramerProperties;
import github.sarthakdev143.photo_framer.image.TestImages;
import github.sarthakdev143.photo_framer.model.BatchRunOutcome;
import github.sarthakdev143.photo_framer.model.BatchRunRequest;
import github.sarthakdev143.photo_framer.model.BatchRunState;
import github.sarthakdev143.photo_framer.model.BatchRunStatus;
import github.sarthakdev143.photo_framer.model.ProcessingConfig;
import github.sarthakdev143.photo_framer.model.RunStatistics;
import github.sarthakdev143.photo_framer.processor.LayoutRegistry;
import github.sarthakdev143.photo_framer.processor.LogoRepository;
import github.sarthakdev143.photo_framer.processor.ProcessorChainBuilder;
import github.sarthakdev143.photo_framer.scheduler.BatchListener;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DefaultBatchProcessingServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private BatchListener listener;

    private final List<Runnable> queuedTasks = new ArrayList<>();
    private SimpleMeterRegistry meterRegistry;
    private PhotoFramerProperties properties;
    private ProcessorChainBuilder chainBuilder;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new PhotoFramerProperties();
        properties.getLayout().setType("watermark");
        chainBuilder = new ProcessorChainBuilder(new LayoutRegistry(LogoRepository.empty()));
    }

    @Test
    void submitRunCompletesSuccessfully() throws Exception {
        DefaultBatchProcessingService service = directService();
        Path input = inputWith(2);

        String runId = service.submitRun(new BatchRunRequest(input, tempDir.resolve("out"), null));
        BatchRunStatus status = service.getRunStatus(runId).orElseThrow();

        assertThat(status.state()).isEqualTo(BatchRunState.FINISHED);
        assertThat(status.outcome()).isEqualTo(BatchRunOutcome.SUCCEEDED);
        assertThat(status.message()).isEqualTo("All photos processed successfully.");
        assertThat(status.statistics().completed()).isEqualTo(2);
        assertThat(status.progressPercent()).isEqualTo(100);
        assertThat(status.errors()).isEmpty();
        assertThat(tempDir.resolve("out/photo-0.jpg")).exists();
        assertThat(meterRegistry.counter("photo_framer.runs.started").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("photo_framer.files.completed").count()).isEqualTo(2.0);
    }

    @Test
    void submitRunRecordsFileFailures() throws Exception {
        DefaultBatchProcessingService service = directService();
        Path input = inputWith(2);
        TestImages.writeCorrupt(input.resolve("zz-broken.jpg"));

        String runId = service.submitRun(new BatchRunRequest(input, tempDir.resolve("out"), 2));
        BatchRunStatus status = service.getRunStatus(runId).orElseThrow();

        assertThat(status.state()).isEqualTo(BatchRunState.FINISHED);
        assertThat(status.outcome()).isEqualTo(BatchRunOutcome.COMPLETED_WITH_FAILURES);
        assertThat(status.message()).isEqualTo("Completed with 1 failures.");
        assertThat(status.errors()).singleElement()
                .satisfies(error -> assertThat(error.fileName()).isEqualTo("zz-broken.jpg"));
        assertThat(meterRegistry.counter("photo_framer.files.failed").count()).isEqualTo(1.0);
    }

    @Test
    void missingInputDirectoryMarksRunFailed() {
        DefaultBatchProcessingService service = directService();

        String runId = service.submitRun(new BatchRunRequest(tempDir.resolve("absent"), tempDir.resolve("out"), null));
        BatchRunStatus status = service.getRunStatus(runId).orElseThrow();

        assertThat(status.state()).isEqualTo(BatchRunState.FAILED);
        assertThat(status.outcome()).isEqualTo(BatchRunOutcome.FATAL);
        assertThat(status.message()).contains("does not exist");
        assertThat(meterRegistry.counter("photo_framer.runs.fatal").count()).isEqualTo(1.0);
    }

    @Test
    void cancelledQueuedRunEndsStopped() throws Exception {
        DefaultBatchProcessingService service = queuedService();
        Path input = inputWith(3);

        String runId = service.submitRun(new BatchRunRequest(input, tempDir.resolve("out"), 1));

        assertThat(service.getRunStatus(runId).orElseThrow().state()).isEqualTo(BatchRunState.QUEUED);
        assertThat(service.cancelRun(runId)).isTrue();

        queuedTasks.forEach(Runnable::run);
        BatchRunStatus status = service.getRunStatus(runId).orElseThrow();

        assertThat(status.state()).isEqualTo(BatchRunState.STOPPED);
        assertThat(status.outcome()).isEqualTo(BatchRunOutcome.STOPPED);
        assertThat(status.statistics().queued()).isEqualTo(3);
        assertThat(status.progressPercent()).isEqualTo(100);
        assertThat(meterRegistry.counter("photo_framer.runs.stopped").count()).isEqualTo(1.0);
        assertThat(service.cancelRun(runId)).isFalse();
    }

    @Test
    void cancelUnknownRunReturnsFalse() {
        DefaultBatchProcessingService service = directService();

        assertThat(service.cancelRun("missing")).isFalse();
        assertThat(service.getRunStatus("missing")).isEmpty();
    }

    @Test
    void submitRunForwardsEventsToListener() throws Exception {
        DefaultBatchProcessingService service = directService();
        Path input = inputWith(1);

        service.submitRun(
                new BatchRunRequest(input, tempDir.resolve("out"), 1),
                ProcessingConfig.builder().layoutType("square").quality(80).build(),
                listener);

        verify(listener).onFileCompleted(input.resolve("photo-0.jpg"));
        verify(listener).onProgress(100);
        verify(listener).onFinished(any(RunStatistics.class));
    }

    @Test
    void listenerFailureMarksRunFailed() throws Exception {
        DefaultBatchProcessingService service = directService();
        Path input = inputWith(1);
        doThrow(new IllegalStateException("listener broke")).when(listener).onFinished(any());

        String runId = service.submitRun(
                new BatchRunRequest(input, tempDir.resolve("out"), 1),
                ProcessingConfig.builder().build(),
                listener);
        BatchRunStatus status = service.getRunStatus(runId).orElseThrow();

        assertThat(status.state()).isEqualTo(BatchRunState.FAILED);
        assertThat(status.outcome()).isEqualTo(BatchRunOutcome.FATAL);
        assertThat(status.message()).isEqualTo("Batch run failed. Check logs.");
        verify(listener).onProgress(eq(100));
    }

    @Test
    void submitRunRejectsIncompleteRequests() {
        DefaultBatchProcessingService service = directService();

        assertThatThrownBy(() -> service.submitRun(new BatchRunRequest(null, tempDir, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("input");
        assertThatThrownBy(() -> service.submitRun(new BatchRunRequest(tempDir, null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("output");
        assertThatThrownBy(() -> service.submitRun(new BatchRunRequest(tempDir, tempDir, 0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("concurrency");
        assertThat(meterRegistry.counter("photo_framer.runs.started").count()).isZero();
    }

    @Test
    void rejectedRunIsMarkedFailedAndNotLeftQueued() throws Exception {
        TaskExecutor rejectingExecutor = task -> {
            throw new TaskRejectedException("Coordinator queue is full");
        };
        DefaultBatchProcessingService service =
                new DefaultBatchProcessingService(properties, chainBuilder, rejectingExecutor, meterRegistry);

        String runId = service.submitRun(
                new BatchRunRequest(inputWith(1), tempDir.resolve("out"), 1),
                ProcessingConfig.builder().layoutType("simple").build(),
                listener);
        BatchRunStatus status = service.getRunStatus(runId).orElseThrow();

        assertThat(status.state()).isEqualTo(BatchRunState.FAILED);
        assertThat(status.outcome()).isEqualTo(BatchRunOutcome.FATAL);
        assertThat(status.message()).isEqualTo(DefaultBatchProcessingService.REJECTED_MESSAGE);
        assertThat(service.cancelRun(runId)).isFalse();
        assertThat(meterRegistry.counter("photo_framer.runs.fatal").count()).isEqualTo(1.0);
        verify(listener).onFatalError(eq(DefaultBatchProcessingService.REJECTED_MESSAGE), any(TaskRejectedException.class));
    }

    @Test
    void shutdownCancelsActiveRuns() throws Exception {
        DefaultBatchProcessingService service = queuedService();
        String runId = service.submitRun(new BatchRunRequest(inputWith(2), tempDir.resolve("out"), 1));

        service.cancelActiveRuns();
        queuedTasks.forEach(Runnable::run);

        assertThat(service.getRunStatus(runId).orElseThrow().state()).isEqualTo(BatchRunState.STOPPED);
    }

    private DefaultBatchProcessingService directService() {
        TaskExecutor directExecutor = Runnable::run;
        return new DefaultBatchProcessingService(properties, chainBuilder, directExecutor, meterRegistry);
    }

    private DefaultBatchProcessingService queuedService() {
        TaskExecutor queuingExecutor = queuedTasks::add;
        return new DefaultBatchProcessingService(properties, chainBuilder, queuingExecutor, meterRegistry);
    }

    private Path inputWith(int count) throws IOException {
        Path input = Files.createDirectories(tempDir.resolve("in"));
        for (int i = 0; i < count; i++) {
            TestImages.writeJpeg(input.resolve("photo-" + i + ".jpg"), 120, 90);
        }
        return input;
    }
}

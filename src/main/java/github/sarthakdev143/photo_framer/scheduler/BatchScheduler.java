package github.sarthakdev143.photo_framer.scheduler;

import github.sarthakdev143.photo_framer.exception.RunSetupException;
import github.sarthakdev143.photo_framer.image.ImageContainer;
import github.sarthakdev143.photo_framer.image.ImageFiles;
import github.sarthakdev143.photo_framer.model.BatchRunOutcome;
import github.sarthakdev143.photo_framer.model.FileError;
import github.sarthakdev143.photo_framer.model.FileState;
import github.sarthakdev143.photo_framer.model.RunStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Runs one batch: lists the input directory once, then keeps at most {@code concurrency} files in
 * flight on a fixed worker pool, dispatching the next queued file as soon as a worker frees up.
 *
 * <p>The calling thread is the coordinator. It alone owns the pending queue and the counters and
 * is the only thread that calls the {@link BatchListener}. Workers only open, process, save and
 * close their own {@link ImageContainer}.
 *
 * <p>{@link #cancel()} is cooperative: nothing new is dispatched once it is observed, files already
 * in flight run to completion, and the run ends with {@link BatchListener#onStopped} instead of
 * {@link BatchListener#onFinished}. Interrupting the coordinator has the same effect; the interrupt
 * flag is restored once the in-flight files have reported. A scheduler runs a single batch.
 */
public class BatchScheduler {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);

    private static final Logger logger = LoggerFactory.getLogger(BatchScheduler.class);

    private final Duration pollInterval;
    private final LongSupplier nanoClock;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean started = new AtomicBoolean();

    public BatchScheduler() {
        this(DEFAULT_POLL_INTERVAL);
    }

    public BatchScheduler(Duration pollInterval) {
        this(pollInterval, System::nanoTime);
    }

    BatchScheduler(Duration pollInterval, LongSupplier nanoClock) {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive.");
        }
        this.pollInterval = pollInterval;
        this.nanoClock = nanoClock;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.info("Cancellation requested; no further files will be dispatched");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public BatchRunOutcome run(BatchJob job, BatchListener listener) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("A batch scheduler runs a single batch.");
        }

        List<Path> files;
        try {
            files = ImageFiles.listImages(job.inputDir());
            ImageFiles.prepareOutputDir(job.outputDir());
        } catch (RunSetupException e) {
            logger.error("Batch run could not start: {}", e.getMessage(), e);
            listener.onFatalError(e.getMessage(), e);
            return BatchRunOutcome.FATAL;
        }

        logger.info(
                "Starting batch of {} files from {} to {} with concurrency={} chain={}",
                files.size(),
                job.inputDir(),
                job.outputDir(),
                job.concurrency(),
                job.chain().names());
        return dispatchAll(files, job, listener);
    }

    private BatchRunOutcome dispatchAll(List<Path> files, BatchJob job, BatchListener listener) {
        Deque<Path> pending = new ArrayDeque<>(files);
        RunStatisticsTracker tracker = new RunStatisticsTracker(files.size(), nanoClock);
        ProgressEmitter progress = new ProgressEmitter(listener);
        Map<Future<FileResult>, Path> running = new HashMap<>();
        ExecutorService workers = Executors.newFixedThreadPool(
                job.concurrency(),
                new CustomizableThreadFactory("photo-worker-"));
        CompletionService<FileResult> completions = new ExecutorCompletionService<>(workers);

        listener.onStatistics(tracker.snapshot());
        progress.emit(0);
        boolean interrupted = false;
        try {
            while (true) {
                while (!cancelled.get() && tracker.inFlight() < job.concurrency() && !pending.isEmpty()) {
                    Path file = pending.poll();
                    running.put(completions.submit(() -> processFile(file, job)), file);
                    tracker.dispatched();
                    logger.debug("Dispatched {}", file.getFileName());
                    listener.onStatistics(tracker.snapshot());
                }

                if (tracker.inFlight() == 0) {
                    break;
                }

                Future<FileResult> done;
                if (interrupted) {
                    done = awaitUninterruptibly(completions);
                } else {
                    try {
                        done = completions.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                    } catch (InterruptedException e) {
                        interrupted = true;
                        logger.warn(
                                "Coordinator interrupted with {} files in flight; stopping the run",
                                tracker.inFlight());
                        cancelled.set(true);
                        continue;
                    }
                }
                if (done == null) {
                    listener.onStatistics(tracker.snapshot());
                    continue;
                }

                record(resultOf(done, running.remove(done)), tracker, listener, progress);
            }
        } finally {
            workers.shutdown();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        RunStatistics statistics = tracker.snapshot();
        listener.onStatistics(statistics);
        if (cancelled.get()) {
            progress.emit(100);
            logger.info(
                    "Batch stopped: completed={} failed={} notDispatched={}",
                    statistics.completed(),
                    statistics.failed(),
                    statistics.queued());
            listener.onStopped(statistics);
            return BatchRunOutcome.STOPPED;
        }

        progress.emit(statistics.progressPercent());
        logger.info(
                "Batch finished: completed={} failed={} elapsed={}ms rate={}/s",
                statistics.completed(),
                statistics.failed(),
                statistics.elapsed().toMillis(),
                String.format(Locale.ROOT, "%.2f", statistics.rate()));
        listener.onFinished(statistics);
        return BatchRunOutcome.ofFinishedRun(statistics);
    }

    private void record(
            FileResult result,
            RunStatisticsTracker tracker,
            BatchListener listener,
            ProgressEmitter progress) {
        if (result.state() == FileState.COMPLETED) {
            tracker.completed();
            listener.onFileCompleted(result.file());
        } else {
            tracker.failed();
            listener.onFileError(new FileError(result.file().getFileName().toString(), result.message()));
        }
        RunStatistics statistics = tracker.snapshot();
        listener.onStatistics(statistics);
        progress.emit(statistics.progressPercent());
    }

    // Files already in flight still have to report, so repeated interrupts are ignored here.
    private static Future<FileResult> awaitUninterruptibly(CompletionService<FileResult> completions) {
        while (true) {
            try {
                return completions.take();
            } catch (InterruptedException e) {
                logger.debug("Ignoring interrupt while draining in-flight files");
            }
        }
    }

    private FileResult processFile(Path file, BatchJob job) {
        ImageContainer container = null;
        try {
            container = ImageContainer.open(file);
            container.setEquivalentFocalLengthMode(job.useEquivalentFocalLength());
            job.chain().process(container);
            container.save(job.outputDir().resolve(file.getFileName()), job.quality());
            return FileResult.completed(file);
        } catch (Exception e) {
            logger.error("Processing failed for {}", file.getFileName(), e);
            return FileResult.failed(file, describe(e));
        } finally {
            if (container != null) {
                container.close();
            }
        }
    }

    private FileResult resultOf(Future<FileResult> done, Path file) {
        try {
            return done.get();
        } catch (ExecutionException e) {
            logger.error("Worker crashed while processing {}", file.getFileName(), e.getCause());
            return FileResult.failed(file, describe(e.getCause()));
        } catch (InterruptedException e) {
            // The future is already complete, so get() does not block here.
            Thread.currentThread().interrupt();
            return FileResult.failed(file, "Interrupted while collecting the result.");
        }
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "Unknown error.";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private static final class ProgressEmitter {

        private final BatchListener listener;
        private int last = -1;

        private ProgressEmitter(BatchListener listener) {
            this.listener = listener;
        }

        void emit(int percent) {
            if (percent > last) {
                last = percent;
                listener.onProgress(percent);
            }
        }
    }
}

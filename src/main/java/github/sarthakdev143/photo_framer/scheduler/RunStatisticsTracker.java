package github.sarthakdev143.photo_framer.scheduler;

import github.sarthakdev143.photo_framer.model.RunStatistics;

import java.time.Duration;
import java.util.function.LongSupplier;

class RunStatisticsTracker {

    private final int total;
    private final LongSupplier nanoClock;
    private final long startNanos;
    private int queued;
    private int inFlight;
    private int completed;
    private int failed;

    RunStatisticsTracker(int total, LongSupplier nanoClock) {
        this.total = total;
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
        this.queued = total;
    }

    void dispatched() {
        if (queued == 0) {
            throw new IllegalStateException("No queued file left to dispatch.");
        }
        queued--;
        inFlight++;
    }

    void completed() {
        leaveInFlight();
        completed++;
    }

    void failed() {
        leaveInFlight();
        failed++;
    }

    int inFlight() {
        return inFlight;
    }

    RunStatistics snapshot() {
        return new RunStatistics(
                total,
                queued,
                inFlight,
                completed,
                failed,
                Duration.ofNanos(Math.max(0L, nanoClock.getAsLong() - startNanos)));
    }

    private void leaveInFlight() {
        if (inFlight == 0) {
            throw new IllegalStateException("No file is in flight.");
        }
        inFlight--;
    }
}

package github.sarthakdev143.photo_framer.model;

import java.time.Duration;

public record RunStatistics(
        int total,
        int queued,
        int inFlight,
        int completed,
        int failed,
        Duration elapsed) {

    public RunStatistics {
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
        if (queued + inFlight + completed + failed != total) {
            throw new IllegalArgumentException("File counts do not add up to total " + total + ".");
        }
    }

    public static RunStatistics initial(int total) {
        return new RunStatistics(total, total, 0, 0, 0, Duration.ZERO);
    }

    public double rate() {
        double seconds = elapsed.toNanos() / 1_000_000_000.0;
        if (completed == 0 || seconds <= 0.0) {
            return 0.0;
        }
        return completed / seconds;
    }

    public int finished() {
        return completed + failed;
    }

    public int progressPercent() {
        if (total == 0) {
            return 100;
        }
        return (int) ((long) finished() * 100 / total);
    }
}

package github.sarthakdev143.photo_framer.model;

public enum BatchRunOutcome {
    SUCCEEDED,
    COMPLETED_WITH_FAILURES,
    STOPPED,
    FATAL;

    public static BatchRunOutcome ofFinishedRun(RunStatistics statistics) {
        return statistics.failed() == 0 ? SUCCEEDED : COMPLETED_WITH_FAILURES;
    }
}

package github.sarthakdev143.photo_framer.model;

public enum BatchRunState {
    QUEUED,
    RUNNING,
    FINISHED,
    STOPPED,
    FAILED
}

package github.sarthakdev143.photo_framer.model;

public enum FileState {
    QUEUED,
    IN_FLIGHT,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}

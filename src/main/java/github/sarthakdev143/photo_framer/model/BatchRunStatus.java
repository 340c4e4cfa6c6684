package github.sarthakdev143.photo_framer.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

public record BatchRunStatus(
        String runId,
        BatchRunState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        Path inputDir,
        Path outputDir,
        RunStatistics statistics,
        int progressPercent,
        List<FileError> errors,
        BatchRunOutcome outcome) {

    public BatchRunStatus {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean isTerminal() {
        return state == BatchRunState.FINISHED || state == BatchRunState.STOPPED || state == BatchRunState.FAILED;
    }
}

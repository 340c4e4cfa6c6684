package github.sarthakdev143.photo_framer.scheduler;

import github.sarthakdev143.photo_framer.model.FileError;
import github.sarthakdev143.photo_framer.model.RunStatistics;

import java.nio.file.Path;

/**
 * Receives the events of one run. All callbacks come from the run's coordinating thread, in order.
 * Exactly one of {@link #onFinished}, {@link #onStopped} or {@link #onFatalError} ends a run.
 */
public interface BatchListener {

    BatchListener NO_OP = new BatchListener() {
    };

    default void onStatistics(RunStatistics statistics) {
    }

    default void onProgress(int percent) {
    }

    default void onFileCompleted(Path file) {
    }

    default void onFileError(FileError error) {
    }

    default void onFinished(RunStatistics statistics) {
    }

    default void onStopped(RunStatistics statistics) {
    }

    default void onFatalError(String message, Throwable cause) {
    }
}

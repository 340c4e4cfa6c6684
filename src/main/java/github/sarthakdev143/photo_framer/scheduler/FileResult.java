package github.sarthakdev143.photo_framer.scheduler;

import github.sarthakdev143.photo_framer.model.FileState;

import java.nio.file.Path;

record FileResult(
        Path file,
        FileState state,
        String message) {

    static FileResult completed(Path file) {
        return new FileResult(file, FileState.COMPLETED, null);
    }

    static FileResult failed(Path file, String message) {
        return new FileResult(file, FileState.FAILED, message);
    }
}

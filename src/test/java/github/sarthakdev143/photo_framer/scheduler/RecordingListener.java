package github.sarthakdev143.photo_framer.scheduler;

import github.sarthakdev143.photo_framer.model.FileError;
import github.sarthakdev143.photo_framer.model.RunStatistics;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

class RecordingListener implements BatchListener {

    final List<RunStatistics> statistics = new ArrayList<>();
    final List<Integer> progress = new ArrayList<>();
    final List<Path> completed = new ArrayList<>();
    final List<FileError> errors = new ArrayList<>();
    final List<String> endings = new ArrayList<>();
    String fatalMessage;

    @Override
    public void onStatistics(RunStatistics statistics) {
        this.statistics.add(statistics);
    }

    @Override
    public void onProgress(int percent) {
        progress.add(percent);
    }

    @Override
    public void onFileCompleted(Path file) {
        completed.add(file);
    }

    @Override
    public void onFileError(FileError error) {
        errors.add(error);
    }

    @Override
    public void onFinished(RunStatistics statistics) {
        endings.add("finished");
    }

    @Override
    public void onStopped(RunStatistics statistics) {
        endings.add("stopped");
    }

    @Override
    public void onFatalError(String message, Throwable cause) {
        endings.add("fatal");
        fatalMessage = message;
    }

    RunStatistics last() {
        return statistics.get(statistics.size() - 1);
    }
}

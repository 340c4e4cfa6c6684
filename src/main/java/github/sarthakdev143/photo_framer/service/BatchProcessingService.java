package github.sarthakdev143.photo_framer.service;

import github.sarthakdev143.photo_framer.model.BatchRunRequest;
import github.sarthakdev143.photo_framer.model.BatchRunStatus;
import github.sarthakdev143.photo_framer.model.ProcessingConfig;
import github.sarthakdev143.photo_framer.scheduler.BatchListener;

import java.util.Optional;

public interface BatchProcessingService {

    String submitRun(BatchRunRequest request);

    String submitRun(BatchRunRequest request, ProcessingConfig config, BatchListener listener);

    Optional<BatchRunStatus> getRunStatus(String runId);

    boolean cancelRun(String runId);
}

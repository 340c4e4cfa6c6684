package github.sarthakdev143.photo_framer.model;

import java.nio.file.Path;

public record BatchRunRequest(
        Path inputDir,
        Path outputDir,
        Integer concurrency) {
}

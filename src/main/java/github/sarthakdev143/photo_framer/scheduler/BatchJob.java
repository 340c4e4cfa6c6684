package github.sarthakdev143.photo_framer.scheduler;

import github.sarthakdev143.photo_framer.processor.ProcessorChain;

import java.nio.file.Path;
import java.util.Objects;

public record BatchJob(
        Path inputDir,
        Path outputDir,
        ProcessorChain chain,
        int quality,
        boolean useEquivalentFocalLength,
        int concurrency) {

    public static final int DEFAULT_CONCURRENCY = 5;

    public BatchJob {
        Objects.requireNonNull(chain, "chain");
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("quality must be between 1 and 100.");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1.");
        }
    }
}

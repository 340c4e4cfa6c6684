package github.sarthakdev143.photo_framer.image;

import github.sarthakdev143.photo_framer.exception.RunSetupException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

public final class ImageFiles {

    private static final Set<String> IMAGE_EXTENSIONS = Set.of(
            ".jpg", ".jpeg", ".png", ".bmp", ".tif", ".tiff");

    private ImageFiles() {
    }

    public static List<Path> listImages(Path inputDir) {
        if (inputDir == null || !Files.isDirectory(inputDir)) {
            throw new RunSetupException("Input directory does not exist: " + inputDir);
        }
        if (!Files.isReadable(inputDir)) {
            throw new RunSetupException("Input directory is not readable: " + inputDir);
        }

        try (Stream<Path> paths = Files.list(inputDir)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(ImageFiles::isImageFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new RunSetupException("Unable to list input directory " + inputDir, e);
        }
    }

    public static Path prepareOutputDir(Path outputDir) {
        if (outputDir == null) {
            throw new RunSetupException("Output directory is required.");
        }
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new RunSetupException("Unable to create output directory " + outputDir, e);
        }
        if (!Files.isWritable(outputDir)) {
            throw new RunSetupException("Output directory is not writable: " + outputDir);
        }
        return outputDir;
    }

    public static boolean isImageFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.startsWith(".")) {
            return false;
        }
        return IMAGE_EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}

package github.sarthakdev143.photo_framer.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

public class LogoRepository {

    private static final Logger logger = LoggerFactory.getLogger(LogoRepository.class);
    private static final List<String> LOGO_EXTENSIONS = List.of(".png", ".jpg", ".jpeg");

    private final Map<String, BufferedImage> logos;

    public LogoRepository(Map<String, BufferedImage> logos) {
        Map<String, BufferedImage> ordered = new LinkedHashMap<>();
        logos.entrySet()
                .stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, BufferedImage> entry) -> entry.getKey().length())
                        .reversed()
                        .thenComparing(Map.Entry::getKey))
                .forEach(entry -> ordered.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue()));
        this.logos = Collections.unmodifiableMap(ordered);
    }

    public static LogoRepository empty() {
        return new LogoRepository(Map.of());
    }

    public static LogoRepository load(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            logger.info("No logo directory at {}; logo layouts will print the camera make instead", directory);
            return empty();
        }

        Map<String, BufferedImage> loaded = new LinkedHashMap<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
                String keyword = keywordOf(file);
                if (keyword == null) {
                    continue;
                }
                BufferedImage logo = readLogo(file);
                if (logo != null) {
                    loaded.put(keyword, logo);
                }
            }
        } catch (IOException e) {
            logger.warn("Unable to list logo directory {}", directory, e);
        }

        logger.info("Loaded {} logos from {}", loaded.size(), directory);
        return new LogoRepository(loaded);
    }

    public Optional<BufferedImage> find(String make) {
        if (make == null || make.isBlank()) {
            return Optional.empty();
        }
        String normalizedMake = make.toLowerCase(Locale.ROOT);
        return logos.entrySet()
                .stream()
                .filter(entry -> normalizedMake.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    public int size() {
        return logos.size();
    }

    private static String keywordOf(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String extension : LOGO_EXTENSIONS) {
            if (name.endsWith(extension) && name.length() > extension.length()) {
                return name.substring(0, name.length() - extension.length());
            }
        }
        return null;
    }

    private static BufferedImage readLogo(Path file) {
        try {
            BufferedImage logo = ImageIO.read(file.toFile());
            if (logo == null) {
                logger.warn("Skipping logo {}: not a readable image", file.getFileName());
            }
            return logo;
        } catch (IOException e) {
            logger.warn("Skipping logo {}", file.getFileName(), e);
            return null;
        }
    }
}

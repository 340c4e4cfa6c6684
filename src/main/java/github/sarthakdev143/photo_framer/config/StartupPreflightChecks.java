package github.sarthakdev143.photo_framer.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
@Order(0)
@ConditionalOnProperty(name = "photo-framer.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final String LOGO_DIR_PROPERTY = "photo-framer.logo-dir";

    private final PhotoFramerProperties properties;

    public StartupPreflightChecks(PhotoFramerProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkImageCodecs();
        checkLogoDirectory();
        checkQuality();
    }

    private void checkImageCodecs() {
        if (!ImageIO.getImageReadersByFormatName("jpeg").hasNext()) {
            throw new IllegalStateException("No JPEG reader is registered with ImageIO.");
        }
        if (!ImageIO.getImageWritersByFormatName("jpeg").hasNext()) {
            throw new IllegalStateException("No JPEG writer is registered with ImageIO.");
        }
    }

    private void checkLogoDirectory() {
        Path logoDir = properties.getLogoDir();
        if (logoDir == null || Files.notExists(logoDir)) {
            return;
        }
        if (!Files.isDirectory(logoDir)) {
            throw new IllegalStateException(
                    "Logo path " + logoDir.toAbsolutePath() + " is not a directory. Fix " + LOGO_DIR_PROPERTY + ".");
        }
        if (!Files.isReadable(logoDir)) {
            throw new IllegalStateException(
                    "Logo directory is not readable at " + logoDir.toAbsolutePath() + ".");
        }
    }

    private void checkQuality() {
        int quality = properties.getQuality();
        if (quality < 1 || quality > 100) {
            throw new IllegalStateException(
                    "photo-framer.quality must be between 1 and 100 but was " + quality + ".");
        }
    }
}

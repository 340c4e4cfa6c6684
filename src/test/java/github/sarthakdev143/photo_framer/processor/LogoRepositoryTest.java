package github.sarthakdev143.photo_framer.processor;

import github.sarthakdev143.photo_framer.image.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LogoRepositoryTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsLogosKeyedByLowercaseFileStem() throws Exception {
        TestImages.writePng(tempDir.resolve("Nikon.png"), 10, 5);
        TestImages.writeJpeg(tempDir.resolve("canon.jpg"), 10, 5);
        Files.writeString(tempDir.resolve("readme.txt"), "logos");
        Files.writeString(tempDir.resolve("broken.png"), "not a png");

        LogoRepository repository = LogoRepository.load(tempDir);

        assertThat(repository.size()).isEqualTo(2);
        assertThat(repository.find("NIKON CORPORATION")).isPresent();
        assertThat(repository.find("Canon")).isPresent();
        assertThat(repository.find("SONY")).isEmpty();
        assertThat(repository.find(null)).isEmpty();
    }

    @Test
    void missingDirectoryGivesEmptyRepository() {
        assertThat(LogoRepository.load(tempDir.resolve("absent")).size()).isZero();
    }

    @Test
    void longestKeywordWins() {
        BufferedImage leica = TestImages.image(4, 4);
        BufferedImage leicaCamera = TestImages.image(8, 4);
        LogoRepository repository = new LogoRepository(Map.of("leica", leica, "leica camera", leicaCamera));

        assertThat(repository.find("Leica Camera AG")).containsSame(leicaCamera);
        assertThat(repository.find("LEICA")).containsSame(leica);
    }
}

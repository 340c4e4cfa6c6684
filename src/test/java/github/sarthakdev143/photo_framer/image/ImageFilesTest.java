package github.sarthakdev143.photo_framer.image;

import github.sarthakdev143.photo_framer.exception.RunSetupException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void listImagesReturnsSortedImageFilesOnly() throws Exception {
        Files.createFile(tempDir.resolve("b.JPG"));
        Files.createFile(tempDir.resolve("a.png"));
        Files.createFile(tempDir.resolve("notes.txt"));
        Files.createFile(tempDir.resolve(".hidden.jpg"));
        Files.createDirectory(tempDir.resolve("nested.jpg"));

        assertThat(ImageFiles.listImages(tempDir))
                .containsExactly(tempDir.resolve("a.png"), tempDir.resolve("b.JPG"));
    }

    @Test
    void listImagesRejectsMissingDirectory() {
        assertThatThrownBy(() -> ImageFiles.listImages(tempDir.resolve("missing")))
                .isInstanceOf(RunSetupException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void prepareOutputDirCreatesNestedDirectories() {
        Path output = tempDir.resolve("out/framed");

        assertThat(ImageFiles.prepareOutputDir(output)).isDirectory();
    }

    @Test
    void prepareOutputDirFailsWhenPathIsAFile() throws Exception {
        Path file = Files.createFile(tempDir.resolve("taken"));

        assertThatThrownBy(() -> ImageFiles.prepareOutputDir(file)).isInstanceOf(RunSetupException.class);
    }
}

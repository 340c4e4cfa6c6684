package github.sarthakdev143.photo_framer.processor;

import github.sarthakdev143.photo_framer.image.ExifInfo;
import github.sarthakdev143.photo_framer.image.ImageContainer;
import github.sarthakdev143.photo_framer.image.TestImages;
import github.sarthakdev143.photo_framer.model.Corner;
import github.sarthakdev143.photo_framer.model.ElementConfig;
import github.sarthakdev143.photo_framer.model.TextField;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WatermarkProcessorTest {

    private static final Map<Corner, ElementConfig> ELEMENTS = Map.of(
            Corner.LEFT_TOP, new ElementConfig(TextField.MODEL, null, true),
            Corner.LEFT_BOTTOM, ElementConfig.of(TextField.LENS),
            Corner.RIGHT_TOP, ElementConfig.of(TextField.PARAM),
            Corner.RIGHT_BOTTOM, ElementConfig.custom("Tokyo"));

    @Test
    void appendsStripBelowPhoto() {
        ImageContainer container = container(1000, 800, ExifInfo.empty());
        WatermarkProcessor processor = new WatermarkProcessor(
                "watermark", LogoPosition.NONE, WatermarkTheme.LIGHT, ELEMENTS, true, LogoRepository.empty());

        processor.process(container);

        assertThat(container.getWidth()).isEqualTo(1000);
        assertThat(container.getHeight()).isEqualTo(800 + 96);
        assertThat(container.getImage().getRGB(999, 895)).isEqualTo(WatermarkTheme.LIGHT.background().getRGB());
    }

    @Test
    void stripHasMinimumHeightForSmallPhotos() {
        assertThat(WatermarkProcessor.stripHeight(200, 100)).isEqualTo(48);
        assertThat(WatermarkProcessor.stripHeight(4000, 3000)).isEqualTo(360);
    }

    @Test
    void darkThemeUsesDarkStrip() {
        ImageContainer container = container(600, 400, ExifInfo.empty());
        WatermarkProcessor processor = new WatermarkProcessor(
                "dark_watermark_left_logo",
                LogoPosition.LEFT,
                WatermarkTheme.DARK,
                ELEMENTS,
                true,
                LogoRepository.empty());

        processor.process(container);

        assertThat(processor.name()).isEqualTo("dark_watermark_left_logo");
        assertThat(container.getImage().getRGB(599, container.getHeight() - 1))
                .isEqualTo(WatermarkTheme.DARK.background().getRGB());
    }

    @Test
    void drawsMatchingLogoInStrip() {
        BufferedImage red = new BufferedImage(40, 40, BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < 40; x++) {
            for (int y = 0; y < 40; y++) {
                red.setRGB(x, y, 0xFF0000);
            }
        }
        ExifInfo exif = new ExifInfo("Fujifilm", "X-T4", null, null, null, null, null, null, null, null, null, null);
        ImageContainer container = container(500, 500, exif);
        WatermarkProcessor processor = new WatermarkProcessor(
                "watermark_left_logo",
                LogoPosition.LEFT,
                WatermarkTheme.LIGHT,
                ELEMENTS,
                true,
                new LogoRepository(Map.of("fujifilm", red)));

        processor.process(container);

        // strip 60px, logo 30px square starting at x=24, vertically centred
        assertThat(container.getImage().getRGB(30, 500 + 30) & 0xFFFFFF).isEqualTo(0xFF0000);
    }

    @Test
    void cornerTextIsCachedOnContainer() {
        ImageContainer container = container(300, 200, ExifInfo.empty());
        WatermarkProcessor processor = new WatermarkProcessor(
                "watermark", LogoPosition.NONE, WatermarkTheme.LIGHT, ELEMENTS, false, LogoRepository.empty());

        processor.process(container);

        assertThat(container.getCornerText(Corner.RIGHT_BOTTOM, ElementConfig.none())).isEqualTo("Tokyo");
        assertThat(container.getCornerText(Corner.LEFT_TOP, ElementConfig.none())).isEqualTo(ImageContainer.PLACEHOLDER);
    }

    private static ImageContainer container(int width, int height, ExifInfo exif) {
        return new ImageContainer(Path.of("photo.jpg"), TestImages.image(width, height), exif);
    }
}

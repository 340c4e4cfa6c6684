package github.sarthakdev143.photo_framer.image;

import github.sarthakdev143.photo_framer.exception.DecodeException;
import github.sarthakdev143.photo_framer.exception.EncodeException;
import github.sarthakdev143.photo_framer.exception.MetadataException;
import github.sarthakdev143.photo_framer.model.Corner;
import github.sarthakdev143.photo_framer.model.ElementConfig;
import github.sarthakdev143.photo_framer.model.TextField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One photo being processed: its pixels, its EXIF fields and the text derived from them.
 *
 * <p>A container is confined to the worker that opened it. Processors replace the image through
 * {@link #setImage(BufferedImage)}; {@link #save(Path, int)} writes the current image and
 * {@link #close()} releases it. After close every accessor throws {@link IllegalStateException};
 * closing twice is a no-op.
 */
public final class ImageContainer implements Closeable {

    public static final String PLACEHOLDER = "N/A";
    public static final String NO_GPS = "No GPS";

    private static final Logger logger = LoggerFactory.getLogger(ImageContainer.class);
    private static final ExifReader DEFAULT_EXIF_READER = new ExifReader();

    private final Path source;
    private final ExifInfo exif;
    private final int originalWidth;
    private final int originalHeight;
    private final Map<Corner, String> cornerTexts = new EnumMap<>(Corner.class);
    private BufferedImage image;
    private boolean equivalentFocalLengthMode;
    private boolean closed;

    public ImageContainer(Path source, BufferedImage image, ExifInfo exif) {
        this.source = Objects.requireNonNull(source, "source");
        this.image = Objects.requireNonNull(image, "image");
        this.exif = exif == null ? ExifInfo.empty() : exif;
        this.originalWidth = image.getWidth();
        this.originalHeight = image.getHeight();
    }

    public static ImageContainer open(Path source) throws DecodeException {
        return open(source, DEFAULT_EXIF_READER);
    }

    public static ImageContainer open(Path source, ExifReader exifReader) throws DecodeException {
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(source.toFile());
        } catch (IOException e) {
            throw new DecodeException(source, "Unable to decode " + source.getFileName() + ": " + e.getMessage(), e);
        }
        if (decoded == null) {
            throw new DecodeException(source, source.getFileName() + " is not a readable image.");
        }

        ExifInfo exif;
        try {
            exif = exifReader.read(source);
        } catch (MetadataException e) {
            logger.warn("{}; falling back to placeholder text", e.getMessage());
            exif = ExifInfo.empty();
        }
        return new ImageContainer(source, toRgb(decoded), exif);
    }

    public Path getSource() {
        return source;
    }

    public ExifInfo getExif() {
        ensureOpen();
        return exif;
    }

    public BufferedImage getImage() {
        ensureOpen();
        return image;
    }

    public void setImage(BufferedImage image) {
        ensureOpen();
        this.image = Objects.requireNonNull(image, "image");
    }

    public int getWidth() {
        return getImage().getWidth();
    }

    public int getHeight() {
        return getImage().getHeight();
    }

    public int getOriginalWidth() {
        ensureOpen();
        return originalWidth;
    }

    public int getOriginalHeight() {
        ensureOpen();
        return originalHeight;
    }

    public double getOriginalRatio() {
        ensureOpen();
        return (double) originalWidth / originalHeight;
    }

    public boolean isEquivalentFocalLengthMode() {
        ensureOpen();
        return equivalentFocalLengthMode;
    }

    public void setEquivalentFocalLengthMode(boolean equivalentFocalLengthMode) {
        ensureOpen();
        if (this.equivalentFocalLengthMode != equivalentFocalLengthMode) {
            cornerTexts.clear();
        }
        this.equivalentFocalLengthMode = equivalentFocalLengthMode;
    }

    public String getText(ElementConfig element) {
        if (element.name() == TextField.CUSTOM) {
            ensureOpen();
            return element.value();
        }
        return getText(element.name());
    }

    public String getText(TextField field) {
        ensureOpen();
        return switch (field) {
            case MODEL -> orPlaceholder(exif.model());
            case MAKE -> orPlaceholder(exif.make());
            case LENS -> orPlaceholder(exif.lensModel() != null ? exif.lensModel() : exif.lensMake());
            case PARAM -> orPlaceholder(ExifTextFormatter.exposureParams(exif));
            case FOCAL_LENGTH -> orPlaceholder(ExifTextFormatter.focalLength(exif, equivalentFocalLengthMode));
            case DATETIME -> orPlaceholder(ExifTextFormatter.datetime(exif.captureTime()));
            case DATE -> orPlaceholder(ExifTextFormatter.date(exif.captureTime()));
            case FILENAME -> baseName();
            case DATE_FILENAME -> getText(TextField.DATE) + " " + baseName();
            case DATETIME_FILENAME -> getText(TextField.DATETIME) + " " + baseName();
            case CAMERA_MAKE_CAMERA_MODEL -> orPlaceholder(ExifTextFormatter.joinMakeAndName(exif.make(), exif.model()));
            case LENS_MAKE_LENS_MODEL -> orPlaceholder(
                    ExifTextFormatter.joinMakeAndName(exif.lensMake(), exif.lensModel()));
            case CAMERA_MODEL_LENS_MODEL -> orPlaceholder(
                    ExifTextFormatter.joinNonNull(exif.model(), exif.lensModel()));
            case TOTAL_PIXEL -> ExifTextFormatter.megapixels(originalWidth, originalHeight);
            case GEO_INFO -> {
                String geo = ExifTextFormatter.geo(exif);
                yield geo == null ? NO_GPS : geo;
            }
            case CUSTOM, NONE -> "";
        };
    }

    /**
     * Text for one watermark corner, computed once per container.
     */
    public String getCornerText(Corner corner, ElementConfig element) {
        ensureOpen();
        return cornerTexts.computeIfAbsent(corner, ignored -> getText(element));
    }

    public void save(Path target, int quality) throws EncodeException {
        ensureOpen();
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("quality must be between 1 and 100.");
        }

        String extension = extensionOf(target);
        Path directory = target.toAbsolutePath().getParent();
        Path tempFile = null;
        try {
            tempFile = Files.createTempFile(directory, "." + target.getFileName() + "-", ".tmp");
            if ("jpg".equals(extension) || "jpeg".equals(extension)) {
                writeJpeg(tempFile, quality);
            } else if (!ImageIO.write(image, extension, tempFile.toFile())) {
                throw new EncodeException(target, "Unsupported target format: " + extension);
            }
            moveIntoPlace(tempFile, target);
            tempFile = null;
        } catch (EncodeException e) {
            throw e;
        } catch (IOException e) {
            throw new EncodeException(target, "Unable to write " + target.getFileName() + ": " + e.getMessage(), e);
        } finally {
            deleteTempFile(tempFile);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        cornerTexts.clear();
        image.flush();
        image = null;
    }

    public boolean isClosed() {
        return closed;
    }

    public static BufferedImage toRgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, source.getWidth(), source.getHeight());
            graphics.drawImage(source, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }

    private void writeJpeg(Path file, int quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new EncodeException(file, "No JPEG writer available.");
        }

        ImageWriter writer = writers.next();
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(quality / 100f);
        try (ImageOutputStream output = ImageIO.createImageOutputStream(file.toFile())) {
            writer.setOutput(output);
            writer.write(null, new IIOImage(toRgb(image), null, null), param);
        } finally {
            writer.dispose();
        }
    }

    private void moveIntoPlace(Path tempFile, Path target) throws IOException {
        try {
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private String baseName() {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private String orPlaceholder(String value) {
        return value == null || value.isBlank() ? PLACEHOLDER : value;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Image container for " + source.getFileName() + " is closed.");
        }
    }

    private static String extensionOf(Path target) {
        String fileName = target.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static void deleteTempFile(Path filePath) {
        if (filePath == null) {
            return;
        }
        try {
            Files.deleteIfExists(filePath);
        } catch (IOException e) {
            logger.warn("Unable to delete temporary file {}", filePath, e);
        }
    }
}

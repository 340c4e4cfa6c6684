package github.sarthakdev143.photo_framer.image;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.GeoLocation;
import com.drew.lang.Rational;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import github.sarthakdev143.photo_framer.exception.MetadataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public class ExifReader {

    private static final Logger logger = LoggerFactory.getLogger(ExifReader.class);
    private static final DateTimeFormatter EXIF_DATETIME = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    public ExifInfo read(Path source) throws MetadataException {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(source.toFile());
        } catch (ImageProcessingException | IOException e) {
            throw new MetadataException("Unable to read EXIF from " + source.getFileName(), e);
        }

        ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        ExifSubIFDDirectory subIfd = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);

        GeoLocation location = gps == null ? null : gps.getGeoLocation();
        String captureTime = stringOf(subIfd, ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL);
        if (captureTime == null) {
            captureTime = stringOf(ifd0, ExifIFD0Directory.TAG_DATETIME);
        }

        return new ExifInfo(
                stringOf(ifd0, ExifIFD0Directory.TAG_MAKE),
                stringOf(ifd0, ExifIFD0Directory.TAG_MODEL),
                stringOf(subIfd, ExifSubIFDDirectory.TAG_LENS_MAKE),
                stringOf(subIfd, ExifSubIFDDirectory.TAG_LENS_MODEL),
                doubleOf(subIfd, ExifSubIFDDirectory.TAG_FOCAL_LENGTH),
                integerOf(subIfd, ExifSubIFDDirectory.TAG_35MM_FILM_EQUIV_FOCAL_LENGTH),
                doubleOf(subIfd, ExifSubIFDDirectory.TAG_FNUMBER),
                doubleOf(subIfd, ExifSubIFDDirectory.TAG_EXPOSURE_TIME),
                integerOf(subIfd, ExifSubIFDDirectory.TAG_ISO_EQUIVALENT),
                parseCaptureTime(source, captureTime),
                location == null || location.isZero() ? null : location.getLatitude(),
                location == null || location.isZero() ? null : location.getLongitude());
    }

    static LocalDateTime parseCaptureTime(Path source, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim(), EXIF_DATETIME);
        } catch (DateTimeParseException e) {
            logger.warn("Ignoring malformed EXIF datetime '{}' in {}", value, source.getFileName());
            return null;
        }
    }

    private String stringOf(Directory directory, int tag) {
        return directory == null ? null : directory.getString(tag);
    }

    private Integer integerOf(Directory directory, int tag) {
        if (directory == null || !directory.containsTag(tag)) {
            return null;
        }
        Integer value = directory.getInteger(tag);
        return value == null || value <= 0 ? null : value;
    }

    private Double doubleOf(Directory directory, int tag) {
        if (directory == null || !directory.containsTag(tag)) {
            return null;
        }
        Rational rational = directory.getRational(tag);
        if (rational == null || rational.getDenominator() == 0 || rational.getNumerator() <= 0) {
            return null;
        }
        return rational.doubleValue();
    }
}

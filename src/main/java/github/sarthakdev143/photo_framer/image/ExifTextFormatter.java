package github.sarthakdev143.photo_framer.image;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

final class ExifTextFormatter {

    static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private static final double SHUTTER_FRACTION_TOLERANCE = 1e-3;

    private ExifTextFormatter() {
    }

    static String exposureParams(ExifInfo exif) {
        List<String> parts = new ArrayList<>();
        if (exif.aperture() != null) {
            parts.add("f/" + plainNumber(exif.aperture(), 1));
        }
        if (exif.exposureSeconds() != null) {
            parts.add(shutter(exif.exposureSeconds()) + "s");
        }
        if (exif.iso() != null) {
            parts.add("ISO" + exif.iso());
        }
        return parts.isEmpty() ? null : String.join(" ", parts);
    }

    static String focalLength(ExifInfo exif, boolean equivalent) {
        if (equivalent && exif.focalLength35mm() != null) {
            return exif.focalLength35mm() + "mm";
        }
        if (exif.focalLength() != null) {
            return plainNumber(exif.focalLength(), 1) + "mm";
        }
        return null;
    }

    static String shutter(double seconds) {
        if (seconds > 0.0 && seconds < 1.0) {
            double reciprocal = 1.0 / seconds;
            long denominator = Math.round(reciprocal);
            if (Math.abs(reciprocal - denominator) < SHUTTER_FRACTION_TOLERANCE) {
                return "1/" + denominator;
            }
        }
        return plainNumber(seconds, 1);
    }

    static String datetime(LocalDateTime value) {
        return value == null ? null : DATETIME.format(value);
    }

    static String date(LocalDateTime value) {
        return value == null ? null : DATE.format(value);
    }

    static String geo(ExifInfo exif) {
        if (!exif.hasGeoLocation()) {
            return null;
        }
        return String.format(Locale.ROOT, "%.4f, %.4f", exif.latitude(), exif.longitude());
    }

    static String megapixels(int width, int height) {
        double megapixels = (double) width * height / 1_000_000.0;
        return plainNumber(megapixels, 1) + "MP";
    }

    static String joinMakeAndName(String make, String name) {
        if (make == null) {
            return name;
        }
        if (name == null) {
            return make;
        }
        if (name.toLowerCase(Locale.ROOT).startsWith(make.toLowerCase(Locale.ROOT))) {
            return name;
        }
        return make + " " + name;
    }

    static String joinNonNull(String first, String second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return first + " " + second;
    }

    static String plainNumber(double value, int maxFractionDigits) {
        BigDecimal decimal = BigDecimal.valueOf(value)
                .setScale(maxFractionDigits, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        return decimal.toPlainString();
    }
}

package github.sarthakdev143.photo_framer.image;

import java.time.LocalDateTime;

public record ExifInfo(
        String make,
        String model,
        String lensMake,
        String lensModel,
        Double focalLength,
        Integer focalLength35mm,
        Double aperture,
        Double exposureSeconds,
        Integer iso,
        LocalDateTime captureTime,
        Double latitude,
        Double longitude) {

    private static final ExifInfo EMPTY = new ExifInfo(
            null, null, null, null, null, null, null, null, null, null, null, null);

    public ExifInfo {
        make = blankToNull(make);
        model = blankToNull(model);
        lensMake = blankToNull(lensMake);
        lensModel = blankToNull(lensModel);
    }

    public static ExifInfo empty() {
        return EMPTY;
    }

    public boolean hasGeoLocation() {
        return latitude != null && longitude != null;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.replace('\0', ' ').trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

package github.sarthakdev143.photo_framer.model;

import java.util.Locale;

public enum TextField {
    MODEL("Model"),
    MAKE("Make"),
    LENS("LensModel"),
    PARAM("Param"),
    FOCAL_LENGTH("FocalLength"),
    DATETIME("Datetime"),
    DATE("Date"),
    FILENAME("Filename"),
    DATE_FILENAME("Date_Filename"),
    DATETIME_FILENAME("Datetime_Filename"),
    CAMERA_MAKE_CAMERA_MODEL("CameraMake_CameraModel"),
    LENS_MAKE_LENS_MODEL("LensMake_LensModel"),
    CAMERA_MODEL_LENS_MODEL("CameraModel_LensModel"),
    TOTAL_PIXEL("TotalPixel"),
    GEO_INFO("GeoInfo"),
    CUSTOM("Custom"),
    NONE("None");

    private final String configValue;

    TextField(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    public static TextField fromInput(String input) {
        if (input == null || input.isBlank()) {
            return NONE;
        }

        String normalized = input.trim();
        for (TextField field : values()) {
            if (field.name().equalsIgnoreCase(normalized) || field.configValue.equalsIgnoreCase(normalized)) {
                return field;
            }
        }

        throw new IllegalArgumentException("Unknown text field: " + input.toLowerCase(Locale.ROOT));
    }
}

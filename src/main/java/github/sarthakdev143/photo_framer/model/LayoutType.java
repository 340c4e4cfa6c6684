package github.sarthakdev143.photo_framer.model;

import java.util.Optional;

public enum LayoutType {
    WATERMARK("watermark"),
    WATERMARK_LEFT_LOGO("watermark_left_logo"),
    WATERMARK_RIGHT_LOGO("watermark_right_logo"),
    DARK_WATERMARK_LEFT_LOGO("dark_watermark_left_logo"),
    DARK_WATERMARK_RIGHT_LOGO("dark_watermark_right_logo"),
    SQUARE("square"),
    SIMPLE("simple");

    public static final String SQUARE_KEY = "square";
    public static final String WATERMARK_MARKER = "watermark";

    private final String key;

    LayoutType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<LayoutType> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        for (LayoutType type : values()) {
            if (type.key.equals(key.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

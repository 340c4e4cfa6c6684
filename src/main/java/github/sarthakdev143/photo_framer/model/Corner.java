package github.sarthakdev143.photo_framer.model;

import java.util.Locale;

public enum Corner {
    LEFT_TOP,
    RIGHT_TOP,
    LEFT_BOTTOM,
    RIGHT_BOTTOM;

    public boolean isLeft() {
        return this == LEFT_TOP || this == LEFT_BOTTOM;
    }

    public boolean isTop() {
        return this == LEFT_TOP || this == RIGHT_TOP;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}

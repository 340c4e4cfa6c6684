package github.sarthakdev143.photo_framer.processor;

import java.awt.Color;

public enum WatermarkTheme {
    LIGHT(Color.WHITE, new Color(0x21, 0x21, 0x21), new Color(0x75, 0x75, 0x75), new Color(0xD0, 0xD0, 0xD0)),
    DARK(new Color(0x12, 0x12, 0x12), Color.WHITE, new Color(0xBD, 0xBD, 0xBD), new Color(0x50, 0x50, 0x50));

    private final Color background;
    private final Color primaryText;
    private final Color secondaryText;
    private final Color divider;

    WatermarkTheme(Color background, Color primaryText, Color secondaryText, Color divider) {
        this.background = background;
        this.primaryText = primaryText;
        this.secondaryText = secondaryText;
        this.divider = divider;
    }

    public Color background() {
        return background;
    }

    public Color primaryText() {
        return primaryText;
    }

    public Color secondaryText() {
        return secondaryText;
    }

    public Color divider() {
        return divider;
    }
}

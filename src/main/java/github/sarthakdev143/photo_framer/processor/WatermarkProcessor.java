package github.sarthakdev143.photo_framer.processor;

import github.sarthakdev143.photo_framer.image.ImageContainer;
import github.sarthakdev143.photo_framer.model.Corner;
import github.sarthakdev143.photo_framer.model.ElementConfig;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public class WatermarkProcessor implements ProcessorComponent {

    private static final double STRIP_RATIO = 0.12;
    private static final int MIN_STRIP_HEIGHT = 48;
    private static final double FONT_RATIO = 0.22;
    private static final double LOGO_RATIO = 0.5;
    private static final double TOP_BASELINE_RATIO = 0.45;
    private static final double BOTTOM_BASELINE_RATIO = 0.78;

    private final String name;
    private final LogoPosition logoPosition;
    private final WatermarkTheme theme;
    private final Map<Corner, ElementConfig> elements;
    private final boolean logoEnabled;
    private final LogoRepository logos;

    public WatermarkProcessor(
            String name,
            LogoPosition logoPosition,
            WatermarkTheme theme,
            Map<Corner, ElementConfig> elements,
            boolean logoEnabled,
            LogoRepository logos) {
        this.name = name;
        this.logoPosition = logoPosition;
        this.theme = theme;
        EnumMap<Corner, ElementConfig> copy = new EnumMap<>(Corner.class);
        for (Corner corner : Corner.values()) {
            ElementConfig element = elements.get(corner);
            copy.put(corner, element == null ? ElementConfig.none() : element);
        }
        this.elements = Map.copyOf(copy);
        this.logoEnabled = logoEnabled;
        this.logos = logos == null ? LogoRepository.empty() : logos;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ImageContainer process(ImageContainer container) {
        BufferedImage image = container.getImage();
        int width = image.getWidth();
        int height = image.getHeight();
        int strip = stripHeight(width, height);

        BufferedImage canvas = Canvases.filled(width, height + strip, theme.background());
        Graphics2D graphics = Canvases.qualityGraphics(canvas);
        try {
            graphics.drawImage(image, 0, 0, null);

            int padding = (int) Math.round(strip * 0.4);
            int fontSize = Math.max(10, (int) Math.round(strip * FONT_RATIO));
            Font regular = new Font(Font.SANS_SERIF, Font.PLAIN, fontSize);
            Font bold = new Font(Font.SANS_SERIF, Font.BOLD, fontSize);
            int topBaseline = height + (int) Math.round(strip * TOP_BASELINE_RATIO);
            int bottomBaseline = height + (int) Math.round(strip * BOTTOM_BASELINE_RATIO);

            String leftTop = text(container, Corner.LEFT_TOP);
            String leftBottom = text(container, Corner.LEFT_BOTTOM);
            String rightTop = text(container, Corner.RIGHT_TOP);
            String rightBottom = text(container, Corner.RIGHT_BOTTOM);

            int leftX = padding;
            if (showLogo() && logoPosition == LogoPosition.LEFT) {
                leftX += drawLogo(graphics, container, padding, height, strip, bold) + padding / 2;
            }
            drawText(graphics, leftTop, fontFor(Corner.LEFT_TOP, bold, bold), theme.primaryText(), leftX, topBaseline, false);
            drawText(graphics, leftBottom, fontFor(Corner.LEFT_BOTTOM, bold, regular), theme.secondaryText(), leftX, bottomBaseline, false);

            int rightX = width - padding;
            drawText(graphics, rightTop, fontFor(Corner.RIGHT_TOP, bold, bold), theme.primaryText(), rightX, topBaseline, true);
            drawText(graphics, rightBottom, fontFor(Corner.RIGHT_BOTTOM, bold, regular), theme.secondaryText(), rightX, bottomBaseline, true);

            if (showLogo() && logoPosition == LogoPosition.RIGHT) {
                int blockWidth = Math.max(
                        textWidth(graphics, rightTop, fontFor(Corner.RIGHT_TOP, bold, bold)),
                        textWidth(graphics, rightBottom, fontFor(Corner.RIGHT_BOTTOM, bold, regular)));
                int dividerX = rightX - blockWidth - padding / 2;
                graphics.setColor(theme.divider());
                graphics.setStroke(new BasicStroke(Math.max(1f, strip / 60f)));
                graphics.drawLine(dividerX, height + strip / 4, dividerX, height + strip * 3 / 4);

                int logoWidth = measureLogo(graphics, container, strip, bold);
                drawLogo(graphics, container, dividerX - padding / 2 - logoWidth, height, strip, bold);
            }
        } finally {
            graphics.dispose();
        }

        container.setImage(canvas);
        return container;
    }

    public LogoPosition logoPosition() {
        return logoPosition;
    }

    public WatermarkTheme theme() {
        return theme;
    }

    static int stripHeight(int width, int height) {
        return Math.max(MIN_STRIP_HEIGHT, (int) Math.round(Math.min(width, height) * STRIP_RATIO));
    }

    private boolean showLogo() {
        return logoEnabled && logoPosition != LogoPosition.NONE;
    }

    private String text(ImageContainer container, Corner corner) {
        return container.getCornerText(corner, elements.get(corner));
    }

    private Font fontFor(Corner corner, Font bold, Font fallback) {
        return elements.get(corner).bold() ? bold : fallback;
    }

    private int drawLogo(Graphics2D graphics, ImageContainer container, int x, int top, int strip, Font bold) {
        String make = container.getExif().make();
        Optional<BufferedImage> logo = logos.find(make);
        if (logo.isPresent()) {
            int logoHeight = (int) Math.round(strip * LOGO_RATIO);
            int logoWidth = scaledWidth(logo.get(), logoHeight);
            graphics.drawImage(logo.get(), x, top + (strip - logoHeight) / 2, logoWidth, logoHeight, null);
            return logoWidth;
        }
        if (make == null) {
            return 0;
        }
        graphics.setFont(bold);
        graphics.setColor(theme.primaryText());
        FontMetrics metrics = graphics.getFontMetrics();
        graphics.drawString(make, x, top + (strip + metrics.getAscent() - metrics.getDescent()) / 2);
        return metrics.stringWidth(make);
    }

    private int measureLogo(Graphics2D graphics, ImageContainer container, int strip, Font bold) {
        String make = container.getExif().make();
        Optional<BufferedImage> logo = logos.find(make);
        if (logo.isPresent()) {
            return scaledWidth(logo.get(), (int) Math.round(strip * LOGO_RATIO));
        }
        return make == null ? 0 : graphics.getFontMetrics(bold).stringWidth(make);
    }

    private int scaledWidth(BufferedImage logo, int targetHeight) {
        return Math.max(1, (int) Math.round(logo.getWidth() * (double) targetHeight / logo.getHeight()));
    }

    private int textWidth(Graphics2D graphics, String text, Font font) {
        return text == null || text.isEmpty() ? 0 : graphics.getFontMetrics(font).stringWidth(text);
    }

    private void drawText(Graphics2D graphics, String text, Font font, Color color, int x, int baseline, boolean alignRight) {
        if (text == null || text.isEmpty()) {
            return;
        }
        graphics.setFont(font);
        graphics.setColor(color);
        int drawX = alignRight ? x - graphics.getFontMetrics().stringWidth(text) : x;
        graphics.drawString(text, drawX, baseline);
    }
}

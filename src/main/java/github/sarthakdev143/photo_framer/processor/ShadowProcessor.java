package github.sarthakdev143.photo_framer.processor;

import github.sarthakdev143.photo_framer.image.ImageContainer;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

public class ShadowProcessor implements ProcessorComponent {

    private static final double BLUR_RATIO = 0.02;
    private static final int MIN_BLUR = 4;
    private static final int MAX_SHADOW_ALPHA = 96;

    @Override
    public String name() {
        return "shadow";
    }

    @Override
    public ImageContainer process(ImageContainer container) {
        BufferedImage image = container.getImage();
        int width = image.getWidth();
        int height = image.getHeight();
        int blur = Math.max(MIN_BLUR, (int) Math.round(Math.min(width, height) * BLUR_RATIO));
        int offset = Math.max(2, blur / 2);
        int padding = blur * 2 + offset;

        BufferedImage canvas = Canvases.filled(width + padding * 2, height + padding * 2, Color.WHITE);
        Graphics2D graphics = Canvases.qualityGraphics(canvas);
        try {
            // Stacked translucent rings: alpha accumulates towards the photo edge.
            int step = Math.max(1, MAX_SHADOW_ALPHA / blur);
            graphics.setColor(new Color(0, 0, 0, step));
            for (int spread = blur; spread > 0; spread--) {
                graphics.fillRoundRect(
                        padding + offset - spread,
                        padding + offset - spread,
                        width + spread * 2,
                        height + spread * 2,
                        spread * 2,
                        spread * 2);
            }
            graphics.drawImage(image, padding, padding, null);
        } finally {
            graphics.dispose();
        }

        container.setImage(canvas);
        return container;
    }
}

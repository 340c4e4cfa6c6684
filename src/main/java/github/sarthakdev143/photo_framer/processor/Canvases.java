package github.sarthakdev143.photo_framer.processor;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

final class Canvases {

    private Canvases() {
    }

    static BufferedImage filled(int width, int height, Color background) {
        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = canvas.createGraphics();
        try {
            graphics.setColor(background);
            graphics.fillRect(0, 0, width, height);
        } finally {
            graphics.dispose();
        }
        return canvas;
    }

    static BufferedImage centered(BufferedImage image, int width, int height, Color background) {
        BufferedImage canvas = filled(width, height, background);
        Graphics2D graphics = canvas.createGraphics();
        try {
            graphics.drawImage(image, (width - image.getWidth()) / 2, (height - image.getHeight()) / 2, null);
        } finally {
            graphics.dispose();
        }
        return canvas;
    }

    static Graphics2D qualityGraphics(BufferedImage canvas) {
        Graphics2D graphics = canvas.createGraphics();
        graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        return graphics;
    }
}

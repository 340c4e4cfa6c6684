package github.sarthakdev143.photo_framer.processor;

import github.sarthakdev143.photo_framer.image.ImageContainer;

import java.awt.Color;
import java.awt.image.BufferedImage;

public class MarginProcessor implements ProcessorComponent {

    private final double ratio;

    public MarginProcessor(double ratio) {
        if (ratio < 0.0) {
            throw new IllegalArgumentException("Margin ratio must not be negative.");
        }
        this.ratio = ratio;
    }

    @Override
    public String name() {
        return "margin";
    }

    @Override
    public ImageContainer process(ImageContainer container) {
        BufferedImage image = container.getImage();
        int border = (int) Math.round(Math.min(image.getWidth(), image.getHeight()) * ratio);
        if (border == 0) {
            return container;
        }
        container.setImage(Canvases.centered(
                image,
                image.getWidth() + border * 2,
                image.getHeight() + border * 2,
                Color.WHITE));
        return container;
    }

    public double ratio() {
        return ratio;
    }
}

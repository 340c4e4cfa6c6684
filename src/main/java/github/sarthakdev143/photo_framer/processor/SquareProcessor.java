package github.sarthakdev143.photo_framer.processor;

import github.sarthakdev143.photo_framer.image.ImageContainer;

import java.awt.Color;
import java.awt.image.BufferedImage;

public class SquareProcessor implements ProcessorComponent {

    private final Color background;

    public SquareProcessor() {
        this(Color.WHITE);
    }

    public SquareProcessor(Color background) {
        this.background = background;
    }

    @Override
    public String name() {
        return "square";
    }

    @Override
    public ImageContainer process(ImageContainer container) {
        BufferedImage image = container.getImage();
        int side = Math.max(image.getWidth(), image.getHeight());
        if (image.getWidth() == side && image.getHeight() == side) {
            return container;
        }
        container.setImage(Canvases.centered(image, side, side, background));
        return container;
    }
}

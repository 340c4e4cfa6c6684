package github.sarthakdev143.photo_framer.processor;

import github.sarthakdev143.photo_framer.image.ImageContainer;

import java.awt.Color;
import java.awt.image.BufferedImage;

public class PaddingToOriginalRatioProcessor implements ProcessorComponent {

    private static final double RATIO_TOLERANCE = 1e-3;

    @Override
    public String name() {
        return "padding_to_original_ratio";
    }

    @Override
    public ImageContainer process(ImageContainer container) {
        BufferedImage image = container.getImage();
        double target = container.getOriginalRatio();
        int width = image.getWidth();
        int height = image.getHeight();
        double current = (double) width / height;
        if (Math.abs(current - target) < RATIO_TOLERANCE) {
            return container;
        }

        int paddedWidth = width;
        int paddedHeight = height;
        if (current > target) {
            paddedHeight = (int) Math.round(width / target);
        } else {
            paddedWidth = (int) Math.round(height * target);
        }
        container.setImage(Canvases.centered(image, paddedWidth, paddedHeight, Color.WHITE));
        return container;
    }
}

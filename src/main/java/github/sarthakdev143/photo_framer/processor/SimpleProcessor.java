package github.sarthakdev143.photo_framer.processor;

import github.sarthakdev143.photo_framer.exception.ProcessingException;
import github.sarthakdev143.photo_framer.image.ImageContainer;
import net.coobird.thumbnailator.Thumbnails;

import java.awt.image.BufferedImage;
import java.io.IOException;

public class SimpleProcessor implements ProcessorComponent {

    private final int maxLongEdge;

    public SimpleProcessor(int maxLongEdge) {
        if (maxLongEdge < 0) {
            throw new IllegalArgumentException("maxLongEdge must not be negative.");
        }
        this.maxLongEdge = maxLongEdge;
    }

    @Override
    public String name() {
        return "simple";
    }

    @Override
    public ImageContainer process(ImageContainer container) {
        BufferedImage image = container.getImage();
        if (maxLongEdge == 0 || Math.max(image.getWidth(), image.getHeight()) <= maxLongEdge) {
            container.setImage(ImageContainer.toRgb(image));
            return container;
        }

        try {
            container.setImage(Thumbnails.of(image)
                    .size(maxLongEdge, maxLongEdge)
                    .keepAspectRatio(true)
                    .imageType(BufferedImage.TYPE_INT_RGB)
                    .asBufferedImage());
        } catch (IOException e) {
            throw new ProcessingException(name(), "Unable to resize " + container.getSource().getFileName(), e);
        }
        return container;
    }

    public int maxLongEdge() {
        return maxLongEdge;
    }
}

package github.sarthakdev143.photo_framer.processor;

import github.sarthakdev143.photo_framer.image.ImageContainer;

public interface ProcessorComponent {

    String name();

    ImageContainer process(ImageContainer container);
}

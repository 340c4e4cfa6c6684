package github.sarthakdev143.photo_framer.processor;

import github.sarthakdev143.photo_framer.exception.ProcessingException;
import github.sarthakdev143.photo_framer.image.ImageContainer;

import java.util.List;

public final class ProcessorChain {

    private final List<ProcessorComponent> components;

    public ProcessorChain(List<ProcessorComponent> components) {
        this.components = List.copyOf(components);
    }

    public static ProcessorChain empty() {
        return new ProcessorChain(List.of());
    }

    public List<ProcessorComponent> components() {
        return components;
    }

    public List<String> names() {
        return components.stream().map(ProcessorComponent::name).toList();
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    public ImageContainer process(ImageContainer container) {
        for (ProcessorComponent component : components) {
            try {
                component.process(container);
            } catch (ProcessingException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ProcessingException(
                        component.name(),
                        "Step " + component.name() + " failed for " + container.getSource().getFileName()
                                + ": " + e.getMessage(),
                        e);
            }
        }
        return container;
    }

    @Override
    public String toString() {
        return "ProcessorChain" + names();
    }
}

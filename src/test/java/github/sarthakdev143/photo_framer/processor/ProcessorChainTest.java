package github.sarthakdev143.photo_framer.processor;

import github.sarthakdev143.photo_framer.exception.ProcessingException;
import github.sarthakdev143.photo_framer.image.ImageContainer;
import github.sarthakdev143.photo_framer.image.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProcessorChainTest {

    @Test
    void runsStepsInInsertionOrder() {
        List<String> calls = new ArrayList<>();
        ProcessorChain chain = new ProcessorChain(List.of(
                recording("first", calls),
                recording("second", calls),
                recording("third", calls)));

        chain.process(container());

        assertThat(calls).containsExactly("first", "second", "third");
        assertThat(chain.names()).containsExactly("first", "second", "third");
    }

    @Test
    void emptyChainReturnsContainerUnchanged() {
        ImageContainer container = container();
        BufferedImage before = container.getImage();

        ImageContainer result = ProcessorChain.empty().process(container);

        assertThat(result).isSameAs(container);
        assertThat(result.getImage()).isSameAs(before);
        assertThat(ProcessorChain.empty().isEmpty()).isTrue();
    }

    @Test
    void failingStepAbortsChainAndNamesTheStep() {
        ProcessorComponent failing = mock(ProcessorComponent.class);
        when(failing.name()).thenReturn("broken");
        when(failing.process(any())).thenThrow(new IllegalStateException("boom"));
        ProcessorComponent after = mock(ProcessorComponent.class);
        ProcessorChain chain = new ProcessorChain(List.of(failing, after));

        assertThatThrownBy(() -> chain.process(container()))
                .isInstanceOf(ProcessingException.class)
                .hasMessageContaining("broken")
                .hasMessageContaining("photo.jpg")
                .hasMessageContaining("boom")
                .hasCauseInstanceOf(IllegalStateException.class)
                .extracting("step")
                .isEqualTo("broken");
        verify(after, never()).process(any());
    }

    @Test
    void processingExceptionsPassThroughUnwrapped() {
        ProcessingException original = new ProcessingException("resize", "resize failed", null);
        ProcessorComponent failing = mock(ProcessorComponent.class);
        when(failing.process(any())).thenThrow(original);

        assertThatThrownBy(() -> new ProcessorChain(List.of(failing)).process(container())).isSameAs(original);
    }

    @Test
    void componentsListIsImmutable() {
        List<ProcessorComponent> source = new ArrayList<>(List.of(new SquareProcessor()));
        ProcessorChain chain = new ProcessorChain(source);
        source.add(new MarginProcessor(0.1));

        assertThat(chain.components()).hasSize(1);
        assertThatThrownBy(() -> chain.components().add(new MarginProcessor(0.1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    private static ProcessorComponent recording(String name, List<String> calls) {
        return new ProcessorComponent() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ImageContainer process(ImageContainer container) {
                calls.add(name);
                return container;
            }
        };
    }

    private static ImageContainer container() {
        return new ImageContainer(Path.of("photo.jpg"), TestImages.image(20, 10), null);
    }
}

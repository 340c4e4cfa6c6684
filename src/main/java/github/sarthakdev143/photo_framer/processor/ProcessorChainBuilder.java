package github.sarthakdev143.photo_framer.processor;

import github.sarthakdev143.photo_framer.model.ProcessingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ProcessorChainBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ProcessorChainBuilder.class);

    private final LayoutRegistry layoutRegistry;

    public ProcessorChainBuilder(LayoutRegistry layoutRegistry) {
        this.layoutRegistry = layoutRegistry;
    }

    // Order is fixed: shadow, layout, margin, ratio padding. A blank layout gets the simple layout only.
    public ProcessorChain build(ProcessingConfig config) {
        List<ProcessorComponent> components = new ArrayList<>();

        if (config.hasLayout() && config.shadowEnabled() && !config.isSquareLayout()) {
            components.add(new ShadowProcessor());
        }

        components.add(layoutRegistry.create(config).orElseGet(() -> {
            if (!config.hasLayout()) {
                return new SimpleProcessor(config.maxLongEdge());
            }
            logger.warn("Unknown layout '{}'; using the simple layout", config.layoutType());
            return new SimpleProcessor(config.maxLongEdge());
        }));

        if (config.whiteMarginEnabled() && config.isWatermarkLayout()) {
            components.add(new MarginProcessor(config.whiteMarginRatio()));
        }

        if (config.hasLayout() && config.paddingWithOriginalRatioEnabled() && !config.isSquareLayout()) {
            components.add(new PaddingToOriginalRatioProcessor());
        }

        ProcessorChain chain = new ProcessorChain(components);
        logger.debug("Built processor chain {} for layout '{}'", chain.names(), config.layoutType());
        return chain;
    }
}

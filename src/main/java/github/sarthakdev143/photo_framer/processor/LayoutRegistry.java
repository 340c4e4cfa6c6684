package github.sarthakdev143.photo_framer.processor;

import github.sarthakdev143.photo_framer.model.LayoutType;
import github.sarthakdev143.photo_framer.model.ProcessingConfig;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@Component
public class LayoutRegistry {

    private final LogoRepository logos;

    public LayoutRegistry(LogoRepository logos) {
        this.logos = logos;
    }

    public List<String> layoutKeys() {
        return Arrays.stream(LayoutType.values()).map(LayoutType::key).toList();
    }

    public Optional<ProcessorComponent> create(ProcessingConfig config) {
        return LayoutType.fromKey(config.layoutType()).map(type -> create(type, config));
    }

    ProcessorComponent create(LayoutType type, ProcessingConfig config) {
        return switch (type) {
            case WATERMARK -> watermark(type, LogoPosition.NONE, WatermarkTheme.LIGHT, config);
            case WATERMARK_LEFT_LOGO -> watermark(type, LogoPosition.LEFT, WatermarkTheme.LIGHT, config);
            case WATERMARK_RIGHT_LOGO -> watermark(type, LogoPosition.RIGHT, WatermarkTheme.LIGHT, config);
            case DARK_WATERMARK_LEFT_LOGO -> watermark(type, LogoPosition.LEFT, WatermarkTheme.DARK, config);
            case DARK_WATERMARK_RIGHT_LOGO -> watermark(type, LogoPosition.RIGHT, WatermarkTheme.DARK, config);
            case SQUARE -> new SquareProcessor();
            case SIMPLE -> new SimpleProcessor(config.maxLongEdge());
        };
    }

    private WatermarkProcessor watermark(
            LayoutType type,
            LogoPosition logoPosition,
            WatermarkTheme theme,
            ProcessingConfig config) {
        return new WatermarkProcessor(
                type.key(),
                logoPosition,
                theme,
                config.elements(),
                config.logoEnabled(),
                logos);
    }
}

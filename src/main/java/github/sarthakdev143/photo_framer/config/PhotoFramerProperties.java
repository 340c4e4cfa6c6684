package github.sarthakdev143.photo_framer.config;

import github.sarthakdev143.photo_framer.model.Corner;
import github.sarthakdev143.photo_framer.model.ElementConfig;
import github.sarthakdev143.photo_framer.model.LayoutType;
import github.sarthakdev143.photo_framer.model.ProcessingConfig;
import github.sarthakdev143.photo_framer.model.TextField;
import github.sarthakdev143.photo_framer.scheduler.BatchJob;
import github.sarthakdev143.photo_framer.scheduler.BatchScheduler;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "photo-framer")
public class PhotoFramerProperties {

    private final Layout layout = new Layout();
    private final WhiteMargin whiteMargin = new WhiteMargin();
    private final Batch batch = new Batch();
    private boolean shadowEnabled;
    private boolean paddingWithOriginalRatioEnabled;
    private boolean useEquivalentFocalLength;
    private int quality = ProcessingConfig.DEFAULT_QUALITY;
    private int maxLongEdge;
    private Path logoDir = Path.of("logos");

    public ProcessingConfig toProcessingConfig() {
        Elements elements = layout.getElements();
        return ProcessingConfig.builder()
                .layoutType(layout.getType())
                .element(Corner.LEFT_TOP, elements.getLeftTop().toElementConfig())
                .element(Corner.RIGHT_TOP, elements.getRightTop().toElementConfig())
                .element(Corner.LEFT_BOTTOM, elements.getLeftBottom().toElementConfig())
                .element(Corner.RIGHT_BOTTOM, elements.getRightBottom().toElementConfig())
                .logoEnabled(layout.isLogoEnabled())
                .shadowEnabled(shadowEnabled)
                .whiteMarginEnabled(whiteMargin.isEnabled())
                .whiteMarginRatio(whiteMargin.getRatio())
                .paddingWithOriginalRatioEnabled(paddingWithOriginalRatioEnabled)
                .useEquivalentFocalLength(useEquivalentFocalLength)
                .quality(quality)
                .maxLongEdge(maxLongEdge)
                .build();
    }

    public Layout getLayout() {
        return layout;
    }

    public WhiteMargin getWhiteMargin() {
        return whiteMargin;
    }

    public Batch getBatch() {
        return batch;
    }

    public boolean isShadowEnabled() {
        return shadowEnabled;
    }

    public void setShadowEnabled(boolean shadowEnabled) {
        this.shadowEnabled = shadowEnabled;
    }

    public boolean isPaddingWithOriginalRatioEnabled() {
        return paddingWithOriginalRatioEnabled;
    }

    public void setPaddingWithOriginalRatioEnabled(boolean paddingWithOriginalRatioEnabled) {
        this.paddingWithOriginalRatioEnabled = paddingWithOriginalRatioEnabled;
    }

    public boolean isUseEquivalentFocalLength() {
        return useEquivalentFocalLength;
    }

    public void setUseEquivalentFocalLength(boolean useEquivalentFocalLength) {
        this.useEquivalentFocalLength = useEquivalentFocalLength;
    }

    public int getQuality() {
        return quality;
    }

    public void setQuality(int quality) {
        this.quality = quality;
    }

    public int getMaxLongEdge() {
        return maxLongEdge;
    }

    public void setMaxLongEdge(int maxLongEdge) {
        this.maxLongEdge = maxLongEdge;
    }

    public Path getLogoDir() {
        return logoDir;
    }

    public void setLogoDir(Path logoDir) {
        this.logoDir = logoDir;
    }

    public static class Layout {

        private String type = LayoutType.WATERMARK_LEFT_LOGO.key();
        private boolean logoEnabled = true;
        private final Elements elements = new Elements();

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public boolean isLogoEnabled() {
            return logoEnabled;
        }

        public void setLogoEnabled(boolean logoEnabled) {
            this.logoEnabled = logoEnabled;
        }

        public Elements getElements() {
            return elements;
        }
    }

    public static class Elements {

        private final Element leftTop = new Element(TextField.MODEL, true);
        private final Element rightTop = new Element(TextField.PARAM, true);
        private final Element leftBottom = new Element(TextField.LENS, false);
        private final Element rightBottom = new Element(TextField.DATETIME, false);

        public Element getLeftTop() {
            return leftTop;
        }

        public Element getRightTop() {
            return rightTop;
        }

        public Element getLeftBottom() {
            return leftBottom;
        }

        public Element getRightBottom() {
            return rightBottom;
        }
    }

    public static class Element {

        private String name;
        private String value;
        private boolean bold;

        public Element() {
            this(TextField.NONE, false);
        }

        Element(TextField name, boolean bold) {
            this.name = name.configValue();
            this.bold = bold;
        }

        ElementConfig toElementConfig() {
            return new ElementConfig(TextField.fromInput(name), value, bold);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getValue() {
            return value;
        }

        public void setValue(String value) {
            this.value = value;
        }

        public boolean isBold() {
            return bold;
        }

        public void setBold(boolean bold) {
            this.bold = bold;
        }
    }

    public static class WhiteMargin {

        private boolean enabled;
        private double ratio = ProcessingConfig.DEFAULT_WHITE_MARGIN_RATIO;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getRatio() {
            return ratio;
        }

        public void setRatio(double ratio) {
            this.ratio = ratio;
        }
    }

    public static class Batch {

        private int concurrency = BatchJob.DEFAULT_CONCURRENCY;
        private Duration statsPollInterval = BatchScheduler.DEFAULT_POLL_INTERVAL;

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public Duration getStatsPollInterval() {
            return statsPollInterval;
        }

        public void setStatsPollInterval(Duration statsPollInterval) {
            this.statsPollInterval = statsPollInterval;
        }
    }
}

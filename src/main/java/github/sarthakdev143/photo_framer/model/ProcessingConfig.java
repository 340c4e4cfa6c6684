package github.sarthakdev143.photo_framer.model;

import java.util.EnumMap;
import java.util.Map;

public record ProcessingConfig(
        String layoutType,
        Map<Corner, ElementConfig> elements,
        boolean shadowEnabled,
        boolean whiteMarginEnabled,
        double whiteMarginRatio,
        boolean paddingWithOriginalRatioEnabled,
        boolean useEquivalentFocalLength,
        boolean logoEnabled,
        int quality,
        int maxLongEdge) {

    public static final int DEFAULT_QUALITY = 100;
    public static final double DEFAULT_WHITE_MARGIN_RATIO = 0.03;

    public ProcessingConfig {
        layoutType = layoutType == null ? "" : layoutType.trim();
        EnumMap<Corner, ElementConfig> copy = new EnumMap<>(Corner.class);
        for (Corner corner : Corner.values()) {
            ElementConfig element = elements == null ? null : elements.get(corner);
            copy.put(corner, element == null ? ElementConfig.none() : element);
        }
        elements = Map.copyOf(copy);
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("quality must be between 1 and 100.");
        }
        if (whiteMarginRatio < 0.0 || whiteMarginRatio > 0.5) {
            throw new IllegalArgumentException("whiteMarginRatio must be between 0 and 0.5.");
        }
        if (maxLongEdge < 0) {
            throw new IllegalArgumentException("maxLongEdge must not be negative.");
        }
    }

    public ElementConfig element(Corner corner) {
        return elements.get(corner);
    }

    public boolean hasLayout() {
        return !layoutType.isEmpty();
    }

    public boolean isSquareLayout() {
        return LayoutType.SQUARE_KEY.equals(layoutType);
    }

    public boolean isWatermarkLayout() {
        return hasLayout() && layoutType.contains(LayoutType.WATERMARK_MARKER);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private String layoutType = LayoutType.WATERMARK_LEFT_LOGO.key();
        private final Map<Corner, ElementConfig> elements = new EnumMap<>(Corner.class);
        private boolean shadowEnabled;
        private boolean whiteMarginEnabled;
        private double whiteMarginRatio = DEFAULT_WHITE_MARGIN_RATIO;
        private boolean paddingWithOriginalRatioEnabled;
        private boolean useEquivalentFocalLength;
        private boolean logoEnabled = true;
        private int quality = DEFAULT_QUALITY;
        private int maxLongEdge;

        private Builder() {
        }

        public Builder layoutType(String layoutType) {
            this.layoutType = layoutType;
            return this;
        }

        public Builder element(Corner corner, ElementConfig element) {
            elements.put(corner, element);
            return this;
        }

        public Builder shadowEnabled(boolean shadowEnabled) {
            this.shadowEnabled = shadowEnabled;
            return this;
        }

        public Builder whiteMarginEnabled(boolean whiteMarginEnabled) {
            this.whiteMarginEnabled = whiteMarginEnabled;
            return this;
        }

        public Builder whiteMarginRatio(double whiteMarginRatio) {
            this.whiteMarginRatio = whiteMarginRatio;
            return this;
        }

        public Builder paddingWithOriginalRatioEnabled(boolean paddingWithOriginalRatioEnabled) {
            this.paddingWithOriginalRatioEnabled = paddingWithOriginalRatioEnabled;
            return this;
        }

        public Builder useEquivalentFocalLength(boolean useEquivalentFocalLength) {
            this.useEquivalentFocalLength = useEquivalentFocalLength;
            return this;
        }

        public Builder logoEnabled(boolean logoEnabled) {
            this.logoEnabled = logoEnabled;
            return this;
        }

        public Builder quality(int quality) {
            this.quality = quality;
            return this;
        }

        public Builder maxLongEdge(int maxLongEdge) {
            this.maxLongEdge = maxLongEdge;
            return this;
        }

        public ProcessingConfig build() {
            return new ProcessingConfig(
                    layoutType,
                    elements,
                    shadowEnabled,
                    whiteMarginEnabled,
                    whiteMarginRatio,
                    paddingWithOriginalRatioEnabled,
                    useEquivalentFocalLength,
                    logoEnabled,
                    quality,
                    maxLongEdge);
        }
    }
}

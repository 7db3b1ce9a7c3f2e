package com.example.filmarchive.domain.enumtype;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed histogram-clip / contrast-limit pairs. Declaration order is the evaluation order
 * of auto-quality, which also decides ties.
 */
public enum EnhancementPreset {

    GENTLE("gentle", 0.3D, 1.0D),
    BALANCED("balanced", 0.5D, 1.5D),
    AGGRESSIVE("aggressive", 0.7D, 2.0D);

    private final String value;
    private final double histogramClip;
    private final double claheClipLimit;

    EnhancementPreset(String value, double histogramClip, double claheClipLimit) {
        this.value = value;
        this.histogramClip = histogramClip;
        this.claheClipLimit = claheClipLimit;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getHistogramClip() {
        return histogramClip;
    }

    public double getClaheClipLimit() {
        return claheClipLimit;
    }
}

package com.example.sidelight.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Grading parameters in the raw processor's own parameter space. This is the only shape that
 * ever gets serialized, and only after it went through the sanitizer.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class NativeParameterSet {

    // [Exposure]
    private double compensation;
    private int contrast;
    private int saturation;
    private int black;
    private int highlightCompr;

    // [Shadows & Highlights]
    private int shadowRecovery;
    private int highlightRecovery;

    // [White Balance], tint is multiplicative (1.0 = neutral)
    private int temperature;
    @Builder.Default
    private double tint = 1.0;

    // [Luminance Curve]
    private int labBrightness;
    private int labContrast;
    private int labChromaticity;

    // [SharpenMicro]
    @JsonProperty("sharpenmicro_strength")
    private int sharpenMicroStrength;
    @JsonProperty("sharpenmicro_contrast")
    private int sharpenMicroContrast;
    @JsonProperty("sharpenmicro_uniformity")
    private int sharpenMicroUniformity;

    private int dehazeStrength;

    // [Vibrance]
    private int vibPastels;
    private int vibSaturated;

    // [Sharpening]
    private boolean sharpenEnabled;
    private int sharpenAmount;
    private double sharpenRadius;
    private int sharpenContrast;

    // [SharpenEdge]
    @JsonProperty("sharpenedge_enabled")
    private boolean sharpenEdgeEnabled;
    @JsonProperty("sharpenedge_passes")
    private int sharpenEdgePasses;
    @JsonProperty("sharpenedge_strength")
    private int sharpenEdgeStrength;

    // [PostDemosaicSharpening]
    private boolean captureSharpenEnabled;
    private int captureSharpenContrast;
    private double captureSharpenRadius;

    // [Denoise]
    private int nrLuminance;
    private int nrChrominance;

    // curves, points in [0,1] (or 0..255, normalized downstream)
    private List<CurvePoint> toneCurve;
    private List<CurvePoint> rgbCurveRed;
    private List<CurvePoint> rgbCurveGreen;
    private List<CurvePoint> rgbCurveBlue;

    // [ColorToning], per-channel offsets
    private int colorToningShadowR;
    private int colorToningShadowG;
    private int colorToningShadowB;
    private int colorToningHighlightR;
    private int colorToningHighlightG;
    private int colorToningHighlightB;
    private int colorToningBalance;

    private int vignetteAmount;

    public NativeParameterSet copy() {
        return toBuilder().build();
    }
}

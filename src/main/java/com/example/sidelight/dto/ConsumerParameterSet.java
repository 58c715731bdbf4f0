package com.example.sidelight.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Slider-style grading parameters as returned by the analysis step (relative, creative values).
 * Every field is optional and zero by default. Nothing here is trusted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConsumerParameterSet {

    // basic tone
    private double exposure;     // stops
    private int contrast;
    private int highlights;
    private int shadows;
    private int whites;
    private int blacks;

    // presence
    private int texture;
    private int clarity;
    private int dehaze;
    private int vibrance;
    private int saturation;

    // white balance
    private int temperature;     // Kelvin
    private int tint;            // -150 green .. +150 magenta

    // detail
    private int sharpness;
    private int luminanceNoiseReduction;
    private int colorNoiseReduction;

    private int vignetteAmount;

    // HSL, hue
    private int hueRed;
    private int hueOrange;
    private int hueYellow;
    private int hueGreen;
    private int hueAqua;
    private int hueBlue;
    private int huePurple;
    private int hueMagenta;

    // HSL, saturation
    private int saturationRed;
    private int saturationOrange;
    private int saturationYellow;
    private int saturationGreen;
    private int saturationAqua;
    private int saturationBlue;
    private int saturationPurple;
    private int saturationMagenta;

    // HSL, luminance
    private int luminanceRed;
    private int luminanceOrange;
    private int luminanceYellow;
    private int luminanceGreen;
    private int luminanceAqua;
    private int luminanceBlue;
    private int luminancePurple;
    private int luminanceMagenta;

    // split toning
    private int splitShadowHue;
    private int splitShadowSaturation;
    private int splitHighlightHue;
    private int splitHighlightSaturation;
    private int splitBalance;
}

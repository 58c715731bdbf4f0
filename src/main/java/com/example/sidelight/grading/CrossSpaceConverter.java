package com.example.sidelight.grading;

import com.example.sidelight.dto.ConsumerParameterSet;
import com.example.sidelight.dto.NativeParameterSet;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps slider-style parameters into the raw processor's native parameter space.
 * <p>
 * Output is left unclamped wherever a formula does not bound it already; the
 * {@link ParameterSanitizer} owns the final ranges and always runs after this.
 */
@Component
@RequiredArgsConstructor
public class CrossSpaceConverter {

    /** The native engine renders darker than the slider model at the same exposure. */
    static final double EXPOSURE_BIAS = 0.25;
    static final double WHITES_EXPOSURE_GAIN = 0.005;
    static final double CONTRAST_SCALE = 0.8;
    static final double SATURATION_SCALE = 0.85;
    static final double DEHAZE_SCALE = 0.7;
    static final int DEFAULT_TEMPERATURE = 5500;
    static final int DEFAULT_SHARPEN_AMOUNT = 100;
    static final double DEFAULT_SHARPEN_RADIUS = 0.75;
    static final int DEFAULT_MICRO_UNIFORMITY = 50;

    private final ToneCurveBuilder toneCurveBuilder;
    private final HueToningConverter hueToningConverter;

    public NativeParameterSet convert(ConsumerParameterSet params) {
        NativeParameterSet.NativeParameterSetBuilder out = NativeParameterSet.builder();

        // Exposure
        double compensation = params.getExposure() + EXPOSURE_BIAS;
        if (params.getWhites() > 0) {
            compensation += params.getWhites() * WHITES_EXPOSURE_GAIN;
        }
        out.compensation(compensation)
                .contrast((int) (params.getContrast() * CONTRAST_SCALE))
                .saturation((int) (params.getSaturation() * SATURATION_SCALE));

        // White balance
        out.temperature(params.getTemperature() == 0 ? DEFAULT_TEMPERATURE : params.getTemperature())
                .tint(convertTint(params.getTint()));

        // Black point, highlights, shadows. Negative sliders recover/deepen, positive lift.
        int black = 0;
        if (params.getBlacks() < 0) {
            black = -params.getBlacks() * 50;
        }
        int highlightCompr = 0;
        int highlightRecovery = 0;
        if (params.getHighlights() < 0) {
            highlightCompr = -params.getHighlights() * 3;
            highlightRecovery = Math.min(100, -params.getHighlights());
        }
        int shadowRecovery = 0;
        if (params.getShadows() > 0) {
            shadowRecovery = params.getShadows();
        } else if (params.getShadows() < 0) {
            black += -params.getShadows() * 20;
        }
        out.black(black)
                .highlightCompr(highlightCompr)
                .highlightRecovery(highlightRecovery)
                .shadowRecovery(shadowRecovery);

        // Clarity and texture both land on micro-contrast
        int microStrength = 0;
        int microContrast = 0;
        if (params.getClarity() > 0) {
            microStrength = params.getClarity() / 2;
            microContrast = params.getClarity() / 4;
        }
        if (params.getTexture() > 0) {
            microStrength += params.getTexture() / 4;
        }
        out.sharpenMicroStrength(microStrength)
                .sharpenMicroContrast(microContrast)
                .sharpenMicroUniformity(DEFAULT_MICRO_UNIFORMITY);

        // Saturated colours get half the vibrance of pastels
        out.vibPastels(params.getVibrance())
                .vibSaturated(params.getVibrance() / 2)
                .dehazeStrength((int) (params.getDehaze() * DEHAZE_SCALE));

        int sharpenAmount = params.getSharpness() == 0 ? DEFAULT_SHARPEN_AMOUNT : params.getSharpness() * 3;
        out.sharpenAmount(sharpenAmount)
                .sharpenRadius(DEFAULT_SHARPEN_RADIUS);

        // Lab adjustments have no direct slider counterpart
        int labBrightness = 0;
        if (params.getWhites() != 0 || params.getBlacks() != 0) {
            labBrightness = clamp((params.getWhites() - params.getBlacks()) / 10, -20, 20);
        }
        out.labBrightness(labBrightness)
                .labContrast(params.getClarity() / 10)
                .labChromaticity(params.getVibrance() / 5);

        out.nrLuminance(params.getLuminanceNoiseReduction())
                .nrChrominance(params.getColorNoiseReduction())
                .vignetteAmount(params.getVignetteAmount())
                .toneCurve(toneCurveBuilder.build(params));

        if (params.getSplitShadowSaturation() != 0 || params.getSplitHighlightSaturation() != 0) {
            int[] shadow = hueToningConverter.toChannelOffsets(params.getSplitShadowHue(), params.getSplitShadowSaturation());
            int[] highlight = hueToningConverter.toChannelOffsets(params.getSplitHighlightHue(), params.getSplitHighlightSaturation());
            out.colorToningShadowR(shadow[0])
                    .colorToningShadowG(shadow[1])
                    .colorToningShadowB(shadow[2])
                    .colorToningHighlightR(highlight[0])
                    .colorToningHighlightG(highlight[1])
                    .colorToningHighlightB(highlight[2])
                    .colorToningBalance(50 + params.getSplitBalance() / 2);
        }

        return out.build();
    }

    /**
     * Slider tint (-150 green .. +150 magenta) to a multiplicative green factor:
     * 0 is neutral 1.0, +150 is 0.5, -150 is 2.0.
     */
    static double convertTint(int tint) {
        if (tint == 0) {
            return 1.0;
        }
        double value = Math.pow(0.5, tint / 150.0);
        return Math.max(0.5, Math.min(2.0, value));
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}

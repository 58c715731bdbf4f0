package com.example.sidelight.grading;

import com.example.sidelight.dto.CurvePoint;
import com.example.sidelight.dto.NativeParameterSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * The mandatory gate between any native parameter set and the serializer. Forces every bounded
 * field into its empirically safe range. Idempotent: sanitizing a sanitized set changes nothing.
 * <p>
 * Fields not listed in {@link #RULES} pass through untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParameterSanitizer {

    static final double MIN_COMPENSATION = 0.25;
    static final double SAFE_COMPENSATION = 0.4;
    static final int MAX_COLOR_TONING = 12;

    static final double MIDTONE_LOW = 0.4;
    static final double MIDTONE_HIGH = 0.6;
    static final double MIDTONE_MAX_DROP = 0.1;

    static final List<SanitizeRule> RULES = List.of(
            // below 0.25 the value is broken, not merely low
            SanitizeRule.resetBelow("compensation", MIN_COMPENSATION, SAFE_COMPENSATION, 1.5,
                    NativeParameterSet::getCompensation, NativeParameterSet::setCompensation),
            SanitizeRule.clamp("contrast", -20, 30,
                    NativeParameterSet::getContrast, NativeParameterSet::setContrast),
            SanitizeRule.ceiling("black", 200,
                    NativeParameterSet::getBlack, NativeParameterSet::setBlack),
            SanitizeRule.ceiling("highlightCompr", 180,
                    NativeParameterSet::getHighlightCompr, NativeParameterSet::setHighlightCompr),
            SanitizeRule.ceiling("highlightRecovery", 70,
                    NativeParameterSet::getHighlightRecovery, NativeParameterSet::setHighlightRecovery),
            SanitizeRule.ceiling("shadowRecovery", 60,
                    NativeParameterSet::getShadowRecovery, NativeParameterSet::setShadowRecovery),
            // negative Lab brightness darkens the whole frame
            SanitizeRule.clamp("labBrightness", 0, 20,
                    NativeParameterSet::getLabBrightness, NativeParameterSet::setLabBrightness),
            SanitizeRule.clamp("labContrast", 0, 40,
                    NativeParameterSet::getLabContrast, NativeParameterSet::setLabContrast),
            SanitizeRule.clamp("labChromaticity", 0, 45,
                    NativeParameterSet::getLabChromaticity, NativeParameterSet::setLabChromaticity),
            SanitizeRule.clamp("dehazeStrength", 0, 30,
                    NativeParameterSet::getDehazeStrength, NativeParameterSet::setDehazeStrength),
            SanitizeRule.clamp("temperature", 4200, 7500,
                    NativeParameterSet::getTemperature, NativeParameterSet::setTemperature),
            SanitizeRule.clampFloat("tint", 0.90, 1.10,
                    NativeParameterSet::getTint, NativeParameterSet::setTint),
            // wider split toning puts casts on skin tones
            SanitizeRule.clamp("colorToningShadowR", -MAX_COLOR_TONING, MAX_COLOR_TONING,
                    NativeParameterSet::getColorToningShadowR, NativeParameterSet::setColorToningShadowR),
            SanitizeRule.clamp("colorToningShadowG", -MAX_COLOR_TONING, MAX_COLOR_TONING,
                    NativeParameterSet::getColorToningShadowG, NativeParameterSet::setColorToningShadowG),
            SanitizeRule.clamp("colorToningShadowB", -MAX_COLOR_TONING, MAX_COLOR_TONING,
                    NativeParameterSet::getColorToningShadowB, NativeParameterSet::setColorToningShadowB),
            SanitizeRule.clamp("colorToningHighlightR", -MAX_COLOR_TONING, MAX_COLOR_TONING,
                    NativeParameterSet::getColorToningHighlightR, NativeParameterSet::setColorToningHighlightR),
            SanitizeRule.clamp("colorToningHighlightG", -MAX_COLOR_TONING, MAX_COLOR_TONING,
                    NativeParameterSet::getColorToningHighlightG, NativeParameterSet::setColorToningHighlightG),
            SanitizeRule.clamp("colorToningHighlightB", -MAX_COLOR_TONING, MAX_COLOR_TONING,
                    NativeParameterSet::getColorToningHighlightB, NativeParameterSet::setColorToningHighlightB),
            // full desaturation is a legitimate monochrome look, oversaturation is not
            SanitizeRule.clamp("saturation", -100, 25,
                    NativeParameterSet::getSaturation, NativeParameterSet::setSaturation),
            SanitizeRule.ceiling("vibPastels", 45,
                    NativeParameterSet::getVibPastels, NativeParameterSet::setVibPastels),
            SanitizeRule.ceiling("vibSaturated", 25,
                    NativeParameterSet::getVibSaturated, NativeParameterSet::setVibSaturated),
            SanitizeRule.ceiling("sharpenMicroStrength", 50,
                    NativeParameterSet::getSharpenMicroStrength, NativeParameterSet::setSharpenMicroStrength),
            SanitizeRule.ceiling("sharpenMicroContrast", 40,
                    NativeParameterSet::getSharpenMicroContrast, NativeParameterSet::setSharpenMicroContrast)
    );

    private final CurveValidator curveValidator;

    /**
     * @return a sanitized copy; {@code params} itself is left untouched
     */
    public NativeParameterSet sanitize(NativeParameterSet params) {
        NativeParameterSet safe = params.copy();
        for (SanitizeRule rule : RULES) {
            double before = rule.getGetter().applyAsDouble(safe);
            if (rule.apply(safe)) {
                log.debug("Sanitized {}: {} -> {}", rule.getField(), before, rule.getGetter().applyAsDouble(safe));
            }
        }
        safe.setToneCurve(sanitizeToneCurve(safe.getToneCurve()));
        return safe;
    }

    /**
     * Lifts midtone points that sit more than 0.1 below the diagonal back onto it, then clamps
     * every coordinate to [0, 1]. A curve with non-finite coordinates is replaced outright.
     */
    List<CurvePoint> sanitizeToneCurve(List<CurvePoint> curve) {
        if (curve == null || curve.isEmpty()) {
            return curve;
        }
        List<CurvePoint> normalized = curveValidator.normalize(curve);
        if (normalized.stream().anyMatch(p -> !p.isFinite())) {
            log.debug("Tone curve {} has non-finite points, using safe default", curve);
            return CurveType.TONE.getSafeDefault();
        }

        List<CurvePoint> result = new ArrayList<>(normalized.size());
        for (CurvePoint p : normalized) {
            double x = p.getX();
            double y = p.getY();
            if (x >= MIDTONE_LOW && x <= MIDTONE_HIGH && y < x - MIDTONE_MAX_DROP) {
                y = x;
            }
            result.add(CurvePoint.of(CurveValidator.clampUnit(x), CurveValidator.clampUnit(y)));
        }
        return result;
    }
}

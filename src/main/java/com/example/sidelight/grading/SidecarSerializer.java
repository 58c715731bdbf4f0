package com.example.sidelight.grading;

import com.example.sidelight.dto.CurvePoint;
import com.example.sidelight.dto.NativeParameterSet;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders a sanitized native parameter set into the raw processor's PP3 sidecar format.
 * <p>
 * Every bounded value is clamped once more on the way out. On top of that, three policies depend
 * on the source being a raw capture: white balance, luminance denoise and the micro-contrast cap.
 * All sharpening stages are written disabled whatever was requested.
 */
@Component
@RequiredArgsConstructor
public class SidecarSerializer {

    static final String FORMAT_VERSION = "346";
    static final String BUILD = "Sidelight";
    static final String NEUTRAL_CURVE = "0;";

    static final int NON_RAW_MICRO_STRENGTH_CAP = 20;
    static final int DEHAZE_GRAIN_THRESHOLD = 10;
    static final int DEHAZE_GRAIN_LUMA = 5;
    static final int DEFAULT_CHROMA_DENOISE = 10;

    private final CurveValidator curveValidator;

    public SidecarDocument serialize(NativeParameterSet params, boolean raw) {
        SidecarDocument doc = new SidecarDocument();

        doc.section("Version")
                .put("Version", FORMAT_VERSION)
                .put("Build", BUILD);

        doc.section("General")
                .put("Rank", 0)
                .put("ColorLabel", 0)
                .put("InTrash", false);

        doc.section("Exposure")
                .put("Enabled", true)
                .put("Compensation", fixed(params.getCompensation(), 2))
                .put("Contrast", clamp(params.getContrast(), -50, 50))
                .put("Saturation", clamp(params.getSaturation(), -50, 50))
                .put("Black", clamp(params.getBlack(), 0, 300))
                .put("HighlightCompr", clamp(params.getHighlightCompr(), 0, 200))
                .put("HighlightComprThreshold", 0)
                .put("HighlightReconstruction", true)
                .put("HighlightReconstructionMethod", "blend");

        int shadows = clamp(params.getShadowRecovery(), 0, 100);
        int highlights = clamp(params.getHighlightRecovery(), 0, 100);
        doc.section("Shadows & Highlights")
                .put("Enabled", shadows > 0 || highlights > 0)
                .put("Highlights", highlights)
                .put("HighlightTonalWidth", 70)
                .put("Shadows", shadows)
                .put("ShadowTonalWidth", 30)
                .put("Radius", 40);

        doc.section("ToneCurve")
                .put("Enabled", true)
                .put("CurveMode", "FilmLike")
                .put("Curve", curve(params.getToneCurve(), CurveType.TONE))
                .put("Curve2", NEUTRAL_CURVE);

        writeWhiteBalance(doc, params, raw);

        doc.section("Luminance Curve")
                .put("Enabled", true)
                .put("Brightness", clamp(params.getLabBrightness(), -20, 20))
                .put("Contrast", clamp(params.getLabContrast(), 0, 40))
                .put("Chromaticity", clamp(params.getLabChromaticity(), 0, 40))
                .put("LCurve", NEUTRAL_CURVE);

        doc.section("Vibrance")
                .put("Enabled", true)
                .put("Pastels", clamp(params.getVibPastels(), -30, 50))
                .put("Saturated", clamp(params.getVibSaturated(), -30, 30))
                .put("PSThreshold", "0;75;")
                .put("ProtectSkins", true)
                .put("AvoidColorShift", true)
                .put("PastSatTog", true);

        String red = curve(params.getRgbCurveRed(), CurveType.RED);
        String green = curve(params.getRgbCurveGreen(), CurveType.GREEN);
        String blue = curve(params.getRgbCurveBlue(), CurveType.BLUE);
        doc.section("RGB Curves")
                .put("Enabled", !(red.equals(NEUTRAL_CURVE) && green.equals(NEUTRAL_CURVE) && blue.equals(NEUTRAL_CURVE)))
                .put("LumaMode", false)
                .put("rCurve", red)
                .put("gCurve", green)
                .put("bCurve", blue);

        writeColorToning(doc, params);
        writeDenoise(doc, params, raw);

        doc.section("Impulse Denoise")
                .put("Enabled", true)
                .put("Threshold", 50);

        if (raw) {
            doc.section("RAW")
                    .put("CA", true)
                    .put("CAAutoIterations", 2)
                    .put("HotPixelFilter", true)
                    .put("DeadPixelFilter", true);
            doc.section("RAW Bayer")
                    .put("Method", "rcd")
                    .put("Border", 4)
                    .put("ImageNum", 1)
                    .put("CcSteps", 0);
        }

        // Output, edge and capture sharpening all produce artifacts; never enable them
        doc.section("Sharpening").put("Enabled", false);
        doc.section("SharpenEdge").put("Enabled", false);
        writeMicroContrast(doc, params, raw);
        doc.section("PostDemosaicSharpening").put("Enabled", false);

        SidecarDocument.Section dehaze = doc.section("Dehaze");
        if (params.getDehazeStrength() != 0) {
            dehaze.put("Enabled", true)
                    .put("Strength", clamp(params.getDehazeStrength(), -100, 100));
        } else {
            dehaze.put("Enabled", false);
        }

        doc.section("Vignetting Correction")
                .put("Amount", clamp(params.getVignetteAmount(), -100, 100))
                .put("Radius", 50)
                .put("Strength", 1)
                .put("CenterX", 0)
                .put("CenterY", 0);

        doc.section("Color Management")
                .put("InputProfile", "(cameraICC)")
                .put("ToneCurve", false)
                .put("ApplyLookTable", true)
                .put("ApplyBaselineExposureOffset", true)
                .put("ApplyHueSatMap", true)
                .put("WorkingProfile", "ProPhoto")
                .put("OutputProfile", "RTv4_sRGB")
                .put("OutputProfileIntent", "Relative")
                .put("OutputBPC", true);

        doc.section("Resize").put("Enabled", false);

        return doc;
    }

    /**
     * Rendered images already carry their white balance; raw-domain values on top of them cause
     * heavy casts, so the section is written disabled for them.
     */
    private void writeWhiteBalance(SidecarDocument doc, NativeParameterSet params, boolean raw) {
        SidecarDocument.Section wb = doc.section("White Balance");
        if (!raw) {
            wb.put("Enabled", false);
            return;
        }
        int temperature = params.getTemperature();
        if (temperature < 3500 || temperature > 9000) {
            temperature = 5500;
        }
        double tint = params.getTint();
        if (!(tint >= 0.7 && tint <= 1.5)) {
            tint = 1.0;
        }
        wb.put("Enabled", true)
                .put("Setting", "Custom")
                .put("Temperature", temperature)
                .put("Green", fixed(tint, 3))
                .put("Equal", 1);
    }

    private void writeColorToning(SidecarDocument doc, NativeParameterSet params) {
        int[] offsets = {
                params.getColorToningShadowR(), params.getColorToningShadowG(), params.getColorToningShadowB(),
                params.getColorToningHighlightR(), params.getColorToningHighlightG(), params.getColorToningHighlightB()
        };
        boolean enabled = false;
        for (int offset : offsets) {
            enabled |= offset != 0;
        }
        doc.section("ColorToning")
                .put("Enabled", enabled)
                .put("Method", "Splitco")
                .put("Redlow", clamp(offsets[0], -100, 100))
                .put("Greenlow", clamp(offsets[1], -100, 100))
                .put("Bluelow", clamp(offsets[2], -100, 100))
                .put("Redhigh", clamp(offsets[3], -100, 100))
                .put("Greenhigh", clamp(offsets[4], -100, 100))
                .put("Bluehigh", clamp(offsets[5], -100, 100))
                .put("Balance", clamp(params.getColorToningBalance(), -100, 100));
    }

    private void writeDenoise(SidecarDocument doc, NativeParameterSet params, boolean raw) {
        int chroma = params.getNrChrominance() > 0 ? params.getNrChrominance() : DEFAULT_CHROMA_DENOISE;

        int luma = 0;
        if (raw) {
            luma = params.getNrLuminance();
        } else if (params.getDehazeStrength() > DEHAZE_GRAIN_THRESHOLD) {
            // dehaze brings out grain that the suppressed denoiser would otherwise leave
            luma = DEHAZE_GRAIN_LUMA;
        }

        doc.section("Denoise")
                .put("Enabled", true)
                .put("Chrominance", clamp(chroma, 0, 50))
                .put("ChrominanceMethod", "Automatic")
                .put("Luminance", clamp(luma, 0, 50));
    }

    private void writeMicroContrast(SidecarDocument doc, NativeParameterSet params, boolean raw) {
        SidecarDocument.Section micro = doc.section("SharpenMicro");
        int strength = params.getSharpenMicroStrength();
        if (strength <= 0) {
            micro.put("Enabled", false);
            return;
        }
        if (!raw) {
            // halos on already demosaiced, compressed images
            strength = Math.min(strength, NON_RAW_MICRO_STRENGTH_CAP);
        }
        micro.put("Enabled", true)
                .put("Strength", clamp(strength, 0, 100))
                .put("Contrast", clamp(params.getSharpenMicroContrast(), 0, 100))
                .put("Uniformity", clamp(params.getSharpenMicroUniformity(), 0, 100));
    }

    /**
     * Validates and formats a curve as {@code 1;x1;y1;x2;y2;...;}. Absent and identity curves are
     * written as the neutral {@code 0;}.
     */
    String curve(List<CurvePoint> points, CurveType type) {
        if (points == null || points.isEmpty()) {
            return NEUTRAL_CURVE;
        }
        List<CurvePoint> validated = curveValidator.validate(points, type);
        if (curveValidator.isIdentity(validated)) {
            return NEUTRAL_CURVE;
        }
        return formatCurve(validated);
    }

    static String formatCurve(List<CurvePoint> points) {
        if (points.isEmpty()) {
            return NEUTRAL_CURVE;
        }
        StringBuilder sb = new StringBuilder("1;");
        for (CurvePoint p : points) {
            sb.append(fixed(p.getX(), 4)).append(';')
                    .append(fixed(p.getY(), 4)).append(';');
        }
        return sb.toString();
    }

    static String fixed(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}

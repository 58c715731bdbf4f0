package com.example.sidelight.grading;

import com.example.sidelight.dto.CurvePoint;
import com.example.sidelight.dto.NativeParameterSet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SidecarSerializerTest {

    private static final String TONE_FALLBACK =
            "1;0.0000;0.0000;0.1500;0.1200;0.5000;0.5200;0.8500;0.8800;1.0000;1.0000;";

    private final SidecarSerializer serializer = new SidecarSerializer(new CurveValidator());

    private static NativeParameterSet.NativeParameterSetBuilder base() {
        return NativeParameterSet.builder().compensation(0.4).temperature(5500).tint(1.0);
    }

    private static String value(SidecarDocument doc, String section, String key) {
        return doc.find(section).orElseThrow(() -> new AssertionError("missing [" + section + "]")).get(key);
    }

    @Test
    void renderedSource_disablesWhiteBalance() {
        SidecarDocument doc = serializer.serialize(base().temperature(6500).build(), false);

        SidecarDocument.Section wb = doc.find("White Balance").orElseThrow();
        assertEquals("false", wb.get("Enabled"));
        assertNull(wb.get("Temperature"));
    }

    @Test
    void rawSource_writesCustomWhiteBalance() {
        SidecarDocument doc = serializer.serialize(base().temperature(6200).tint(0.95).build(), true);

        assertEquals("true", value(doc, "White Balance", "Enabled"));
        assertEquals("Custom", value(doc, "White Balance", "Setting"));
        assertEquals("6200", value(doc, "White Balance", "Temperature"));
        assertEquals("0.950", value(doc, "White Balance", "Green"));
    }

    @Test
    void rawWhiteBalance_outsideSaneRange_fallsBackToNeutral() {
        SidecarDocument doc = serializer.serialize(base().temperature(12000).tint(1.8).build(), true);

        assertEquals("5500", value(doc, "White Balance", "Temperature"));
        assertEquals("1.000", value(doc, "White Balance", "Green"));
    }

    @Test
    void renderedSource_capsMicroContrast() {
        NativeParameterSet params = base().sharpenMicroStrength(45).sharpenMicroContrast(30).sharpenMicroUniformity(50).build();

        assertEquals("20", value(serializer.serialize(params, false), "SharpenMicro", "Strength"));
        assertEquals("45", value(serializer.serialize(params, true), "SharpenMicro", "Strength"));
    }

    @Test
    void noMicroContrast_disablesTheSection() {
        SidecarDocument doc = serializer.serialize(base().build(), true);

        assertEquals("false", value(doc, "SharpenMicro", "Enabled"));
        assertNull(value(doc, "SharpenMicro", "Strength"));
    }

    @Test
    void lumaDenoise_dependsOnSourceAndDehaze() {
        assertEquals("5", value(serializer.serialize(base().dehazeStrength(15).build(), false), "Denoise", "Luminance"));
        assertEquals("0", value(serializer.serialize(base().dehazeStrength(10).nrLuminance(30).build(), false), "Denoise", "Luminance"));
        assertEquals("30", value(serializer.serialize(base().nrLuminance(30).build(), true), "Denoise", "Luminance"));
    }

    @Test
    void chromaDenoise_defaultsWhenUnset() {
        assertEquals("10", value(serializer.serialize(base().build(), true), "Denoise", "Chrominance"));
        assertEquals("50", value(serializer.serialize(base().nrChrominance(80).build(), true), "Denoise", "Chrominance"));
    }

    @Test
    void sharpeningStages_areAlwaysDisabled() {
        NativeParameterSet params = base().sharpenEnabled(true).sharpenAmount(300)
                .sharpenEdgeEnabled(true).captureSharpenEnabled(true).build();

        SidecarDocument doc = serializer.serialize(params, true);

        assertEquals("false", value(doc, "Sharpening", "Enabled"));
        assertEquals("false", value(doc, "SharpenEdge", "Enabled"));
        assertEquals("false", value(doc, "PostDemosaicSharpening", "Enabled"));
    }

    @Test
    void degenerateToneCurve_isWrittenAsTheFallback() {
        NativeParameterSet params = base()
                .toneCurve(List.of(CurvePoint.of(0, 0.9), CurvePoint.of(0.5, 0.1), CurvePoint.of(1, 0.05)))
                .build();

        assertEquals(TONE_FALLBACK, value(serializer.serialize(params, true), "ToneCurve", "Curve"));
    }

    @Test
    void neutralCurves_areWrittenAsZero() {
        SidecarDocument doc = serializer.serialize(base()
                .rgbCurveGreen(List.of(CurvePoint.of(0, 0), CurvePoint.of(1, 1)))
                .build(), true);

        assertEquals("0;", value(doc, "ToneCurve", "Curve"));
        assertEquals("0;", value(doc, "RGB Curves", "gCurve"));
        assertEquals("false", value(doc, "RGB Curves", "Enabled"));
    }

    @Test
    void channelCurve_isFormattedWithFourDecimals() {
        SidecarDocument doc = serializer.serialize(base()
                .rgbCurveBlue(List.of(CurvePoint.of(0, 0.02), CurvePoint.of(0.5, 0.47), CurvePoint.of(1, 1)))
                .build(), true);

        assertEquals("1;0.0000;0.0200;0.5000;0.4700;1.0000;1.0000;", value(doc, "RGB Curves", "bCurve"));
        assertEquals("true", value(doc, "RGB Curves", "Enabled"));
    }

    @Test
    void boundedValues_areClampedOnTheWayOut() {
        NativeParameterSet params = base().contrast(90).black(900).highlightCompr(500)
                .labBrightness(-60).vibSaturated(70).dehazeStrength(150).build();

        SidecarDocument doc = serializer.serialize(params, true);

        assertEquals("50", value(doc, "Exposure", "Contrast"));
        assertEquals("300", value(doc, "Exposure", "Black"));
        assertEquals("200", value(doc, "Exposure", "HighlightCompr"));
        assertEquals("-20", value(doc, "Luminance Curve", "Brightness"));
        assertEquals("30", value(doc, "Vibrance", "Saturated"));
        assertEquals("100", value(doc, "Dehaze", "Strength"));
    }

    @Test
    void colorToning_enabledOnlyWithOffsets() {
        assertEquals("false", value(serializer.serialize(base().build(), true), "ColorToning", "Enabled"));

        SidecarDocument doc = serializer.serialize(base().colorToningShadowB(8).colorToningBalance(50).build(), true);
        assertEquals("true", value(doc, "ColorToning", "Enabled"));
        assertEquals("8", value(doc, "ColorToning", "Bluelow"));
    }

    @Test
    void rawSections_onlyForRawSources() {
        assertTrue(serializer.serialize(base().build(), true).find("RAW Bayer").isPresent());
        assertFalse(serializer.serialize(base().build(), false).find("RAW").isPresent());
    }

    @Test
    void sectionOrder_isStable() {
        List<String> names = serializer.serialize(base().build(), false).getSections().stream()
                .map(SidecarDocument.Section::getName)
                .collect(Collectors.toList());

        assertEquals(List.of("Version", "General", "Exposure", "Shadows & Highlights", "ToneCurve", "White Balance",
                "Luminance Curve", "Vibrance", "RGB Curves", "ColorToning", "Denoise", "Impulse Denoise",
                "Sharpening", "SharpenEdge", "SharpenMicro", "PostDemosaicSharpening", "Dehaze",
                "Vignetting Correction", "Color Management", "Resize"), names);
    }

    @Test
    void render_usesDotDecimals_whateverTheDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            String text = serializer.serialize(base().compensation(0.45).build(), true).render();

            assertTrue(text.startsWith("[Version]\nVersion=346\n"), text);
            assertTrue(text.contains("\nCompensation=0.45\n"), text);
            assertTrue(text.contains("\n\n[Exposure]\n"), text);
        } finally {
            Locale.setDefault(previous);
        }
    }
}

package com.example.sidelight.grading;

import com.example.sidelight.dto.ConsumerParameterSet;
import com.example.sidelight.dto.NativeParameterSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CrossSpaceConverterTest {

    private final CrossSpaceConverter converter = new CrossSpaceConverter(new ToneCurveBuilder(), new HueToningConverter());

    @Test
    void negativeBlacks_becomeAnUnclampedBlackPoint() {
        ConsumerParameterSet params = ConsumerParameterSet.builder().blacks(-40).build();

        NativeParameterSet out = converter.convert(params);

        assertEquals(2000, out.getBlack());
        assertEquals(0.25, out.getCompensation(), 1e-9);
    }

    @Test
    void positiveWhites_addExposureAndLabBrightness() {
        NativeParameterSet out = converter.convert(ConsumerParameterSet.builder().exposure(0.5).whites(40).build());

        assertEquals(0.95, out.getCompensation(), 1e-9);
        assertEquals(4, out.getLabBrightness());
    }

    @Test
    void tint_mapsExponentially() {
        assertEquals(1.0, CrossSpaceConverter.convertTint(0), 1e-9);
        assertEquals(0.5, CrossSpaceConverter.convertTint(150), 1e-9);
        assertEquals(2.0, CrossSpaceConverter.convertTint(-150), 1e-9);
        assertEquals(0.5, CrossSpaceConverter.convertTint(400), 1e-9);
        assertEquals(Math.pow(0.5, 0.5), CrossSpaceConverter.convertTint(75), 1e-9);
    }

    @Test
    void missingTemperature_defaultsToDaylight() {
        assertEquals(5500, converter.convert(new ConsumerParameterSet()).getTemperature());
        assertEquals(6500, converter.convert(ConsumerParameterSet.builder().temperature(6500).build()).getTemperature());
    }

    @Test
    void negativeHighlights_compressAndRecover() {
        NativeParameterSet out = converter.convert(ConsumerParameterSet.builder().highlights(-30).build());

        assertEquals(90, out.getHighlightCompr());
        assertEquals(30, out.getHighlightRecovery());
    }

    @Test
    void shadows_liftWhenPositive_deepenBlackWhenNegative() {
        assertEquals(40, converter.convert(ConsumerParameterSet.builder().shadows(40).build()).getShadowRecovery());

        NativeParameterSet deep = converter.convert(ConsumerParameterSet.builder().blacks(-10).shadows(-10).build());
        assertEquals(700, deep.getBlack());
        assertEquals(0, deep.getShadowRecovery());
    }

    @Test
    void clarityAndTexture_driveMicroContrast() {
        NativeParameterSet out = converter.convert(ConsumerParameterSet.builder().clarity(40).texture(20).build());

        assertEquals(25, out.getSharpenMicroStrength());
        assertEquals(10, out.getSharpenMicroContrast());
        assertEquals(50, out.getSharpenMicroUniformity());
        assertEquals(4, out.getLabContrast());
    }

    @Test
    void vibrance_favoursPastels() {
        NativeParameterSet out = converter.convert(ConsumerParameterSet.builder().vibrance(30).build());

        assertEquals(30, out.getVibPastels());
        assertEquals(15, out.getVibSaturated());
        assertEquals(6, out.getLabChromaticity());
    }

    @Test
    void scaledSliders() {
        NativeParameterSet out = converter.convert(ConsumerParameterSet.builder().contrast(50).dehaze(100).build());

        assertEquals(40, out.getContrast());
        assertEquals(70, out.getDehazeStrength());
    }

    @Test
    void sharpness_defaultsWhenUnset() {
        assertEquals(100, converter.convert(new ConsumerParameterSet()).getSharpenAmount());
        assertEquals(60, converter.convert(ConsumerParameterSet.builder().sharpness(20).build()).getSharpenAmount());
    }

    @Test
    void splitToning_becomesChannelOffsets() {
        ConsumerParameterSet params = ConsumerParameterSet.builder()
                .splitShadowHue(0).splitShadowSaturation(10)
                .splitHighlightHue(240).splitHighlightSaturation(10)
                .splitBalance(20)
                .build();

        NativeParameterSet out = converter.convert(params);

        assertEquals(10, out.getColorToningShadowR());
        assertEquals(-10, out.getColorToningShadowG());
        assertEquals(-10, out.getColorToningShadowB());
        assertEquals(-10, out.getColorToningHighlightR());
        assertEquals(-10, out.getColorToningHighlightG());
        assertEquals(10, out.getColorToningHighlightB());
        assertEquals(60, out.getColorToningBalance());
    }

    @Test
    void noSplitSaturation_leavesColorToningOff() {
        NativeParameterSet out = converter.convert(ConsumerParameterSet.builder().splitShadowHue(200).build());

        assertEquals(0, out.getColorToningShadowB());
        assertEquals(0, out.getColorToningBalance());
    }

    @Test
    void toneCurveIsAlwaysBuilt() {
        assertEquals(5, converter.convert(new ConsumerParameterSet()).getToneCurve().size());
    }
}

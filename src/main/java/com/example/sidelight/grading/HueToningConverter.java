package com.example.sidelight.grading;

import org.springframework.stereotype.Component;

/**
 * Turns a polar split-toning colour (hue in degrees, saturation 0..100) into the per-channel
 * RGB offsets the colour toning section expects, each in [-100, 100].
 */
@Component
public class HueToningConverter {

    static final int MAX_OFFSET = 100;

    /**
     * @return {@code {r, g, b}} offsets; all zero when saturation is zero
     */
    public int[] toChannelOffsets(int hue, int saturation) {
        int sat = Math.max(0, Math.min(100, saturation));
        if (sat == 0) {
            return new int[]{0, 0, 0};
        }

        double h6 = Math.floorMod(hue, 360) / 60.0;
        int sector = (int) h6;
        double f = h6 - sector;

        double[] rgb = switch (sector) {
            case 0 -> new double[]{1, f, 0};
            case 1 -> new double[]{1 - f, 1, 0};
            case 2 -> new double[]{0, 1, f};
            case 3 -> new double[]{0, 1 - f, 1};
            case 4 -> new double[]{f, 0, 1};
            default -> new double[]{1, 0, 1 - f};
        };

        return new int[]{offset(rgb[0], sat), offset(rgb[1], sat), offset(rgb[2], sat)};
    }

    private static int offset(double channel, int saturation) {
        long value = Math.round((channel - 0.5) * 2 * saturation);
        return (int) Math.max(-MAX_OFFSET, Math.min(MAX_OFFSET, value));
    }
}

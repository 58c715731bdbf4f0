package com.example.sidelight.grading;

import com.example.sidelight.dto.CurvePoint;

import java.util.List;

/**
 * Which curve a point list is destined for. Each type carries the fixed curve that replaces a
 * broken one of its kind.
 */
public enum CurveType {

    /** Gentle S-curve. */
    TONE(List.of(
            CurvePoint.of(0, 0),
            CurvePoint.of(0.15, 0.12),
            CurvePoint.of(0.5, 0.52),
            CurvePoint.of(0.85, 0.88),
            CurvePoint.of(1, 1))),

    /** Slight warmth. */
    RED(List.of(CurvePoint.of(0, 0), CurvePoint.of(0.5, 0.52), CurvePoint.of(1, 1))),

    GREEN(CurveValidator.IDENTITY),

    /** Slight warmth by pulling blue. */
    BLUE(List.of(CurvePoint.of(0, 0), CurvePoint.of(0.5, 0.48), CurvePoint.of(1, 1)));

    private final List<CurvePoint> safeDefault;

    CurveType(List<CurvePoint> safeDefault) {
        this.safeDefault = safeDefault;
    }

    public List<CurvePoint> getSafeDefault() {
        return safeDefault;
    }
}

package com.example.sidelight.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One control point of a tone or channel curve. x is the input value, y the mapped output,
 * both nominally in [0, 1]. Serialized as a two element JSON array {@code [x, y]}.
 */
@Getter
@EqualsAndHashCode
public final class CurvePoint {

    private final double x;
    private final double y;

    public CurvePoint(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public static CurvePoint of(double x, double y) {
        return new CurvePoint(x, y);
    }

    /**
     * Binds {@code [x, y]}. Extra coordinates are ignored; a point missing its output value is
     * bound as non-finite so the curve is rejected downstream instead of reading it as y = 0.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CurvePoint fromArray(double[] coordinates) {
        if (coordinates == null || coordinates.length < 2) {
            double x = coordinates != null && coordinates.length == 1 ? coordinates[0] : Double.NaN;
            return new CurvePoint(x, Double.NaN);
        }
        return new CurvePoint(coordinates[0], coordinates[1]);
    }

    @JsonValue
    public double[] toArray() {
        return new double[]{x, y};
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}

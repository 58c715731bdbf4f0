package com.example.sidelight.grading;

import com.example.sidelight.dto.NativeParameterSet;
import lombok.Getter;

import java.util.function.ObjDoubleConsumer;
import java.util.function.ObjIntConsumer;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;

/**
 * One row of the sanitizer's bound table: a native field, its floor and ceiling (either may be
 * absent), and what happens to a value below the floor.
 */
@Getter
public final class SanitizeRule {

    public enum Policy {
        /** Out of range values snap to the nearest bound. */
        CLAMP,
        /** Values below the floor are considered broken and replaced by a fixed default. */
        RESET_BELOW_FLOOR
    }

    private final String field;
    private final Double floor;
    private final Double ceiling;
    private final Policy policy;
    private final double resetValue;
    private final ToDoubleFunction<NativeParameterSet> getter;
    private final ObjDoubleConsumer<NativeParameterSet> setter;

    private SanitizeRule(String field, Double floor, Double ceiling, Policy policy, double resetValue,
                         ToDoubleFunction<NativeParameterSet> getter, ObjDoubleConsumer<NativeParameterSet> setter) {
        this.field = field;
        this.floor = floor;
        this.ceiling = ceiling;
        this.policy = policy;
        this.resetValue = resetValue;
        this.getter = getter;
        this.setter = setter;
    }

    static SanitizeRule clampFloat(String field, double floor, double ceiling,
                                   ToDoubleFunction<NativeParameterSet> getter, ObjDoubleConsumer<NativeParameterSet> setter) {
        return new SanitizeRule(field, floor, ceiling, Policy.CLAMP, floor, getter, setter);
    }

    static SanitizeRule clamp(String field, int floor, int ceiling,
                              ToIntFunction<NativeParameterSet> getter, ObjIntConsumer<NativeParameterSet> setter) {
        return new SanitizeRule(field, (double) floor, (double) ceiling, Policy.CLAMP, floor,
                getter::applyAsInt, (p, v) -> setter.accept(p, (int) v));
    }

    static SanitizeRule ceiling(String field, int ceiling,
                                ToIntFunction<NativeParameterSet> getter, ObjIntConsumer<NativeParameterSet> setter) {
        return new SanitizeRule(field, null, (double) ceiling, Policy.CLAMP, 0,
                getter::applyAsInt, (p, v) -> setter.accept(p, (int) v));
    }

    static SanitizeRule resetBelow(String field, double floor, double resetValue, double ceiling,
                                   ToDoubleFunction<NativeParameterSet> getter, ObjDoubleConsumer<NativeParameterSet> setter) {
        return new SanitizeRule(field, floor, ceiling, Policy.RESET_BELOW_FLOOR, resetValue, getter, setter);
    }

    /**
     * Applies this rule to {@code params} in place.
     *
     * @return true when the field had to be changed
     */
    boolean apply(NativeParameterSet params) {
        double value = getter.applyAsDouble(params);
        double fixed = fix(value);
        if (Double.compare(fixed, value) == 0) {
            return false;
        }
        setter.accept(params, fixed);
        return true;
    }

    double fix(double value) {
        if (!Double.isFinite(value)) {
            // NaN never compares, treat it (and infinities) as badly out of range
            if (policy == Policy.RESET_BELOW_FLOOR) {
                return resetValue;
            }
            if (value == Double.POSITIVE_INFINITY && ceiling != null) {
                return ceiling;
            }
            return floor != null ? floor : ceiling;
        }
        if (floor != null && value < floor) {
            return policy == Policy.RESET_BELOW_FLOOR ? resetValue : floor;
        }
        if (ceiling != null && value > ceiling) {
            return ceiling;
        }
        return value;
    }

    boolean isSatisfiedBy(double value) {
        return Double.isFinite(value)
                && (floor == null || value >= floor)
                && (ceiling == null || value <= ceiling);
    }
}

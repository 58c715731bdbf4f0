package com.example.sidelight.grading;

import com.example.sidelight.dto.CurvePoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalizes and validates explicit curves before they are written out.
 * <p>
 * A curve that would render predominantly dark, washed out, or inverted is swapped for the
 * fixed safe default of its {@link CurveType}. Broken curves are never patched point by point:
 * a locally corrected curve can still hide a global inversion.
 */
@Slf4j
@Component
public class CurveValidator {

    static final List<CurvePoint> IDENTITY = List.of(CurvePoint.of(0, 0), CurvePoint.of(1, 1));

    /** Any coordinate above this means the curve was written in 0..255. */
    static final double BYTE_DOMAIN_THRESHOLD = 1.5;

    static final double BLACK_WINDOW = 0.05;
    static final double WHITE_WINDOW = 0.95;
    static final double MID_WINDOW_LOW = 0.45;
    static final double MID_WINDOW_HIGH = 0.55;

    // Empirical thresholds, kept as tuned
    static final double MID_MIN = 0.25;
    static final double MID_MAX = 0.85;
    static final double BLACK_MAX = 0.5;
    static final double WHITE_MIN = 0.5;

    public List<CurvePoint> validate(List<CurvePoint> points, CurveType type) {
        List<CurvePoint> curve = normalize(points);
        if (curve.size() < 2) {
            return IDENTITY;
        }

        Optional<String> problem = findProblem(curve);
        if (problem.isPresent()) {
            log.warn("Replacing {} curve {} with safe default: {}", type, points, problem.get());
            return type.getSafeDefault();
        }

        List<CurvePoint> clamped = new ArrayList<>(curve.size());
        for (CurvePoint p : curve) {
            clamped.add(CurvePoint.of(clampUnit(p.getX()), clampUnit(p.getY())));
        }
        return clamped;
    }

    /**
     * Drops null entries and rescales the whole curve from 0..255 to 0..1 when any coordinate
     * exceeds {@value #BYTE_DOMAIN_THRESHOLD}.
     */
    public List<CurvePoint> normalize(List<CurvePoint> points) {
        if (points == null) {
            return List.of();
        }
        List<CurvePoint> present = points.stream().filter(Objects::nonNull).toList();

        boolean byteDomain = present.stream()
                .anyMatch(p -> p.getX() > BYTE_DOMAIN_THRESHOLD || p.getY() > BYTE_DOMAIN_THRESHOLD);
        if (!byteDomain) {
            return present;
        }
        return present.stream()
                .map(p -> CurvePoint.of(p.getX() / 255.0, p.getY() / 255.0))
                .toList();
    }

    /**
     * Inspects the black point, white point and midpoint landmarks of an already normalized
     * curve. Coordinates are clamped to [0, 1] before inspection.
     *
     * @return the reason the curve is unsafe, or empty when it is fine
     */
    public Optional<String> findProblem(List<CurvePoint> curve) {
        double blackY = 0;
        double whiteY = 1;
        double midY = 0.5;

        for (CurvePoint p : curve) {
            if (!p.isFinite()) {
                return Optional.of("non-finite coordinate " + p);
            }
            double x = clampUnit(p.getX());
            double y = clampUnit(p.getY());
            if (x <= BLACK_WINDOW) {
                blackY = y;
            }
            if (x >= WHITE_WINDOW) {
                whiteY = y;
            }
            if (x >= MID_WINDOW_LOW && x <= MID_WINDOW_HIGH) {
                midY = y;
            }
        }

        if (midY < MID_MIN) {
            return Optional.of("midpoint too dark");
        } else if (midY > MID_MAX) {
            return Optional.of("midpoint too bright");
        } else if (blackY > BLACK_MAX) {
            return Optional.of("black point too high");
        } else if (whiteY < WHITE_MIN) {
            return Optional.of("white point too low");
        } else if (blackY > whiteY) {
            return Optional.of("inverted curve");
        }
        return Optional.empty();
    }

    public boolean isIdentity(List<CurvePoint> curve) {
        return IDENTITY.equals(curve);
    }

    static double clampUnit(double value) {
        return Math.max(0, Math.min(1, value));
    }
}

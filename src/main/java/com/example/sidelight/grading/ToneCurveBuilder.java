package com.example.sidelight.grading;

import com.example.sidelight.dto.ConsumerParameterSet;
import com.example.sidelight.dto.CurvePoint;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Approximates the implicit tone curve of the slider model (blacks, shadows, highlights, whites,
 * contrast) with an explicit five point curve.
 * <p>
 * The rules below run in list order and accumulate on shared points. Every nudge is re-clamped
 * to its own window, which keeps the curve monotone enough that no slider combination can
 * invert it.
 */
@Component
public class ToneCurveBuilder {

    static final double[] ANCHORS = {0.0, 0.25, 0.5, 0.75, 1.0};

    static final List<Rule> RULES = List.of(
            new Rule("blacks", ConsumerParameterSet::getBlacks, 200.0, 0, 0.5, 0.0, 0.15),
            new Rule("blacks", ConsumerParameterSet::getBlacks, 200.0, 1, 0.3, 0.05, 0.4),
            new Rule("shadows", ConsumerParameterSet::getShadows, 150.0, 1, 0.15, 0.1, 0.45),
            new Rule("shadows", ConsumerParameterSet::getShadows, 150.0, 2, 0.05, 0.35, 0.65),
            new Rule("highlights", ConsumerParameterSet::getHighlights, 150.0, 3, 0.1, 0.6, 0.9),
            new Rule("highlights", ConsumerParameterSet::getHighlights, 150.0, 4, 0.05, 0.85, 1.0),
            new Rule("whites", ConsumerParameterSet::getWhites, 200.0, 3, 0.05, 0.6, 0.95),
            new Rule("whites", ConsumerParameterSet::getWhites, 200.0, 4, 0.1, 0.9, 1.0),
            // S-curve: pull the shadow anchor down, push the highlight anchor up
            new Rule("contrast", ConsumerParameterSet::getContrast, 200.0, 1, -0.08, 0.05, 0.4),
            new Rule("contrast", ConsumerParameterSet::getContrast, 200.0, 3, 0.08, 0.6, 0.95)
    );

    public List<CurvePoint> build(ConsumerParameterSet params) {
        double[] y = ANCHORS.clone();
        for (Rule rule : RULES) {
            int slider = rule.getSlider().applyAsInt(params);
            if (slider == 0) {
                continue;
            }
            double offset = slider / rule.getDivisor();
            y[rule.getPoint()] = clamp(y[rule.getPoint()] + offset * rule.getWeight(), rule.getMin(), rule.getMax());
        }

        List<CurvePoint> curve = new ArrayList<>(ANCHORS.length);
        for (int i = 0; i < ANCHORS.length; i++) {
            curve.add(CurvePoint.of(ANCHORS[i], y[i]));
        }
        return curve;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * One perturbation: {@code y[point] = clamp(y[point] + slider / divisor * weight, min, max)}.
     */
    @Value
    static class Rule {
        String name;
        ToIntFunction<ConsumerParameterSet> slider;
        double divisor;
        int point;
        double weight;
        double min;
        double max;
    }
}

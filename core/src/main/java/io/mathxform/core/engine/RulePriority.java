package io.mathxform.core.engine;

import java.util.Map;

/** Tie-break weights used when two suggestions render to the same markup. Higher wins. */
final class RulePriority {

    private static final Map<String, Integer> PRIORITIES = Map.of(
            "conjugate_linearity", 3,
            "conjugate_multiplicative", 3,
            "modulus_square", 3,
            "trig_double_angle_sin", 2,
            "trig_identity_sin2", 2,
            "complete_square", 2);

    private RulePriority() {}

    static int of(String ruleName) {
        return PRIORITIES.getOrDefault(ruleName, 0);
    }
}

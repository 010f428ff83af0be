package io.mathxform.core.engine;

import io.mathxform.core.algebra.Deriv;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.algebra.Functions;
import io.mathxform.core.spi.AlgebraEngine;
import java.util.List;

/**
 * Evaluates a selection that is itself an unevaluated derivative. A derivative nested inside a
 * larger selection is left alone. Results containing trigonometric functions are expanded; anything
 * else is simplified.
 */
public final class DerivativeGenerator implements SuggestionGenerator {

    static final String ID = "differentiate_do_it";
    static final String RULE_NAME = "differentiate";

    @Override
    public List<Suggestion> generate(Expr target, AlgebraEngine engine) {
        if (!(target instanceof Deriv derivative)) {
            return List.of();
        }
        Expr evaluated = engine.evaluateDerivatives(target);
        Expr result = Functions.containsTrigonometric(evaluated) ? engine.expand(evaluated) : engine.simplify(evaluated);
        if (result.equals(target)) {
            return List.of();
        }
        String label = "Differentiate with respect to " + derivative.variable().name();
        return List.of(new Suggestion(ID, label, RULE_NAME, result));
    }
}

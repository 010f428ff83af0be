package io.mathxform.core.engine;

import io.mathxform.core.algebra.Add;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.algebra.Fn;
import io.mathxform.core.algebra.Functions;
import io.mathxform.core.algebra.Mul;
import io.mathxform.core.spi.AlgebraEngine;
import java.util.ArrayList;
import java.util.List;

/**
 * Distributes complex conjugation over sums and products of any length, and folds a sum or product
 * of conjugates back into one conjugate.
 */
public final class ConjugateDistributionGenerator implements SuggestionGenerator {

    static final String LINEARITY = "conjugate_linearity";
    static final String MULTIPLICATIVE = "conjugate_multiplicative";

    @Override
    public List<Suggestion> generate(Expr target, AlgebraEngine engine) {
        if (target instanceof Fn fn && Functions.CONJUGATE.equals(fn.name())) {
            if (fn.argument() instanceof Add sum) {
                return List.of(new Suggestion(
                        LINEARITY + "_auto",
                        "Distribute conjugate over sum: conj(a+b+…) → conj(a) + conj(b) + …",
                        LINEARITY,
                        new Add(conjugateEach(sum.terms(), engine))));
            }
            if (fn.argument() instanceof Mul product) {
                return List.of(new Suggestion(
                        MULTIPLICATIVE + "_auto",
                        "Distribute conjugate over product: conj(ab…) → conj(a) conj(b) …",
                        MULTIPLICATIVE,
                        new Mul(conjugateEach(product.factors(), engine))));
            }
            return List.of();
        }
        if (target instanceof Add sum && allConjugates(sum.terms())) {
            return List.of(new Suggestion(
                    LINEARITY + "_reverse_auto",
                    "Combine conjugates: conj(a) + conj(b) + … → conj(a+b+…)",
                    LINEARITY,
                    new Fn(Functions.CONJUGATE, new Add(unwrapEach(sum.terms())))));
        }
        if (target instanceof Mul product && allConjugates(product.factors())) {
            return List.of(new Suggestion(
                    MULTIPLICATIVE + "_reverse_auto",
                    "Combine conjugates: conj(a) conj(b) … → conj(ab…)",
                    MULTIPLICATIVE,
                    new Fn(Functions.CONJUGATE, new Mul(unwrapEach(product.factors())))));
        }
        return List.of();
    }

    /** Conjugates each operand; numbers and the imaginary unit fold immediately. */
    private static List<Expr> conjugateEach(List<Expr> operands, AlgebraEngine engine) {
        List<Expr> result = new ArrayList<>(operands.size());
        for (Expr operand : operands) {
            result.add(engine.simplify(new Fn(Functions.CONJUGATE, operand)));
        }
        return result;
    }

    private static boolean allConjugates(List<Expr> operands) {
        return operands.size() > 1 && operands.stream().allMatch(ConjugateDistributionGenerator::isConjugate);
    }

    private static boolean isConjugate(Expr expr) {
        return expr instanceof Fn fn && Functions.CONJUGATE.equals(fn.name());
    }

    private static List<Expr> unwrapEach(List<Expr> conjugates) {
        List<Expr> result = new ArrayList<>(conjugates.size());
        for (Expr conjugate : conjugates) {
            result.add(((Fn) conjugate).argument());
        }
        return result;
    }
}

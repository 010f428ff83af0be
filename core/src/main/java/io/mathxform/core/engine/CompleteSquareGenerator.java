package io.mathxform.core.engine;

import io.mathxform.core.algebra.Add;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.algebra.Mul;
import io.mathxform.core.algebra.Num;
import io.mathxform.core.algebra.Pow;
import io.mathxform.core.algebra.Sym;
import io.mathxform.core.spi.AlgebraEngine;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Completes the square of a quadratic: {@code ax^2 + bx + c -> a(x + b/(2a))^2 - b^2/(4a) + c}.
 *
 * <p>
 * The variable is {@code x} when it occurs, otherwise the alphabetically first free symbol.
 */
public final class CompleteSquareGenerator implements SuggestionGenerator {

    static final String ID = "complete_square_auto";
    static final String RULE_NAME = "complete_square";
    static final String LABEL = "Complete the square: ax^2+bx+c → a(x + b/(2a))^2 - b^2/(4a) + c";

    private static final String PREFERRED_VARIABLE = "x";
    private static final int QUADRATIC = 2;

    @Override
    public List<Suggestion> generate(Expr target, AlgebraEngine engine) {
        SortedSet<String> symbols = engine.freeSymbols(target);
        if (symbols.isEmpty()) {
            return List.of();
        }
        Sym variable = new Sym(symbols.contains(PREFERRED_VARIABLE) ? PREFERRED_VARIABLE : symbols.first());
        Optional<List<Expr>> coefficients = engine.polynomialCoefficients(target, variable, QUADRATIC);
        if (coefficients.isEmpty() || coefficients.get().size() != 3) {
            return List.of();
        }
        Expr c = coefficients.get().get(0);
        Expr b = coefficients.get().get(1);
        Expr a = coefficients.get().get(2);

        Expr shift = Mul.of(b, new Pow(Mul.of(Num.TWO, a), Num.MINUS_ONE));
        Expr square = new Pow(Add.of(variable, shift), Num.TWO);
        Expr offset = Mul.of(Num.MINUS_ONE, new Pow(b, Num.TWO), new Pow(Mul.of(Num.of(4), a), Num.MINUS_ONE));
        Expr completed = engine.simplify(Add.of(Mul.of(a, square), offset, c));

        if (completed.equals(target)) {
            return List.of();
        }
        return List.of(new Suggestion(ID, LABEL, RULE_NAME, completed));
    }
}

package io.mathxform.core.algebra;

import io.mathxform.core.spi.AlgebraEngine;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/** The bundled {@link AlgebraEngine}: exact rational arithmetic over immutable expression records. */
public final class SymbolicAlgebraEngine implements AlgebraEngine {

    public static final String ID = "symbolic";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Expr parse(String source) {
        return ExpressionParser.parse(source);
    }

    @Override
    public Expr simplify(Expr expr) {
        return Normalizer.normalize(expr);
    }

    @Override
    public Expr expand(Expr expr) {
        return Expander.expand(expr);
    }

    @Override
    public Expr differentiate(Expr expr, Sym variable) {
        return Differentiator.differentiate(expr, variable);
    }

    @Override
    public Expr evaluateDerivatives(Expr expr) {
        return Differentiator.evaluateDerivatives(expr);
    }

    @Override
    public Optional<Binding> match(Expr target, Expr pattern) {
        return PatternMatcher.match(target, pattern);
    }

    @Override
    public Expr substitute(Expr template, Binding binding) {
        return Substitution.substitute(template, binding);
    }

    @Override
    public SortedSet<String> freeSymbols(Expr expr) {
        return Exprs.freeSymbols(expr);
    }

    @Override
    public Optional<List<Expr>> polynomialCoefficients(Expr expr, Sym variable, int maxDegree) {
        return Polynomials.coefficients(expr, variable, maxDegree);
    }

    @Override
    public boolean supportsFunction(String name) {
        return Functions.isNative(name);
    }

    @Override
    public String printContent(Expr expr) {
        return ContentMathPrinter.print(expr);
    }

    @Override
    public String printPresentation(Expr expr) {
        return PresentationMathPrinter.print(expr);
    }
}

package io.mathxform.core.adapter;

import io.mathxform.core.algebra.Add;
import io.mathxform.core.algebra.Const;
import io.mathxform.core.algebra.Deriv;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.algebra.Fn;
import io.mathxform.core.algebra.Functions;
import io.mathxform.core.algebra.Mul;
import io.mathxform.core.algebra.Num;
import io.mathxform.core.algebra.Pow;
import io.mathxform.core.algebra.Sym;
import io.mathxform.core.model.Call;
import io.mathxform.core.model.Derivative;
import io.mathxform.core.model.ExpressionNode;
import io.mathxform.core.model.Identifier;
import io.mathxform.core.model.NumberLiteral;
import io.mathxform.core.model.Power;
import io.mathxform.core.model.Product;
import io.mathxform.core.model.Sum;
import io.mathxform.core.spi.AlgebraEngine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts expression trees parsed from markup into the algebra engine's representation. The
 * result is normalized by the engine. Never fails on unknown function names: they become opaque
 * function applications.
 */
public final class AlgebraAdapter {

    private static final Sym DEFAULT_VARIABLE = new Sym("x");

    private final AlgebraEngine engine;

    public AlgebraAdapter(AlgebraEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    public Expr toAlgebraExpr(ExpressionNode node) {
        return engine.simplify(convert(node));
    }

    private Expr convert(ExpressionNode node) {
        if (node instanceof Identifier identifier) {
            String name = identifier.name();
            return "i".equals(name) || "I".equals(name) ? Const.IMAGINARY_UNIT : new Sym(name);
        }
        if (node instanceof NumberLiteral number) {
            return number(number.literal());
        }
        if (node instanceof Power power) {
            return new Pow(convert(power.base()), convert(power.exponent()));
        }
        if (node instanceof Sum sum) {
            return new Add(convertAll(sum.terms()));
        }
        if (node instanceof Product product) {
            return new Mul(convertAll(product.factors()));
        }
        if (node instanceof Call call) {
            return function(Functions.canonicalName(call.function()), convert(call.argument()));
        }
        if (node instanceof Derivative derivative) {
            Sym variable = derivative.variable() instanceof Identifier identifier
                    ? new Sym(identifier.name())
                    : DEFAULT_VARIABLE;
            return new Deriv(convert(derivative.body()), variable);
        }
        throw new IllegalArgumentException("Unknown node type: " + node.getClass().getName());
    }

    private List<Expr> convertAll(List<ExpressionNode> nodes) {
        List<Expr> converted = new ArrayList<>(nodes.size());
        for (ExpressionNode node : nodes) {
            converted.add(convert(node));
        }
        return converted;
    }

    /** Integer, then rational ({@code p/q} or decimal), else an opaque symbol named by the literal. */
    private static Expr number(String literal) {
        try {
            return Num.parse(literal);
        } catch (NumberFormatException | ArithmeticException e) {
            return new Sym(literal);
        }
    }

    private Expr function(String name, Expr argument) {
        switch (name) {
            case Functions.SEC:
                return engine.supportsFunction(name)
                        ? new Fn(name, argument)
                        : new Pow(new Fn(Functions.COS, argument), Num.MINUS_ONE);
            case Functions.CSC:
                return engine.supportsFunction(name)
                        ? new Fn(name, argument)
                        : new Pow(new Fn(Functions.SIN, argument), Num.MINUS_ONE);
            case Functions.COT:
                return engine.supportsFunction(name)
                        ? new Fn(name, argument)
                        : Mul.of(new Fn(Functions.COS, argument), new Pow(new Fn(Functions.SIN, argument), Num.MINUS_ONE));
            default:
                return new Fn(name, argument);
        }
    }
}

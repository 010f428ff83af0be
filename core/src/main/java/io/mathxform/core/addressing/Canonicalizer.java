package io.mathxform.core.addressing;

import io.mathxform.core.model.Call;
import io.mathxform.core.model.Derivative;
import io.mathxform.core.model.ExpressionNode;
import io.mathxform.core.model.Identifier;
import io.mathxform.core.model.NumberLiteral;
import io.mathxform.core.model.Power;
import io.mathxform.core.model.Product;
import io.mathxform.core.model.Sum;
import java.util.List;
import java.util.StringJoiner;

/**
 * Order-sensitive canonical string of an expression node:
 *
 * <pre>
 * ident:NAME
 * number:LITERAL
 * power(BASE,EXPONENT)
 * add(T1,...,Tn)
 * call:FN(ARG)
 * call:times(add(F1,...,Fn))     products
 * diff(VAR,BODY)
 * </pre>
 *
 * <p>
 * The grammar is part of the node-id wire contract.
 */
public final class Canonicalizer {

    private Canonicalizer() {}

    public static String canonicalize(ExpressionNode node) {
        if (node instanceof Identifier identifier) {
            return "ident:" + identifier.name();
        }
        if (node instanceof NumberLiteral number) {
            return "number:" + number.literal();
        }
        List<String> children = node.children().stream().map(Canonicalizer::canonicalize).toList();
        return compose(node, children);
    }

    /** Builds a composite node's canonical string from its children's, in {@code children()} order. */
    static String compose(ExpressionNode node, List<String> children) {
        if (node instanceof Identifier || node instanceof NumberLiteral) {
            return canonicalize(node);
        }
        if (node instanceof Power) {
            return "power(" + children.get(0) + "," + children.get(1) + ")";
        }
        if (node instanceof Sum) {
            return join("add(", children);
        }
        if (node instanceof Product) {
            return "call:" + Product.FUNCTION_NAME + "(" + join("add(", children) + ")";
        }
        if (node instanceof Call call) {
            return "call:" + call.function() + "(" + children.get(0) + ")";
        }
        if (node instanceof Derivative) {
            return "diff(" + children.get(0) + "," + children.get(1) + ")";
        }
        throw new IllegalArgumentException("Unknown node type: " + node.getClass().getName());
    }

    private static String join(String prefix, List<String> parts) {
        StringJoiner joiner = new StringJoiner(",", prefix, ")");
        parts.forEach(joiner::add);
        return joiner.toString();
    }
}

package io.mathxform.core.algebra;

import io.mathxform.core.error.ReplacementRenderException;
import io.mathxform.core.markup.MathMl;
import java.util.Map;

/** Serializes an expression as Content MathML, wrapped in a namespaced {@code <math>} root. */
final class ContentMathPrinter {

    private static final Map<String, String> FUNCTION_TAGS = Map.of(
            Functions.SIN, "sin",
            Functions.COS, "cos",
            Functions.TAN, "tan",
            Functions.COT, "cot",
            Functions.SEC, "sec",
            Functions.CSC, "csc",
            Functions.EXP, "exp",
            Functions.LOG, "ln",
            Functions.ABS, "abs",
            Functions.CONJUGATE, "conjugate");

    private ContentMathPrinter() {}

    static String print(Expr expr) {
        StringBuilder out = new StringBuilder();
        write(expr, out);
        return MathMl.contentRoot(out.toString());
    }

    private static void write(Expr expr, StringBuilder out) {
        if (expr instanceof Sym sym) {
            out.append("<ci>").append(MathMl.escape(sym.name())).append("</ci>");
        } else if (expr instanceof Wild wild) {
            out.append("<ci>").append(MathMl.escape(wild.name())).append("</ci>");
        } else if (expr instanceof Num num) {
            if (num.isInteger()) {
                out.append("<cn>").append(num.numerator()).append("</cn>");
            } else {
                out.append("<cn type=\"rational\">")
                        .append(num.numerator())
                        .append("<sep/>")
                        .append(num.denominator())
                        .append("</cn>");
            }
        } else if (Const.IMAGINARY_UNIT.equals(expr)) {
            out.append("<imaginaryi/>");
        } else if (expr instanceof Add add) {
            apply("<plus/>", add.terms(), out);
        } else if (expr instanceof Mul mul) {
            apply("<times/>", mul.factors(), out);
        } else if (expr instanceof Pow pow) {
            apply("<power/>", pow.args(), out);
        } else if (expr instanceof Fn fn) {
            String tag = FUNCTION_TAGS.get(fn.name());
            String head = tag != null ? "<" + tag + "/>" : "<ci>" + MathMl.escape(fn.name()) + "</ci>";
            apply(head, fn.args(), out);
        } else if (expr instanceof Deriv deriv) {
            out.append("<apply><diff/><bvar><ci>")
                    .append(MathMl.escape(deriv.variable().name()))
                    .append("</ci></bvar>");
            write(deriv.body(), out);
            out.append("</apply>");
        } else {
            throw new ReplacementRenderException("No content markup for " + expr.getClass().getSimpleName());
        }
    }

    private static void apply(String head, Iterable<Expr> operands, StringBuilder out) {
        out.append("<apply>").append(head);
        for (Expr operand : operands) {
            write(operand, out);
        }
        out.append("</apply>");
    }
}

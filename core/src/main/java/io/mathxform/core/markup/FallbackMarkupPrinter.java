package io.mathxform.core.markup;

import io.mathxform.core.algebra.Add;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.algebra.ExprFormatter;
import io.mathxform.core.algebra.Fn;
import io.mathxform.core.algebra.Functions;
import io.mathxform.core.algebra.Mul;
import io.mathxform.core.algebra.Num;
import io.mathxform.core.algebra.Pow;
import io.mathxform.core.algebra.Sym;

/**
 * Hand-rolled printer used when the engine's printers fail. Covers symbols, numbers, sums,
 * products, powers, {@code sin}, {@code cos}, {@code abs} and {@code conjugate}; anything else
 * becomes a {@code <ci>} (content) or {@code <mtext>} (presentation) holding the plain-text form.
 * Never throws.
 */
public final class FallbackMarkupPrinter {

    public String content(Expr expr) {
        StringBuilder out = new StringBuilder();
        content(expr, out);
        return MathMl.contentRoot(out.toString());
    }

    public String presentation(Expr expr) {
        StringBuilder out = new StringBuilder();
        presentation(expr, out);
        return MathMl.presentationRoot(out.toString());
    }

    private void content(Expr expr, StringBuilder out) {
        if (expr instanceof Sym sym) {
            out.append("<ci>").append(MathMl.escape(sym.name())).append("</ci>");
        } else if (expr instanceof Num num && num.isInteger()) {
            out.append("<cn>").append(num.numerator()).append("</cn>");
        } else if (expr instanceof Add add) {
            apply("<plus/>", add.terms(), out);
        } else if (expr instanceof Mul mul) {
            apply("<times/>", mul.factors(), out);
        } else if (expr instanceof Pow pow) {
            apply("<power/>", pow.args(), out);
        } else if (expr instanceof Fn fn && isCovered(fn.name())) {
            String head = Functions.CONJUGATE.equals(fn.name()) ? "<ci>conjugate</ci>" : "<" + fn.name() + "/>";
            apply(head, fn.args(), out);
        } else {
            out.append("<ci>").append(MathMl.escape(ExprFormatter.format(expr))).append("</ci>");
        }
    }

    private void apply(String head, Iterable<Expr> operands, StringBuilder out) {
        out.append("<apply>").append(head);
        for (Expr operand : operands) {
            content(operand, out);
        }
        out.append("</apply>");
    }

    private void presentation(Expr expr, StringBuilder out) {
        if (expr instanceof Sym sym) {
            out.append("<mi>").append(MathMl.escape(sym.name())).append("</mi>");
        } else if (expr instanceof Num num && num.isInteger()) {
            out.append("<mn>").append(num.numerator()).append("</mn>");
        } else if (expr instanceof Add add) {
            out.append("<mrow>");
            for (int i = 0; i < add.terms().size(); i++) {
                if (i > 0) {
                    out.append("<mo>+</mo>");
                }
                presentation(add.terms().get(i), out);
            }
            out.append("</mrow>");
        } else if (expr instanceof Mul mul) {
            out.append("<mrow>");
            for (int i = 0; i < mul.factors().size(); i++) {
                if (i > 0) {
                    out.append("<mo>·</mo>");
                }
                presentation(mul.factors().get(i), out);
            }
            out.append("</mrow>");
        } else if (expr instanceof Pow pow) {
            out.append("<msup>");
            if (pow.base() instanceof Add) {
                out.append("<mrow><mo>(</mo>");
                presentation(pow.base(), out);
                out.append("<mo>)</mo></mrow>");
            } else {
                out.append("<mrow>");
                presentation(pow.base(), out);
                out.append("</mrow>");
            }
            presentation(pow.exponent(), out);
            out.append("</msup>");
        } else if (expr instanceof Fn fn && Functions.ABS.equals(fn.name())) {
            out.append("<mrow><mo>|</mo>");
            presentation(fn.argument(), out);
            out.append("<mo>|</mo></mrow>");
        } else if (expr instanceof Fn fn && isCovered(fn.name())) {
            String name = Functions.CONJUGATE.equals(fn.name()) ? "conj" : fn.name();
            out.append("<mrow><mi>").append(name).append("</mi><mo>(</mo>");
            presentation(fn.argument(), out);
            out.append("<mo>)</mo></mrow>");
        } else {
            out.append("<mtext>").append(MathMl.escape(ExprFormatter.format(expr))).append("</mtext>");
        }
    }

    private static boolean isCovered(String function) {
        return Functions.SIN.equals(function)
                || Functions.COS.equals(function)
                || Functions.ABS.equals(function)
                || Functions.CONJUGATE.equals(function);
    }
}

package io.mathxform.core.algebra;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Instantiates a rule template with a match binding. Symbols and wildcards named in the binding are
 * replaced; nothing is normalized, so the template's literal shape survives ({@code a + a} stays a
 * sum). The only cleanup drops the identity operands an empty wildcard binding leaves behind: a
 * template term bound to {@code 0}, a template factor or exponent bound to {@code 1}.
 */
final class Substitution {

    private Substitution() {}

    static Expr substitute(Expr template, Binding binding) {
        if (template instanceof Sym || template instanceof Wild) {
            return bound(template, binding);
        }
        if (template instanceof Add add) {
            return operands(add.terms(), Num.ZERO, binding, Add::new);
        }
        if (template instanceof Mul mul) {
            return operands(mul.factors(), Num.ONE, binding, Mul::new);
        }
        if (template instanceof Pow pow) {
            Expr exponent = substitute(pow.exponent(), binding);
            Expr base = substitute(pow.base(), binding);
            return isPlaceholder(pow.exponent()) && Num.ONE.equals(exponent) ? base : new Pow(base, exponent);
        }
        List<Expr> args = template.args();
        if (args.isEmpty()) {
            return template;
        }
        List<Expr> replaced = new ArrayList<>(args.size());
        for (Expr arg : args) {
            replaced.add(substitute(arg, binding));
        }
        return template.withArgs(replaced);
    }

    private static Expr operands(
            List<Expr> templates, Num identity, Binding binding, Function<List<Expr>, Expr> rebuild) {
        List<Expr> replaced = new ArrayList<>(templates.size());
        for (Expr operand : templates) {
            Expr next = substitute(operand, binding);
            if (isPlaceholder(operand) && identity.equals(next)) {
                continue;
            }
            replaced.add(next);
        }
        if (replaced.isEmpty()) {
            return identity;
        }
        return replaced.size() == 1 ? replaced.get(0) : rebuild.apply(replaced);
    }

    private static boolean isPlaceholder(Expr expr) {
        return expr instanceof Sym || expr instanceof Wild;
    }

    private static Expr bound(Expr placeholder, Binding binding) {
        String name = placeholder instanceof Sym sym ? sym.name() : ((Wild) placeholder).name();
        return binding.get(name).orElse(placeholder);
    }
}

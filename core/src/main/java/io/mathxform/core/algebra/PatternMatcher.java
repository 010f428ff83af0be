package io.mathxform.core.algebra;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Structural matching of a pattern containing {@link Wild} placeholders against a normalized target.
 *
 * <p>
 * Sums and products match associatively and commutatively: structured pattern operands are
 * paired with target operands in any order (with backtracking), then bare wildcards take the
 * remaining operands. Every bare wildcard but the last takes exactly one operand; the last one
 * absorbs whatever is left. It binds the identity ({@code 0} for sums, {@code 1} for products) when
 * nothing is left, provided the pattern also has a structured operand that matched. A target that
 * is not a sum (or product) is treated as a one-operand sum (or product).
 *
 * <p>
 * A wildcard that occurs more than once must bind equal subexpressions.
 */
final class PatternMatcher {

    private enum Operation {
        SUM(Num.ZERO),
        PRODUCT(Num.ONE);

        private final Num identity;

        Operation(Num identity) {
            this.identity = identity;
        }

        List<Expr> operands(Expr expr) {
            if (this == SUM && expr instanceof Add add) {
                return add.terms();
            }
            if (this == PRODUCT && expr instanceof Mul mul) {
                return mul.factors();
            }
            return identity.equals(expr) ? List.of() : List.of(expr);
        }

        Expr combine(List<Expr> operands) {
            if (operands.isEmpty()) {
                return identity;
            }
            if (operands.size() == 1) {
                return operands.get(0);
            }
            return this == SUM ? Normalizer.sum(operands) : Normalizer.product(operands);
        }
    }

    private PatternMatcher() {}

    static Optional<Binding> match(Expr target, Expr pattern) {
        return matches(pattern, target, Binding.empty()).findFirst();
    }

    private static Stream<Binding> matches(Expr pattern, Expr target, Binding binding) {
        if (pattern instanceof Wild wild) {
            return bind(wild, target, binding);
        }
        if (pattern instanceof Add add) {
            return matchOperands(add.terms(), Operation.SUM.operands(target), binding, Operation.SUM);
        }
        if (pattern instanceof Mul mul) {
            return matchOperands(mul.factors(), Operation.PRODUCT.operands(target), binding, Operation.PRODUCT);
        }
        if (pattern instanceof Pow pow && target instanceof Pow other) {
            return matches(pow.base(), other.base(), binding)
                    .flatMap(b -> matches(pow.exponent(), other.exponent(), b));
        }
        if (pattern instanceof Fn fn && target instanceof Fn other && fn.name().equals(other.name())) {
            return matches(fn.argument(), other.argument(), binding);
        }
        if (pattern instanceof Deriv deriv && target instanceof Deriv other) {
            return matches(deriv.variable(), other.variable(), binding)
                    .flatMap(b -> matches(deriv.body(), other.body(), b));
        }
        return pattern.equals(target) ? Stream.of(binding) : Stream.empty();
    }

    private static Stream<Binding> bind(Wild wild, Expr target, Binding binding) {
        Optional<Expr> bound = binding.get(wild.name());
        if (bound.isPresent()) {
            return bound.get().equals(target) ? Stream.of(binding) : Stream.empty();
        }
        return Stream.of(binding.with(wild.name(), target));
    }

    private static Stream<Binding> matchOperands(
            List<Expr> patterns, List<Expr> targets, Binding binding, Operation operation) {
        List<Expr> ordered = new ArrayList<>(patterns.size());
        boolean structured = false;
        for (Expr pattern : patterns) {
            if (!(pattern instanceof Wild)) {
                ordered.add(pattern);
                structured = true;
            }
        }
        for (Expr pattern : patterns) {
            if (pattern instanceof Wild) {
                ordered.add(pattern);
            }
        }
        return assign(ordered, 0, targets, binding, operation, structured);
    }

    private static Stream<Binding> assign(
            List<Expr> patterns,
            int index,
            List<Expr> remaining,
            Binding binding,
            Operation operation,
            boolean identityAllowed) {
        if (index == patterns.size()) {
            return remaining.isEmpty() ? Stream.of(binding) : Stream.empty();
        }
        Expr pattern = patterns.get(index);
        if (pattern instanceof Wild wild) {
            Optional<Expr> bound = binding.get(wild.name());
            if (bound.isPresent()) {
                return removeAll(remaining, operation.operands(bound.get()))
                        .map(rest -> assign(patterns, index + 1, rest, binding, operation, identityAllowed))
                        .orElseGet(Stream::empty);
            }
            if (index == patterns.size() - 1) {
                if (remaining.isEmpty() && !identityAllowed) {
                    return Stream.empty();
                }
                return Stream.of(binding.with(wild.name(), operation.combine(remaining)));
            }
            return IntStream.range(0, remaining.size())
                    .boxed()
                    .flatMap(k -> assign(
                            patterns,
                            index + 1,
                            without(remaining, k),
                            binding.with(wild.name(), remaining.get(k)),
                            operation,
                            identityAllowed));
        }
        return IntStream.range(0, remaining.size())
                .boxed()
                .flatMap(k -> matches(pattern, remaining.get(k), binding)
                        .flatMap(b -> assign(patterns, index + 1, without(remaining, k), b, operation, identityAllowed)));
    }

    private static List<Expr> without(List<Expr> list, int index) {
        List<Expr> copy = new ArrayList<>(list);
        copy.remove(index);
        return copy;
    }

    private static Optional<List<Expr>> removeAll(List<Expr> from, List<Expr> operands) {
        List<Expr> rest = new ArrayList<>(from);
        for (Expr operand : operands) {
            if (!rest.remove(operand)) {
                return Optional.empty();
            }
        }
        return Optional.of(rest);
    }
}

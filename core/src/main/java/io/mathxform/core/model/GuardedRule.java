package io.mathxform.core.model;

import io.mathxform.core.algebra.Binding;
import java.util.Objects;
import java.util.function.BiPredicate;

/** Suppresses matches whose binding (or the request's assumptions) fails the guard. */
public record GuardedRule(String description, BiPredicate<Binding, Assumptions> guard) implements RuleCapability {

    public GuardedRule {
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(guard, "guard must not be null");
    }

    @Override
    public boolean admits(Binding binding, Assumptions assumptions) {
        return guard.test(binding, assumptions);
    }

    @Override
    public String toString() {
        return "GuardedRule[" + description + "]";
    }
}

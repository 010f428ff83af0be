package io.mathxform.core.model;

/** Offered in the reverse direction even when the replacement equals the target. */
public record AlwaysShowRule() implements RuleCapability {

    public static final AlwaysShowRule INSTANCE = new AlwaysShowRule();

    @Override
    public boolean alwaysShow() {
        return true;
    }
}

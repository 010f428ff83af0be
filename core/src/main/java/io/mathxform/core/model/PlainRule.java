package io.mathxform.core.model;

/** No special behaviour. */
public record PlainRule() implements RuleCapability {

    public static final PlainRule INSTANCE = new PlainRule();
}

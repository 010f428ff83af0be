package io.mathxform.core.model;

/** A replacement expression in both markup dialects. */
public record RenderedMarkup(String structural, String presentational) {}

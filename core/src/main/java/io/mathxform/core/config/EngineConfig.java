package io.mathxform.core.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Rule-catalog configuration.
 *
 * @param rulesDir directory scanned for rule files, or {@code null} for none
 * @param ruleSuffix file-name suffix that selects rule files in {@code rulesDir}
 * @param bundled whether the rule files shipped on the classpath are loaded too
 */
public record EngineConfig(Path rulesDir, String ruleSuffix, boolean bundled) {

    public static final String DEFAULT_RULE_SUFFIX = "rewriterules";

    public EngineConfig {
        Objects.requireNonNull(ruleSuffix, "ruleSuffix must not be null");
        if (ruleSuffix.isBlank()) {
            throw new IllegalArgumentException("ruleSuffix must not be blank");
        }
    }

    /** Bundled rules only. */
    public static EngineConfig defaults() {
        return new EngineConfig(null, DEFAULT_RULE_SUFFIX, true);
    }

    public Optional<Path> rulesDirectory() {
        return Optional.ofNullable(rulesDir);
    }
}

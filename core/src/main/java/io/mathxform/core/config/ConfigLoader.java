package io.mathxform.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Function;

/**
 * Loads {@link EngineConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * rules:
 *   dir: /etc/math-xform/rules
 *   suffix: rewriterules
 *   bundled: true
 * </pre>
 *
 * <p>
 * Missing keys keep the {@link EngineConfig#defaults() defaults}. Environment variables
 * {@code MATHXFORM_RULES_DIR}, {@code MATHXFORM_RULES_SUFFIX} and {@code MATHXFORM_RULES_BUNDLED}
 * take precedence over the file. A variable counts as set only if it is defined and non-blank.
 */
public final class ConfigLoader {

    public static final String DEFAULT_CONFIG_FILE = "math-xform.yaml";

    static final String ENV_RULES_DIR = "MATHXFORM_RULES_DIR";
    static final String ENV_RULES_SUFFIX = "MATHXFORM_RULES_SUFFIX";
    static final String ENV_RULES_BUNDLED = "MATHXFORM_RULES_BUNDLED";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or is not valid YAML
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the file, applying overrides from the supplied lookup ({@code null} means undefined).
     *
     * @throws ConfigLoadException if the file is missing or is not valid YAML
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return overlay(EngineConfig.defaults(), envLookup);
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        return overlay(mapToConfig(root.path("rules"), configPath), envLookup);
    }

    private static EngineConfig mapToConfig(JsonNode rules, Path configPath) {
        EngineConfig defaults = EngineConfig.defaults();
        Path dir = rules.has("dir") ? resolve(configPath, rules.get("dir").asText()) : defaults.rulesDir();
        String suffix = textOrDefault(rules, "suffix", defaults.ruleSuffix());
        boolean bundled = defaults.bundled();
        if (rules.has("bundled")) {
            JsonNode node = rules.get("bundled");
            if (!node.isBoolean()) {
                throw new ConfigLoadException("rules.bundled must be true or false in " + configPath);
            }
            bundled = node.asBoolean();
        }
        try {
            return new EngineConfig(dir, suffix, bundled);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid rules configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Relative directories are resolved against the configuration file's directory. */
    private static Path resolve(Path configPath, String dir) {
        Path path = toPath(dir, "rules.dir in " + configPath);
        if (path.isAbsolute()) {
            return path;
        }
        Path parent = configPath.toAbsolutePath().getParent();
        return parent == null ? path : parent.resolve(path).normalize();
    }

    private static EngineConfig overlay(EngineConfig config, Function<String, String> envLookup) {
        Path dir = isSet(envLookup, ENV_RULES_DIR) ? toPath(envLookup.apply(ENV_RULES_DIR), ENV_RULES_DIR) : config.rulesDir();
        String suffix = isSet(envLookup, ENV_RULES_SUFFIX) ? envLookup.apply(ENV_RULES_SUFFIX).trim() : config.ruleSuffix();
        boolean bundled = isSet(envLookup, ENV_RULES_BUNDLED)
                ? parseBoolean(ENV_RULES_BUNDLED, envLookup.apply(ENV_RULES_BUNDLED))
                : config.bundled();
        return new EngineConfig(dir, suffix, bundled);
    }

    private static Path toPath(String text, String source) {
        try {
            return Path.of(text.trim());
        } catch (InvalidPathException e) {
            throw new ConfigLoadException("Invalid path for " + source + ": " + e.getMessage(), e);
        }
    }

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static boolean parseBoolean(String envVar, String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw new ConfigLoadException(envVar + " must be true or false, got '" + value.trim() + "'");
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.has(field) ? node.get(field).asText() : defaultValue;
    }
}

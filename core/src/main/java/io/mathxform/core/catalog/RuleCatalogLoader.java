package io.mathxform.core.catalog;

import io.mathxform.core.config.EngineConfig;
import io.mathxform.core.error.RuleLoadException;
import io.mathxform.core.model.RewriteRule;
import io.mathxform.core.spi.AlgebraEngine;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link RuleCatalog} from rule files on disk and from the rule files bundled on the
 * classpath.
 *
 * <p>
 * Loading never fails as a whole: a malformed line is logged with its source and line number
 * and skipped, and a missing or unreadable file or directory contributes no rules.
 */
public final class RuleCatalogLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RuleCatalogLoader.class);

    /** Classpath resources loaded when {@link EngineConfig#bundled()} is set. */
    public static final List<String> BUNDLED_RESOURCES = List.of(
            "rules/algebra.rewriterules", "rules/complex.rewriterules", "rules/trigonometry.rewriterules");

    private final RuleLineParser lineParser;
    private final RuleCapabilityRegistry capabilityRegistry;

    public RuleCatalogLoader(AlgebraEngine engine) {
        this(new RuleLineParser(engine), RuleCapabilityRegistry.defaults());
    }

    public RuleCatalogLoader(RuleLineParser lineParser, RuleCapabilityRegistry capabilityRegistry) {
        this.lineParser = Objects.requireNonNull(lineParser, "lineParser must not be null");
        this.capabilityRegistry = Objects.requireNonNull(capabilityRegistry, "capabilityRegistry must not be null");
    }

    /** Bundled rules (when enabled) followed by the rules of the configured directory. */
    public RuleCatalog load(EngineConfig config) {
        List<RewriteRule> rules = new ArrayList<>();
        if (config.bundled()) {
            rules.addAll(loadResources(BUNDLED_RESOURCES).rules());
        }
        config.rulesDirectory()
                .ifPresent(dir -> rules.addAll(loadDirectory(dir, config.ruleSuffix()).rules()));
        RuleCatalog catalog = RuleCatalog.of(rules);
        LOG.info("Rule catalog ready: {} rules (bundled={}, dir={})", catalog.size(), config.bundled(), config.rulesDir());
        return catalog;
    }

    /** Loads every file in {@code dir} whose name ends with the default suffix. */
    public RuleCatalog loadDirectory(Path dir) {
        return loadDirectory(dir, EngineConfig.DEFAULT_RULE_SUFFIX);
    }

    /**
     * Loads every regular file in {@code dir} (non-recursive) whose name ends with {@code suffix},
     * in file-name order.
     */
    public RuleCatalog loadDirectory(Path dir, String suffix) {
        if (!Files.isDirectory(dir)) {
            LOG.warn("Rules directory not found: {}", dir);
            return RuleCatalog.empty();
        }
        List<RewriteRule> rules = new ArrayList<>();
        for (Path file : collectRuleFiles(dir, suffix)) {
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                rules.addAll(parseLines(reader, file.toString()));
            } catch (IOException | UncheckedIOException e) {
                LOG.warn("Failed to read rule file {}: {}", file, e.getMessage());
            }
        }
        LOG.info("Loaded {} rewrite rules from {}", rules.size(), dir);
        return RuleCatalog.of(rules);
    }

    /** Loads the named classpath resources in the given order. */
    public RuleCatalog loadResources(List<String> resourceNames) {
        List<RewriteRule> rules = new ArrayList<>();
        for (String name : resourceNames) {
            InputStream in = RuleCatalogLoader.class.getClassLoader().getResourceAsStream(name);
            if (in == null) {
                LOG.warn("Bundled rule resource not found: {}", name);
                continue;
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                rules.addAll(parseLines(reader, name));
            } catch (IOException | UncheckedIOException e) {
                LOG.warn("Failed to read rule resource {}: {}", name, e.getMessage());
            }
        }
        LOG.debug("Loaded {} bundled rewrite rules", rules.size());
        return RuleCatalog.of(rules);
    }

    private List<RewriteRule> parseLines(BufferedReader reader, String source) throws IOException {
        List<RewriteRule> rules = new ArrayList<>();
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            Optional<RewriteRule> rule;
            try {
                rule = lineParser.parse(line, source, lineNumber);
            } catch (RuleLoadException e) {
                LOG.warn("Skipping rule at {}:{}: {}", e.source(), e.line(), e.getMessage());
                continue;
            }
            rule.map(capabilityRegistry::attach).ifPresent(rules::add);
        }
        return rules;
    }

    private static List<Path> collectRuleFiles(Path dir, String suffix) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                if (entry.getFileName().toString().endsWith(suffix) && Files.isRegularFile(entry)) {
                    files.add(entry);
                }
            }
        } catch (IOException e) {
            LOG.warn("Failed to scan rules directory {}: {}", dir, e.getMessage());
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }
}

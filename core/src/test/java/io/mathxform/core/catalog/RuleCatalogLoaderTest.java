package io.mathxform.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.mathxform.core.algebra.Binding;
import io.mathxform.core.algebra.Sym;
import io.mathxform.core.algebra.SymbolicAlgebraEngine;
import io.mathxform.core.config.EngineConfig;
import io.mathxform.core.model.AlwaysShowRule;
import io.mathxform.core.model.Assumptions;
import io.mathxform.core.model.GuardedRule;
import io.mathxform.core.model.NormalizingRule;
import io.mathxform.core.model.PlainRule;
import io.mathxform.core.model.RewriteRule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

@DisplayName("RuleCatalogLoader")
class RuleCatalogLoaderTest {

    private final RuleCatalogLoader loader = new RuleCatalogLoader(new SymbolicAlgebraEngine());

    private ListAppender<ILoggingEvent> logAppender;
    private Logger loaderLogger;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        loaderLogger = (Logger) LoggerFactory.getLogger(RuleCatalogLoader.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        loaderLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        loaderLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private List<String> warnings() {
        return logAppender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    @Nested
    @DisplayName("Bundled rules")
    class Bundled {

        @Test
        @DisplayName("All bundled files load cleanly")
        void loadsAll() {
            RuleCatalog catalog = loader.loadResources(RuleCatalogLoader.BUNDLED_RESOURCES);

            assertThat(catalog.size()).isEqualTo(17);
            assertThat(warnings()).isEmpty();
            assertThat(catalog.rules())
                    .extracting(RewriteRule::name)
                    .startsWith("combine_like_terms_add", "combine_exponents")
                    .contains("modulus_square", "conjugate_exp_i_theta", "trig_tan_quotient")
                    .doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("Registered capabilities are attached by name")
        void capabilitiesAttached() {
            RuleCatalog catalog = loader.loadResources(RuleCatalogLoader.BUNDLED_RESOURCES);

            assertThat(catalog.find("combine_like_terms_add").orElseThrow().capabilities())
                    .containsExactly(AlwaysShowRule.INSTANCE);
            assertThat(catalog.find("complete_square").orElseThrow().capabilities())
                    .hasSize(2)
                    .hasAtLeastOneElementOfType(GuardedRule.class)
                    .hasAtLeastOneElementOfType(NormalizingRule.class);
            assertThat(catalog.find("trig_tan_quotient").orElseThrow().capabilities())
                    .containsExactly(PlainRule.INSTANCE);
        }

        @Test
        @DisplayName("The phase rule is gated on a real angle")
        void phaseGuard() {
            RewriteRule rule = loader.loadResources(RuleCatalogLoader.BUNDLED_RESOURCES)
                    .find("conjugate_exp_i_theta")
                    .orElseThrow();
            Binding binding = Binding.empty().with("theta", new Sym("t"));

            assertThat(rule.admits(binding, Assumptions.none())).isFalse();
            assertThat(rule.admits(binding, Assumptions.of(Map.of("t", "real")))).isTrue();
            assertThat(rule.admits(binding, Assumptions.of(Map.of("t", "positive")))).isTrue();
            assertThat(rule.admits(Binding.empty(), Assumptions.of(Map.of("t", "real")))).isFalse();
        }

        @Test
        @DisplayName("A missing resource is logged and skipped")
        void missingResource() {
            RuleCatalog catalog = loader.loadResources(List.of("rules/absent.rewriterules"));

            assertThat(catalog.size()).isZero();
            assertThat(warnings()).containsExactly("Bundled rule resource not found: rules/absent.rewriterules");
        }
    }

    @Nested
    @DisplayName("Rules directory")
    class Directory {

        @Test
        @DisplayName("Files are read in name order, filtered by suffix")
        void sortedAndFiltered() throws IOException {
            Files.writeString(tempDir.resolve("b.rewriterules"), "cos(x) rewrite sin(x)  # rule: second\n");
            Files.writeString(tempDir.resolve("a.rewriterules"), "tan(x) rewrite sin(x)/cos(x)  # rule: first\n");
            Files.writeString(tempDir.resolve("notes.txt"), "x rewrite y  # rule: ignored\n");
            Files.createDirectory(tempDir.resolve("nested.rewriterules"));

            RuleCatalog catalog = loader.loadDirectory(tempDir);

            assertThat(catalog.rules()).extracting(RewriteRule::name).containsExactly("first", "second");
        }

        @Test
        @DisplayName("A custom suffix selects other files")
        void customSuffix() throws IOException {
            Files.writeString(tempDir.resolve("extra.math"), "x + x rewrite 2*x  # rule: doubled\n");
            Files.writeString(tempDir.resolve("other.rewriterules"), "x rewrite y  # rule: ignored\n");

            RuleCatalog catalog = loader.loadDirectory(tempDir, "math");

            assertThat(catalog.rules()).extracting(RewriteRule::name).containsExactly("doubled");
        }

        @Test
        @DisplayName("Glob characters in the suffix are matched literally")
        void literalSuffix() throws IOException {
            Files.writeString(tempDir.resolve("extra.rules[v1]"), "x + x rewrite 2*x  # rule: bracketed\n");
            Files.writeString(tempDir.resolve("extra.rulesv"), "x rewrite y  # rule: ignored\n");
            Files.writeString(tempDir.resolve("more.{a,b}"), "tan(x) rewrite sin(x)/cos(x)  # rule: braced\n");
            Files.writeString(tempDir.resolve("more.a"), "x rewrite y  # rule: ignored\n");

            assertThat(loader.loadDirectory(tempDir, "rules[v1]").rules())
                    .extracting(RewriteRule::name)
                    .containsExactly("bracketed");
            assertThat(loader.loadDirectory(tempDir, "{a,b}").rules())
                    .extracting(RewriteRule::name)
                    .containsExactly("braced");
            assertThat(warnings()).isEmpty();
        }

        @Test
        @DisplayName("Malformed lines are skipped one by one with their location")
        void skipsBadLines() throws IOException {
            Path file = tempDir.resolve("mixed.rewriterules");
            Files.writeString(file, """
                    # header
                    sin(x) = cos(x)
                    tan(x) rewrite sin(x)/cos(x)  # rule: good

                    sin(x rewrite y
                    """);

            RuleCatalog catalog = loader.loadDirectory(tempDir);

            assertThat(catalog.rules()).extracting(RewriteRule::name).containsExactly("good");
            assertThat(warnings()).hasSize(2);
            assertThat(warnings().get(0)).startsWith("Skipping rule at " + file + ":2:");
            assertThat(warnings().get(1)).startsWith("Skipping rule at " + file + ":5:");
        }

        @Test
        @DisplayName("A missing directory contributes nothing")
        void missingDirectory() {
            Path absent = tempDir.resolve("absent");

            assertThat(loader.loadDirectory(absent).size()).isZero();
            assertThat(warnings()).containsExactly("Rules directory not found: " + absent);
        }
    }

    @Test
    @DisplayName("load combines bundled rules with the configured directory")
    void loadCombines() throws IOException {
        Files.writeString(tempDir.resolve("local.rewriterules"), "x + x rewrite 2*x  # rule: local_double\n");

        RuleCatalog both = loader.load(new EngineConfig(tempDir, EngineConfig.DEFAULT_RULE_SUFFIX, true));
        RuleCatalog directoryOnly = loader.load(new EngineConfig(tempDir, "rewriterules", false));

        assertThat(both.size()).isEqualTo(18);
        assertThat(both.rules().get(17).name()).isEqualTo("local_double");
        assertThat(directoryOnly.rules()).extracting(RewriteRule::name).containsExactly("local_double");
    }

    @Test
    @DisplayName("An empty registry leaves every rule plain")
    void emptyRegistry() {
        RuleCatalogLoader plainLoader = new RuleCatalogLoader(
                new RuleLineParser(new SymbolicAlgebraEngine()), RuleCapabilityRegistry.empty());

        RuleCatalog catalog = plainLoader.loadResources(RuleCatalogLoader.BUNDLED_RESOURCES);

        assertThat(catalog.rules())
                .allSatisfy(rule -> assertThat(rule.capabilities()).containsExactly(PlainRule.INSTANCE));
    }
}

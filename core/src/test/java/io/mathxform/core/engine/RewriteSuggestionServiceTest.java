package io.mathxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mathxform.core.adapter.AlgebraAdapter;
import io.mathxform.core.algebra.SymbolicAlgebraEngine;
import io.mathxform.core.catalog.RuleCatalog;
import io.mathxform.core.catalog.RuleCatalogLoader;
import io.mathxform.core.config.EngineConfig;
import io.mathxform.core.error.MarkupParseException;
import io.mathxform.core.markup.MarkupRenderer;
import io.mathxform.core.markup.MathMarkupParser;
import io.mathxform.core.model.RewriteOption;
import io.mathxform.core.model.SuggestionRequest;
import io.mathxform.core.model.SuggestionResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("RewriteSuggestionService")
class RewriteSuggestionServiceTest {

    private static final String NS = "<math xmlns=\"http://www.w3.org/1998/Math/MathML\">";

    private static final String SIN_2X = "<apply><sin/><apply><times/><cn>2</cn><ci>x</ci></apply></apply>";

    /** {@code x^2 + sin(2x)} */
    private static final String SUM = NS + "<apply><plus/><apply><power/><ci>x</ci><cn>2</cn></apply>" + SIN_2X
            + "</apply></math>";

    /** Node id of {@code sin(2x)}. */
    private static final String SIN_2X_ID = "6a0f7da0";

    private final RewriteSuggestionService service = RewriteSuggestionService.create(EngineConfig.defaults());

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Folds 2 sin(x) cos(x) into sin(2x)")
    void endToEnd() {
        String markup = NS + "<apply><times/><cn>2</cn><apply><sin/><ci>x</ci></apply>"
                + "<apply><cos/><ci>x</ci></apply></apply></math>";

        List<RewriteOption> options = service.suggest(markup, null, null);

        assertThat(options)
                .filteredOn(option -> option.id().equals("trig_double_angle_sin_reverse"))
                .singleElement()
                .satisfies(option -> {
                    assertThat(option.replacementPresentationMathML().replaceAll("<[^>]+>", ""))
                            .isEqualTo("sin(2x)");
                    assertThat(option.replacementContentMathML()).contains("<sin/>");
                });
    }

    @Test
    @DisplayName("Only the selected node is rewritten")
    void selectedNode() {
        List<RewriteOption> options = service.suggest(SUM, SIN_2X_ID, Map.of());

        assertThat(options).extracting(RewriteOption::id).contains("trig_double_angle_sin_forward");
        assertThat(options).allSatisfy(option ->
                assertThat(option.replacementContentMathML()).doesNotContain("<power/><ci>x</ci><cn>2</cn>"));
    }

    @Test
    @DisplayName("An unknown node id selects the whole expression")
    void unknownNode() {
        assertThat(service.suggest(SUM, "deadbeef", null)).isEqualTo(service.suggest(SUM, null, null));
    }

    @Test
    @DisplayName("The selected node id is in the MDC while suggesting and removed afterwards")
    void mdc() {
        List<String> seen = new ArrayList<>();
        SymbolicAlgebraEngine algebra = new SymbolicAlgebraEngine();
        SuggestionEngine recording = new SuggestionEngine(
                RuleCatalog.empty(),
                algebra,
                new MarkupRenderer(algebra),
                List.of((target, engine) -> {
                    seen.add(MDC.get(RewriteSuggestionService.MDC_NODE_ID));
                    return List.of();
                }));
        RewriteSuggestionService recordingService =
                new RewriteSuggestionService(new MathMarkupParser(), new AlgebraAdapter(algebra), recording);

        recordingService.suggest(SUM, SIN_2X_ID, null);

        assertThat(seen).containsExactly(SIN_2X_ID);
        assertThat(MDC.get(RewriteSuggestionService.MDC_NODE_ID)).isNull();
    }

    @Test
    @DisplayName("Unparseable markup fails the request and still clears the MDC")
    void badMarkup() {
        assertThatThrownBy(() -> service.suggest("<math><apply>", "abc", null))
                .isInstanceOf(MarkupParseException.class);
        assertThat(MDC.get(RewriteSuggestionService.MDC_NODE_ID)).isNull();
    }

    @Test
    @DisplayName("Requests carry assumptions through")
    void request() {
        String phase = NS + "<apply><conjugate/><apply><exp/><apply><times/><imaginaryi/><ci>t</ci></apply>"
                + "</apply></apply></math>";

        SuggestionResponse plain = service.suggest(new SuggestionRequest(phase, null, null));
        SuggestionResponse real = service.suggest(new SuggestionRequest(phase, null, Map.of("t", "real")));

        assertThat(plain.options()).extracting(RewriteOption::id).doesNotContain("conjugate_exp_i_theta_forward");
        assertThat(real.options()).extracting(RewriteOption::id).contains("conjugate_exp_i_theta_forward");
    }

    @Test
    @DisplayName("A catalog without rules still runs the generators")
    void generatorsOnly() {
        RewriteSuggestionService bare = RewriteSuggestionService.create(new EngineConfig(null, "rewriterules", false));
        String derivative = NS + "<apply><diff/><bvar><ci>x</ci></bvar><apply><power/><ci>x</ci><cn>2</cn></apply>"
                + "</apply></math>";

        assertThat(bare.suggest(derivative, null, null))
                .extracting(RewriteOption::id)
                .containsExactly(DerivativeGenerator.ID);
        assertThat(new RuleCatalogLoader(new SymbolicAlgebraEngine())
                        .load(new EngineConfig(null, "rewriterules", false))
                        .size())
                .isZero();
    }
}

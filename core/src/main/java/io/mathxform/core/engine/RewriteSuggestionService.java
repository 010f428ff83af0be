package io.mathxform.core.engine;

import io.mathxform.core.adapter.AlgebraAdapter;
import io.mathxform.core.addressing.NodeAddressing;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.algebra.SymbolicAlgebraEngine;
import io.mathxform.core.catalog.RuleCatalog;
import io.mathxform.core.catalog.RuleCatalogLoader;
import io.mathxform.core.config.EngineConfig;
import io.mathxform.core.markup.MathMarkupParser;
import io.mathxform.core.model.AddressedNode;
import io.mathxform.core.model.Assumptions;
import io.mathxform.core.model.ExpressionNode;
import io.mathxform.core.model.RewriteOption;
import io.mathxform.core.model.SuggestionRequest;
import io.mathxform.core.model.SuggestionResponse;
import io.mathxform.core.spi.AlgebraEngine;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point for rewrite suggestions: markup in, options out.
 *
 * <p>
 * Parses the Content MathML, addresses every subtree, resolves the selected node (an unknown or
 * missing id selects the whole expression), converts it to an algebra expression and asks the
 * {@link SuggestionEngine} for options.
 *
 * <p>
 * Thread-safe once constructed.
 */
public final class RewriteSuggestionService {

    private static final Logger LOG = LoggerFactory.getLogger(RewriteSuggestionService.class);

    /** MDC key for the selected node id. */
    static final String MDC_NODE_ID = "nodeId";

    private final MathMarkupParser markupParser;
    private final AlgebraAdapter adapter;
    private final SuggestionEngine suggestionEngine;

    public RewriteSuggestionService(
            MathMarkupParser markupParser, AlgebraAdapter adapter, SuggestionEngine suggestionEngine) {
        this.markupParser = Objects.requireNonNull(markupParser, "markupParser must not be null");
        this.adapter = Objects.requireNonNull(adapter, "adapter must not be null");
        this.suggestionEngine = Objects.requireNonNull(suggestionEngine, "suggestionEngine must not be null");
    }

    /** Wires the bundled algebra engine and loads the catalog described by {@code config}. */
    public static RewriteSuggestionService create(EngineConfig config) {
        AlgebraEngine algebra = new SymbolicAlgebraEngine();
        RuleCatalog catalog = new RuleCatalogLoader(algebra).load(config);
        return new RewriteSuggestionService(
                new MathMarkupParser(), new AlgebraAdapter(algebra), new SuggestionEngine(catalog, algebra));
    }

    /**
     * Suggests rewrites for the selected subexpression.
     *
     * @param contentMathML the whole expression as Content MathML
     * @param selectedNodeId hex node id, or {@code null} for the whole expression
     * @param assumptions variable assumptions, or {@code null}
     * @return the options, possibly empty
     * @throws io.mathxform.core.error.MarkupParseException if the markup cannot be parsed
     */
    public List<RewriteOption> suggest(String contentMathML, String selectedNodeId, Map<String, String> assumptions) {
        if (selectedNodeId != null) {
            MDC.put(MDC_NODE_ID, selectedNodeId);
        }
        try {
            ExpressionNode tree = markupParser.parse(contentMathML);
            AddressedNode root = NodeAddressing.assignIds(tree);
            AddressedNode selected = NodeAddressing.findById(root, selectedNodeId).orElseGet(() -> {
                if (selectedNodeId != null) {
                    LOG.debug("Node id {} not found, using the whole expression", selectedNodeId);
                }
                return root;
            });
            Expr target = adapter.toAlgebraExpr(selected.node());
            List<RewriteOption> options = suggestionEngine.suggest(target, Assumptions.of(assumptions));
            LOG.debug("Suggestions for node {} ({}): {}", selected.id().hex(), target, options.size());
            return options;
        } finally {
            MDC.remove(MDC_NODE_ID);
        }
    }

    public SuggestionResponse suggest(SuggestionRequest request) {
        return new SuggestionResponse(
                suggest(request.contentMathML(), request.selectedNodeId(), request.assumptions()));
    }
}

package io.mathxform.core.model;

import java.util.Map;

/** JSON request body: the expression markup, the selected node id and optional assumptions. */
public record SuggestionRequest(String contentMathML, String selectedNodeId, Map<String, String> assumptions) {}

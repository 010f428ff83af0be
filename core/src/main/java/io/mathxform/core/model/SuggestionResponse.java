package io.mathxform.core.model;

import java.util.List;

/** JSON response body. */
public record SuggestionResponse(List<RewriteOption> options) {

    public SuggestionResponse {
        options = List.copyOf(options);
    }
}

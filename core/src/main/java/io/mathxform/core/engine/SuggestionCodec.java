package io.mathxform.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mathxform.core.model.SuggestionRequest;
import io.mathxform.core.model.SuggestionResponse;

/** JSON form of suggestion requests and responses, for an HTTP layer in front of the service. */
public final class SuggestionCodec {

    private final ObjectMapper mapper;

    public SuggestionCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public SuggestionCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws IllegalArgumentException if the JSON is malformed or {@code contentMathML} is missing
     */
    public SuggestionRequest readRequest(String json) {
        SuggestionRequest request;
        try {
            request = mapper.readValue(json, SuggestionRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse suggestion request: " + e.getOriginalMessage(), e);
        }
        if (request == null || request.contentMathML() == null) {
            throw new IllegalArgumentException("Suggestion request must contain 'contentMathML'");
        }
        return request;
    }

    public String writeResponse(SuggestionResponse response) {
        try {
            return mapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize suggestion response", e);
        }
    }
}

package br.edu.ifba.federated.model.client;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatCompletionRequest(
    String model,
    List<ChatMessage> messages,
    Boolean stream,
    Double temperature,

    @JsonProperty("response_format")
    Map<String, String> responseFormat
) {

    private static final Map<String, String> JSON_OBJECT = Map.of("type", "json_object");

    /**
     * Deterministic, non-streaming completion. JSON mode asks the backend for a single JSON object.
     */
    public static ChatCompletionRequest of(final String model, final List<ChatMessage> messages, final boolean jsonMode) {
        return new ChatCompletionRequest(model, messages, false, 0.0, jsonMode ? JSON_OBJECT : null);
    }
}

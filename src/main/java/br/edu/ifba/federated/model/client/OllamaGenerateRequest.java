package br.edu.ifba.federated.model.client;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OllamaGenerateRequest(
    String model,
    String prompt,
    String system,
    Boolean stream,
    String format
) {

    public static OllamaGenerateRequest of(final String model, final String prompt, final String system, final boolean jsonMode) {
        return new OllamaGenerateRequest(model, prompt, system != null ? system : "", false, jsonMode ? "json" : null);
    }
}

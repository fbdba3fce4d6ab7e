package br.edu.ifba.federated.model.client;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
    String model,
    String input,
    Integer dimensions
) {
}

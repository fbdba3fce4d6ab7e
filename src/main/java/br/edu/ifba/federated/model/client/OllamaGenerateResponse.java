package br.edu.ifba.federated.model.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OllamaGenerateResponse(
    String model,
    String response,
    Boolean done
) {
}

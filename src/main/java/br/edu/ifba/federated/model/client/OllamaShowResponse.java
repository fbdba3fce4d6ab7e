package br.edu.ifba.federated.model.client;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OllamaShowResponse(
    String parameters,
    String modelfile,
    Map<String, Object> details,

    @JsonProperty("model_info")
    Map<String, Object> modelInfo
) {
}

package br.edu.ifba.federated.model.client;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OllamaTagsResponse(List<LocalModel> models) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LocalModel(String name, String model) {}
}

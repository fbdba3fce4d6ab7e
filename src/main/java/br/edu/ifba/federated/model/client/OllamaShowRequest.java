package br.edu.ifba.federated.model.client;

public record OllamaShowRequest(String model) {
}

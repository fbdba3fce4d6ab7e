package br.edu.ifba.federated.model.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(
    String role,
    String content
) {

    public static ChatMessage system(final String content) {
        return new ChatMessage("system", content);
    }

    public static ChatMessage user(final String content) {
        return new ChatMessage("user", content);
    }
}

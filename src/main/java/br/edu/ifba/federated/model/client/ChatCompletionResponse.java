package br.edu.ifba.federated.model.client;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletionResponse(
    String id,
    String model,
    List<Choice> choices
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Choice(
        Integer index,
        ChatMessage message,

        @JsonProperty("finish_reason")
        String finishReason
    ) {}

    /**
     * Content of the first choice, or null when the backend returned none.
     */
    public String firstContent() {
        if (choices == null || choices.isEmpty()) {
            return null;
        }
        final ChatMessage message = choices.get(0).message();
        return message != null ? message.content() : null;
    }
}

package br.edu.ifba.federated.model;

import br.edu.ifba.federated.model.client.ChatCompletionClient;
import br.edu.ifba.federated.model.client.ChatCompletionRequest;
import br.edu.ifba.federated.model.client.ChatCompletionResponse;
import br.edu.ifba.federated.model.client.ChatMessage;
import br.edu.ifba.federated.shared.MalformedModelResponseException;

import java.util.List;

/**
 * Chat channel over any OpenAI-compatible {@code /chat/completions} endpoint.
 */
public class OpenAiChatChannel implements ChatChannel {

    private final ChatCompletionClient client;
    private final String providerId;
    private final String model;
    private final ChannelCredentials credentials;

    public OpenAiChatChannel(
            final ChatCompletionClient client,
            final String providerId,
            final String model,
            final ChannelCredentials credentials) {
        this.client = client;
        this.providerId = providerId;
        this.model = model;
        this.credentials = credentials;
    }

    @Override
    public String complete(final String prompt, final String system, final boolean jsonMode) {
        final List<ChatMessage> messages = List.of(ChatMessage.system(system), ChatMessage.user(prompt));
        final ChatCompletionResponse response = client.complete(
            credentials.authorization(),
            credentials.apiKey(),
            credentials.apiVersion(),
            ChatCompletionRequest.of(model, messages, jsonMode));

        final String content = response != null ? response.firstContent() : null;
        if (content == null) {
            throw new MalformedModelResponseException("No completion returned by " + describe());
        }
        return content;
    }

    @Override
    public String describe() {
        return providerId + ":" + model;
    }
}

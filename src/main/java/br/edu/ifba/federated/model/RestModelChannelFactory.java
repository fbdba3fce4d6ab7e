package br.edu.ifba.federated.model;

import br.edu.ifba.federated.model.client.ChatCompletionClient;
import br.edu.ifba.federated.model.client.EmbeddingClient;
import br.edu.ifba.federated.model.client.OllamaClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.RestClientBuilder;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.net.URI;
import java.util.concurrent.TimeUnit;

/**
 * Builds REST-backed channels for a provider configuration.
 *
 * <p>Every call creates new client instances, so channels from an earlier configuration
 * stay valid for calls that already hold them.</p>
 */
@ApplicationScoped
public class RestModelChannelFactory implements ModelChannelFactory {

    private static final Logger LOG = Logger.getLogger(RestModelChannelFactory.class);

    static final int OPENAI_EMBEDDING_DIMENSION = 1536;
    static final int COMPACT_EMBEDDING_DIMENSION = 768;

    @Inject
    ModelProviderConfig config;

    @Override
    @NotNull
    public ModelChannels create(@NotNull final ProviderSettings settings) {
        final ProviderKind kind = settings.provider();
        final int dimension = config.embeddingDimension().orElse(defaultDimension(kind));

        final ChatChannel cloud;
        final EmbeddingChannel embedding;
        switch (kind) {
            case AZURE -> {
                final String endpoint = require(settings.endpoint(), "Azure endpoint");
                final String deployment = require(settings.deployment(), "Azure deployment");
                final String embeddingDeployment = require(settings.embeddingDeployment(), "Azure embedding deployment");
                final String apiVersion = settings.apiVersion() != null ? settings.apiVersion() : config.azure().apiVersion();
                final ChannelCredentials credentials = ChannelCredentials.azure(settings.apiKey(), apiVersion);
                cloud = new OpenAiChatChannel(
                    chatClient(trimSlash(endpoint) + "/openai/deployments/" + deployment),
                    kind.id(), deployment, credentials);
                embedding = new OpenAiEmbeddingChannel(
                    embeddingClient(trimSlash(endpoint) + "/openai/deployments/" + embeddingDeployment),
                    embeddingDeployment, credentials, dimension, false);
            }
            case GEMINI -> {
                final ChannelCredentials credentials = ChannelCredentials.bearer(settings.apiKey());
                cloud = new OpenAiChatChannel(chatClient(config.gemini().url()), kind.id(),
                    orDefault(settings.model(), config.gemini().model()), credentials);
                embedding = new OpenAiEmbeddingChannel(embeddingClient(config.gemini().url()),
                    config.gemini().embeddingModel(), credentials, dimension, true);
            }
            case OLLAMA -> {
                final String base = trimSlash(config.ollama().url()) + "/v1";
                cloud = new OpenAiChatChannel(chatClient(base), kind.id(),
                    orDefault(settings.model(), config.ollama().model()), ChannelCredentials.NONE);
                embedding = new OpenAiEmbeddingChannel(embeddingClient(base),
                    config.ollama().embeddingModel(), ChannelCredentials.NONE, dimension, false);
            }
            default -> {
                final ChannelCredentials credentials = ChannelCredentials.bearer(settings.apiKey());
                cloud = new OpenAiChatChannel(chatClient(config.openai().url()), kind.id(),
                    orDefault(settings.model(), config.openai().model()), credentials);
                embedding = new OpenAiEmbeddingChannel(embeddingClient(config.openai().url()),
                    config.openai().embeddingModel(), credentials, dimension, config.embeddingDimension().isPresent());
            }
        }

        final LocalModelChannel local = new OllamaLocalChannel(
            ollamaClient(config.readTimeoutMs()),
            ollamaClient(config.probeTimeoutMs()),
            config.ollama().model(),
            config.defaultContextWindow());

        LOG.infof("Built model channels: cloud=%s, embedding dimension=%d, local=%s",
            cloud.describe(), dimension, local.describe());
        return new ModelChannels(cloud, embedding, local, settings);
    }

    static int defaultDimension(final ProviderKind kind) {
        return switch (kind) {
            case OLLAMA, GEMINI -> COMPACT_EMBEDDING_DIMENSION;
            default -> OPENAI_EMBEDDING_DIMENSION;
        };
    }

    private ChatCompletionClient chatClient(final String baseUrl) {
        return builder(baseUrl, config.readTimeoutMs()).build(ChatCompletionClient.class);
    }

    private EmbeddingClient embeddingClient(final String baseUrl) {
        return builder(baseUrl, config.readTimeoutMs()).build(EmbeddingClient.class);
    }

    private OllamaClient ollamaClient(final int readTimeoutMs) {
        return builder(config.ollama().url(), readTimeoutMs).build(OllamaClient.class);
    }

    private RestClientBuilder builder(final String baseUrl, final int readTimeoutMs) {
        return RestClientBuilder.newBuilder()
            .baseUri(URI.create(trimSlash(baseUrl)))
            .connectTimeout(Math.min(config.connectTimeoutMs(), readTimeoutMs), TimeUnit.MILLISECONDS)
            .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS);
    }

    private static String require(final String value, final String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    private static String orDefault(final String value, final String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String trimSlash(final String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

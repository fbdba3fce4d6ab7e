package br.edu.ifba.federated.model;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the model provider.
 *
 * <p>Example configuration:
 * <pre>
 * federated.model.provider=openai
 * federated.model.use-local=true
 * federated.model.openai.api-key=${OPENAI_API_KEY}
 * federated.model.ollama.url=http://localhost:11434
 * federated.model.ollama.model=mistral
 * </pre>
 */
@ConfigMapping(prefix = "federated.model")
public interface ModelProviderConfig {

    @WithDefault("openai")
    String provider();

    /**
     * Whether generation calls try the local Ollama channel before the cloud channel.
     */
    @WithName("use-local")
    @WithDefault("false")
    boolean useLocal();

    /**
     * Embedding dimensionality. When absent the provider default is used (768 for ollama and gemini, 1536 otherwise).
     */
    @WithName("embedding-dimension")
    Optional<Integer> embeddingDimension();

    @WithName("probe-timeout-ms")
    @WithDefault("5000")
    int probeTimeoutMs();

    @WithName("connect-timeout-ms")
    @WithDefault("10000")
    int connectTimeoutMs();

    @WithName("read-timeout-ms")
    @WithDefault("120000")
    int readTimeoutMs();

    @WithName("default-context-window")
    @WithDefault("4096")
    int defaultContextWindow();

    OpenAiConfig openai();

    AzureConfig azure();

    GeminiConfig gemini();

    OllamaConfig ollama();

    interface OpenAiConfig {

        @WithDefault("https://api.openai.com/v1")
        String url();

        @WithName("api-key")
        Optional<String> apiKey();

        @WithDefault("gpt-4o")
        String model();

        @WithName("embedding-model")
        @WithDefault("text-embedding-3-small")
        String embeddingModel();
    }

    interface AzureConfig {

        Optional<String> endpoint();

        @WithName("api-key")
        Optional<String> apiKey();

        @WithName("api-version")
        @WithDefault("2024-02-01")
        String apiVersion();

        Optional<String> deployment();

        @WithName("embedding-deployment")
        Optional<String> embeddingDeployment();
    }

    interface GeminiConfig {

        @WithDefault("https://generativelanguage.googleapis.com/v1beta/openai")
        String url();

        @WithName("api-key")
        Optional<String> apiKey();

        @WithDefault("gemma-3-27b-it")
        String model();

        @WithName("embedding-model")
        @WithDefault("gemini-embedding-001")
        String embeddingModel();
    }

    interface OllamaConfig {

        @WithDefault("http://localhost:11434")
        String url();

        @WithDefault("mistral")
        String model();

        @WithName("embedding-model")
        @WithDefault("nomic-embed-text")
        String embeddingModel();
    }

    /**
     * Settings the provider starts with.
     */
    default ProviderSettings initialSettings() {
        final ProviderKind kind = ProviderKind.from(provider());
        return switch (kind) {
            case OPENAI -> new ProviderSettings(kind, openai().apiKey().orElse(null), null,
                null, null, null, null, useLocal());
            case GEMINI -> new ProviderSettings(kind, gemini().apiKey().orElse(null), null,
                null, null, null, null, useLocal());
            case AZURE -> new ProviderSettings(kind, azure().apiKey().orElse(null), null,
                azure().endpoint().orElse(null), azure().apiVersion(), azure().deployment().orElse(null),
                azure().embeddingDeployment().orElse(null), useLocal());
            case OLLAMA -> new ProviderSettings(kind, null, null, null, null, null, null, useLocal());
        };
    }
}

package br.edu.ifba.federated.model;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Uniform access to text generation and embeddings across local and cloud backends.
 *
 * <p>Generation methods other than {@link #generateCloud} prefer the local channel when the
 * local toggle is on and the local model is available, and fall back to the cloud channel
 * otherwise. Failures that survive retries and fallback complete the future exceptionally;
 * generation never completes with an empty placeholder.</p>
 */
public interface ModelProvider {

    /**
     * Expands a short query into a fuller question.
     */
    CompletableFuture<String> refine(@NotNull String query);

    /**
     * Extracts up to {@code maxEntities} primary entities or concepts. A "none" answer yields an empty list.
     */
    CompletableFuture<List<String>> extractEntities(@NotNull String text, int maxEntities);

    /**
     * Extracts entities and relationships in JSON mode.
     * Completes with {@link br.edu.ifba.federated.shared.MalformedModelResponseException} when the answer does not parse.
     */
    CompletableFuture<ExtractedGraph> extractGraph(@NotNull String text);

    CompletableFuture<String> summarize(@NotNull String text);

    CompletableFuture<String> generate(@NotNull String prompt, @NotNull String system);

    /**
     * Generates on the cloud channel regardless of the local toggle.
     */
    CompletableFuture<String> generateCloud(@NotNull String prompt, @NotNull String system);

    CompletableFuture<float[]> embed(@NotNull String text);

    /**
     * Atomically replaces every channel used by subsequent calls.
     */
    void switchProvider(@NotNull ProviderSettings settings);

    @NotNull
    ProviderSettings currentSettings();

    /**
     * Active cloud channel as {@code provider:model}, reported in retrieval debug output.
     */
    @NotNull
    String providerName();

    /**
     * Dimensionality of the active embedding channel.
     */
    int embeddingDimension();
}

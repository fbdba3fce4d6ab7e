package br.edu.ifba.federated.model;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Scriptable {@link ModelProvider} for pipeline and worker tests.
 *
 * <p>Each operation is a replaceable function. Embeddings are a hashed bag of words,
 * so texts sharing words are close under cosine similarity. Every call is recorded.</p>
 */
public class FakeModelProvider implements ModelProvider {

    public static final int DIMENSION = 64;

    public Function<String, String> refine = query -> query;
    public Function<String, List<String>> entities = text -> List.of();
    public Function<String, ExtractedGraph> graph = text -> ExtractedGraph.empty();
    public Function<String, String> summary = text -> "Summary of the document.";
    public BiFunction<String, String, String> generate = (prompt, system) -> "Generated header.";
    public BiFunction<String, String, String> cloud = (prompt, system) -> "Synthesized answer.";
    public Function<String, float[]> embedding = FakeModelProvider::bagOfWords;

    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private ProviderSettings settings = ProviderSettings.of(ProviderKind.OPENAI, "sk-test-key", false);

    @Override
    public CompletableFuture<String> refine(@NotNull final String query) {
        return call("refine", () -> refine.apply(query));
    }

    @Override
    public CompletableFuture<List<String>> extractEntities(@NotNull final String text, final int maxEntities) {
        return call("extractEntities", () -> entities.apply(text));
    }

    @Override
    public CompletableFuture<ExtractedGraph> extractGraph(@NotNull final String text) {
        return call("extractGraph", () -> graph.apply(text));
    }

    @Override
    public CompletableFuture<String> summarize(@NotNull final String text) {
        return call("summarize", () -> summary.apply(text));
    }

    @Override
    public CompletableFuture<String> generate(@NotNull final String prompt, @NotNull final String system) {
        return call("generate", () -> generate.apply(prompt, system));
    }

    @Override
    public CompletableFuture<String> generateCloud(@NotNull final String prompt, @NotNull final String system) {
        return call("generateCloud", () -> cloud.apply(prompt, system));
    }

    @Override
    public CompletableFuture<float[]> embed(@NotNull final String text) {
        return call("embed", () -> embedding.apply(text));
    }

    @Override
    public void switchProvider(@NotNull final ProviderSettings settings) {
        this.settings = settings;
    }

    @Override
    @NotNull
    public ProviderSettings currentSettings() {
        return settings;
    }

    @Override
    @NotNull
    public String providerName() {
        return "fake:" + settings.provider().id();
    }

    @Override
    public int embeddingDimension() {
        return DIMENSION;
    }

    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public long callCount(final String operation) {
        return calls().stream().filter(operation::equals).count();
    }

    private <T> CompletableFuture<T> call(final String operation, final Supplier<T> body) {
        calls.add(operation);
        try {
            return CompletableFuture.completedFuture(body.get());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public static float[] bagOfWords(final String text) {
        final float[] vector = new float[DIMENSION];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() > 2) {
                vector[Math.floorMod(token.hashCode(), DIMENSION)] += 1f;
            }
        }
        return vector;
    }
}

package br.edu.ifba.federated.model;

import br.edu.ifba.federated.shared.RecoveryEventLogger;
import br.edu.ifba.federated.shared.TransientFailurePredicate;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import io.smallrye.faulttolerance.api.RetryWhen;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Model provider with a local-first generation path, cloud fallback and retries.
 *
 * <h2>Channel selection</h2>
 * <ol>
 *   <li>Local toggle off: cloud channel.</li>
 *   <li>Local model missing or the probe fails: cloud channel, logged as a fallback.</li>
 *   <li>Local call fails: cloud channel, logged as a fallback.</li>
 * </ol>
 * <p>Embeddings always use the embedding channel of the active provider so that every
 * vector in the collection has the same dimensionality.</p>
 *
 * <h2>Reconfiguration</h2>
 * <p>The active {@link ModelChannels} sit behind an {@link AtomicReference}. Each call
 * reads it once, before any work is scheduled, and uses only that snapshot.</p>
 *
 * <h2>Retries</h2>
 * <p>Public methods retry transient failures ({@link TransientFailurePredicate}) with
 * exponential backoff: three attempts in total. A malformed answer is not retried.</p>
 */
@ApplicationScoped
public class ResilientModelProvider implements ModelProvider {

    private static final Logger LOG = Logger.getLogger(ResilientModelProvider.class);

    private static final String LOCAL = "local";
    private static final String CLOUD = "cloud";

    private final AtomicReference<ModelChannels> active = new AtomicReference<>();
    private final ModelChannelFactory channelFactory;
    private final RecoveryEventLogger recoveryLogger;
    private final ExecutorService executor;

    @Inject
    public ResilientModelProvider(
            final ModelChannelFactory channelFactory,
            final ModelProviderConfig config,
            final RecoveryEventLogger recoveryLogger) {
        this(channelFactory, config.initialSettings(), recoveryLogger);
    }

    public ResilientModelProvider(
            final ModelChannelFactory channelFactory,
            final ProviderSettings initialSettings,
            final RecoveryEventLogger recoveryLogger) {
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory must not be null");
        this.recoveryLogger = Objects.requireNonNull(recoveryLogger, "recoveryLogger must not be null");
        this.executor = Executors.newCachedThreadPool(new ModelThreadFactory());
        this.active.set(channelFactory.create(initialSettings));
        LOG.infof("Model provider ready: provider=%s, localFirst=%s",
            initialSettings.provider().id(), initialSettings.useLocalModel());
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    @Override
    @Retry(maxRetries = 2, delay = 1, delayUnit = ChronoUnit.SECONDS, maxDuration = 5, durationUnit = ChronoUnit.MINUTES)
    @ExponentialBackoff(maxDelay = 10, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public CompletableFuture<String> refine(@NotNull final String query) {
        return localFirst("refine", ModelPrompts.refine(query), ModelPrompts.REFINE_SYSTEM, false,
            ModelOutputParser::cleanLine);
    }

    @Override
    @Retry(maxRetries = 2, delay = 1, delayUnit = ChronoUnit.SECONDS, maxDuration = 5, durationUnit = ChronoUnit.MINUTES)
    @ExponentialBackoff(maxDelay = 10, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public CompletableFuture<List<String>> extractEntities(@NotNull final String text, final int maxEntities) {
        return localFirst("extract-entities", ModelPrompts.entityExtraction(text, maxEntities), ModelPrompts.ENTITY_SYSTEM,
            false, raw -> ModelOutputParser.parseEntityList(raw, maxEntities));
    }

    @Override
    @Retry(maxRetries = 2, delay = 1, delayUnit = ChronoUnit.SECONDS, maxDuration = 5, durationUnit = ChronoUnit.MINUTES)
    @ExponentialBackoff(maxDelay = 10, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public CompletableFuture<ExtractedGraph> extractGraph(@NotNull final String text) {
        return localFirst("extract-graph", ModelPrompts.graphExtraction(text), ModelPrompts.GRAPH_EXTRACTION_SYSTEM,
            true, ModelOutputParser::parseGraph);
    }

    @Override
    @Retry(maxRetries = 2, delay = 1, delayUnit = ChronoUnit.SECONDS, maxDuration = 5, durationUnit = ChronoUnit.MINUTES)
    @ExponentialBackoff(maxDelay = 10, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public CompletableFuture<String> summarize(@NotNull final String text) {
        return localFirst("summarize", ModelPrompts.summary(text), ModelPrompts.DEFAULT_SYSTEM, false,
            Function.identity());
    }

    @Override
    @Retry(maxRetries = 2, delay = 1, delayUnit = ChronoUnit.SECONDS, maxDuration = 5, durationUnit = ChronoUnit.MINUTES)
    @ExponentialBackoff(maxDelay = 10, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public CompletableFuture<String> generate(@NotNull final String prompt, @NotNull final String system) {
        return localFirst("generate", prompt, system, false, Function.identity());
    }

    @Override
    @Retry(maxRetries = 2, delay = 1, delayUnit = ChronoUnit.SECONDS, maxDuration = 5, durationUnit = ChronoUnit.MINUTES)
    @ExponentialBackoff(maxDelay = 10, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public CompletableFuture<String> generateCloud(@NotNull final String prompt, @NotNull final String system) {
        final ModelChannels channels = active.get();
        return CompletableFuture.supplyAsync(() -> channels.cloud().complete(prompt, system, false), executor);
    }

    @Override
    @Retry(maxRetries = 2, delay = 1, delayUnit = ChronoUnit.SECONDS, maxDuration = 2, durationUnit = ChronoUnit.MINUTES)
    @ExponentialBackoff(maxDelay = 5, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public CompletableFuture<float[]> embed(@NotNull final String text) {
        final ModelChannels channels = active.get();
        return CompletableFuture.supplyAsync(() -> channels.embedding().embed(text), executor);
    }

    @Override
    public void switchProvider(@NotNull final ProviderSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        final ModelChannels fresh = channelFactory.create(settings);
        final ModelChannels previous = active.getAndSet(fresh);
        LOG.infof("Model provider switched: %s -> %s, localFirst=%s",
            previous.settings().provider().id(), settings.provider().id(), settings.useLocalModel());
    }

    @Override
    @NotNull
    public ProviderSettings currentSettings() {
        return active.get().settings();
    }

    @Override
    @NotNull
    public String providerName() {
        return active.get().cloud().describe();
    }

    @Override
    public int embeddingDimension() {
        return active.get().embedding().dimension();
    }

    private <T> CompletableFuture<T> localFirst(
            final String operation,
            final String prompt,
            final String system,
            final boolean jsonMode,
            final Function<String, T> parser) {
        final ModelChannels channels = active.get();
        return CompletableFuture.supplyAsync(
            () -> parser.apply(completeLocalFirst(channels, operation, prompt, system, jsonMode)), executor);
    }

    private String completeLocalFirst(
            final ModelChannels channels,
            final String operation,
            final String prompt,
            final String system,
            final boolean jsonMode) {
        if (!channels.settings().useLocalModel()) {
            return channels.cloud().complete(prompt, system, jsonMode);
        }

        final LocalModelChannel local = channels.local();
        if (!local.isModelAvailable()) {
            recoveryLogger.logFallback(operation, LOCAL, CLOUD, null);
            return channels.cloud().complete(prompt, system, jsonMode);
        }

        try {
            return local.complete(prompt, system, jsonMode);
        } catch (RuntimeException e) {
            recoveryLogger.logFallback(operation, LOCAL, CLOUD, e);
            return channels.cloud().complete(prompt, system, jsonMode);
        }
    }

    private static final class ModelThreadFactory implements java.util.concurrent.ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(final Runnable runnable) {
            final Thread thread = new Thread(runnable, "model-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

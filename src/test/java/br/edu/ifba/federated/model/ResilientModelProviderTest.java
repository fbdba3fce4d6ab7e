package br.edu.ifba.federated.model;

import br.edu.ifba.federated.shared.MalformedModelResponseException;
import br.edu.ifba.federated.shared.ModelCallException;
import br.edu.ifba.federated.shared.RecoveryEventLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ResilientModelProvider} channel selection and hot-swap.
 * Retries are applied by the CDI interceptor and are not exercised here.
 */
class ResilientModelProviderTest {

    private FakeChannels.Chat openAi;
    private FakeChannels.Chat gemini;
    private FakeChannels.Local local;

    @BeforeEach
    void setUp() {
        openAi = new FakeChannels.Chat("openai:gpt-4o");
        gemini = new FakeChannels.Chat("gemini:gemma-3-27b-it");
        local = new FakeChannels.Local(true);
    }

    private ResilientModelProvider provider(final boolean useLocal) {
        final ModelChannelFactory factory = settings -> new ModelChannels(
            settings.provider() == ProviderKind.GEMINI ? gemini : openAi,
            new FakeChannels.Embedding(settings.provider() == ProviderKind.GEMINI ? 768 : 1536),
            local,
            settings);
        return new ResilientModelProvider(factory, ProviderSettings.of(ProviderKind.OPENAI, "sk-key", useLocal),
            new RecoveryEventLogger());
    }

    @Nested
    @DisplayName("Local-first generation")
    class LocalFirst {

        @Test
        @DisplayName("should use the cloud channel when the local toggle is off")
        void cloudWhenToggleOff() {
            final String answer = provider(false).generate("prompt", "system").join();

            assertEquals("openai:gpt-4o answer", answer);
            assertEquals(0, local.calls.get());
            assertEquals(0, local.probes.get());
        }

        @Test
        @DisplayName("should use the local channel when its model is available")
        void localWhenAvailable() {
            final String answer = provider(true).generate("prompt", "system").join();

            assertEquals("ollama:mistral answer", answer);
            assertEquals(0, openAi.calls.get());
        }

        @Test
        @DisplayName("should fall back to cloud when the local model is absent")
        void fallbackWhenModelAbsent() {
            local.available = false;

            final String answer = provider(true).summarize("long text").join();

            assertEquals("openai:gpt-4o answer", answer);
            assertEquals(0, local.calls.get());
            assertEquals(1, openAi.calls.get());
        }

        @Test
        @DisplayName("should fall back to cloud when the local call fails")
        void fallbackWhenLocalCallFails() {
            local.failure = new ModelCallException("Connection refused", 0);

            final String answer = provider(true).generate("prompt", "system").join();

            assertEquals("openai:gpt-4o answer", answer);
            assertEquals(1, local.calls.get());
        }

        @Test
        @DisplayName("should raise when both channels fail")
        void raiseWhenEverythingFails() {
            local.failure = new ModelCallException("local down", 503);
            openAi.failure = new ModelCallException("cloud down", 503);

            final CompletionException thrown = assertThrows(CompletionException.class,
                () -> provider(true).generate("prompt", "system").join());
            assertInstanceOf(ModelCallException.class, thrown.getCause());
        }

        @Test
        @DisplayName("synthesis should always use the cloud channel")
        void synthesisAlwaysCloud() {
            final String answer = provider(true).generateCloud("prompt", "system").join();

            assertEquals("openai:gpt-4o answer", answer);
            assertEquals(0, local.calls.get());
            assertEquals(0, local.probes.get());
        }
    }

    @Nested
    @DisplayName("Provider switching")
    class Switching {

        @Test
        @DisplayName("in-flight call should finish on the channel it captured")
        void inFlightCallKeepsCapturedChannel() {
            final ResilientModelProvider provider = provider(false);
            final CountDownLatch gate = new CountDownLatch(1);
            openAi.gate = gate;

            final CompletableFuture<String> inFlight = provider.generateCloud("prompt", "system");
            provider.switchProvider(ProviderSettings.of(ProviderKind.GEMINI, "g-key", false));
            gate.countDown();

            assertEquals("openai:gpt-4o answer", inFlight.join());
            assertEquals("gemini:gemma-3-27b-it answer", provider.generateCloud("prompt", "system").join());
        }

        @Test
        @DisplayName("should report the new provider and embedding dimension after a switch")
        void reportsNewSettings() {
            final ResilientModelProvider provider = provider(false);
            assertEquals(1536, provider.embeddingDimension());
            assertEquals("openai:gpt-4o", provider.providerName());

            provider.switchProvider(ProviderSettings.of(ProviderKind.GEMINI, "g-key", true));

            assertEquals(768, provider.embeddingDimension());
            assertEquals("gemini:gemma-3-27b-it", provider.providerName());
            assertTrue(provider.currentSettings().useLocalModel());
        }
    }

    @Nested
    @DisplayName("Parsed operations")
    class Parsed {

        @Test
        @DisplayName("malformed graph output should fail without a fallback")
        void malformedGraphFails() {
            final CompletionException thrown = assertThrows(CompletionException.class,
                () -> provider(false).extractGraph("chunk").join());
            assertInstanceOf(MalformedModelResponseException.class, thrown.getCause());
        }
    }
}

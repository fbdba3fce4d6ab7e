package br.edu.ifba.federated.model;

import br.edu.ifba.federated.model.client.OllamaClient;
import br.edu.ifba.federated.model.client.OllamaGenerateRequest;
import br.edu.ifba.federated.model.client.OllamaGenerateResponse;
import br.edu.ifba.federated.model.client.OllamaShowRequest;
import br.edu.ifba.federated.model.client.OllamaTagsResponse;
import br.edu.ifba.federated.shared.MalformedModelResponseException;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Local generation channel backed by an Ollama server.
 *
 * <p>Availability is probed on every call through {@code /api/tags} with the short-timeout
 * probe client. The context window is discovered on first use through {@code /api/show}
 * and cached for the lifetime of this channel; prompts are cut to three characters per
 * token of that window before they are sent.</p>
 */
public class OllamaLocalChannel implements LocalModelChannel {

    private static final Logger LOG = Logger.getLogger(OllamaLocalChannel.class);

    static final int CHARS_PER_TOKEN = 3;

    private final OllamaClient client;
    private final OllamaClient probeClient;
    private final String model;
    private final int defaultContextWindow;

    private volatile Integer contextWindow;

    public OllamaLocalChannel(
            final OllamaClient client,
            final OllamaClient probeClient,
            final String model,
            final int defaultContextWindow) {
        this.client = client;
        this.probeClient = probeClient;
        this.model = model;
        this.defaultContextWindow = defaultContextWindow;
    }

    @Override
    public boolean isModelAvailable() {
        try {
            final OllamaTagsResponse tags = probeClient.tags();
            final List<OllamaTagsResponse.LocalModel> models = tags != null && tags.models() != null
                ? tags.models() : List.of();
            final boolean exists = models.stream()
                .map(OllamaTagsResponse.LocalModel::name)
                .filter(Objects::nonNull)
                .anyMatch(name -> name.contains(model));
            if (!exists) {
                LOG.warnf("Local model '%s' not found in Ollama. Available: %s", model,
                    models.stream().map(OllamaTagsResponse.LocalModel::name).toList());
            }
            return exists;
        } catch (RuntimeException e) {
            LOG.warnf("Failed to check local model availability: %s", e.getMessage());
            return false;
        }
    }

    @Override
    public int contextWindow() {
        Integer window = contextWindow;
        if (window == null) {
            synchronized (this) {
                window = contextWindow;
                if (window == null) {
                    window = probeContextWindow();
                    contextWindow = window;
                    LOG.infof("Local context window for %s detected: %d", model, window);
                }
            }
        }
        return window;
    }

    private int probeContextWindow() {
        try {
            return ContextWindowProbe.parse(probeClient.show(new OllamaShowRequest(model)), defaultContextWindow);
        } catch (RuntimeException e) {
            LOG.warnf("Could not fetch model info for %s, using default %d: %s",
                model, defaultContextWindow, e.getMessage());
            return defaultContextWindow;
        }
    }

    @Override
    public String complete(final String prompt, final String system, final boolean jsonMode) {
        final int limit = contextWindow() * CHARS_PER_TOKEN;
        final String safePrompt = prompt.length() > limit ? prompt.substring(0, limit) : prompt;

        final OllamaGenerateResponse response = client.generate(
            OllamaGenerateRequest.of(model, safePrompt, system, jsonMode));
        if (response == null || response.response() == null) {
            throw new MalformedModelResponseException("No response returned by " + describe());
        }
        return response.response();
    }

    @Override
    public String describe() {
        return "ollama-local:" + model;
    }
}

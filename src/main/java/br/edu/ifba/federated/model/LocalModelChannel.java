package br.edu.ifba.federated.model;

/**
 * The local/fast generation channel. Its model may be absent, so callers probe before use.
 */
public interface LocalModelChannel extends ChatChannel {

    /**
     * Probes the backend for the configured model. Never throws; an unreachable backend is reported as unavailable.
     */
    boolean isModelAvailable();

    /**
     * Context window of the local model in tokens, discovered once and cached.
     */
    int contextWindow();
}

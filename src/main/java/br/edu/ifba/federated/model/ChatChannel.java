package br.edu.ifba.federated.model;

/**
 * A text generation backend bound to one model.
 */
public interface ChatChannel {

    /**
     * Generates a completion.
     *
     * @param prompt   user prompt
     * @param system   system prompt
     * @param jsonMode ask the backend for a single JSON object
     * @return the generated text, never null
     */
    String complete(String prompt, String system, boolean jsonMode);

    /**
     * Short label for logs and debug output, e.g. {@code openai:gpt-4o}.
     */
    String describe();
}

package br.edu.ifba.federated.model;

import br.edu.ifba.federated.model.client.OllamaShowResponse;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the context window out of an Ollama {@code /api/show} answer.
 *
 * <p>Lookup order: {@code details.context_length}, any {@code model_info} key ending in
 * {@code .context_length}, then {@code num_ctx} in the parameters block and finally in
 * the raw Modelfile. Falls back to the given default.</p>
 */
public final class ContextWindowProbe {

    static final Pattern NUM_CTX_PATTERN = Pattern.compile("num_ctx\\s+(\\d+)");

    private ContextWindowProbe() {
    }

    public static int parse(final OllamaShowResponse show, final int defaultWindow) {
        if (show == null) {
            return defaultWindow;
        }

        Integer structured = positiveInt(show.details() != null ? show.details().get("context_length") : null);
        if (structured != null) {
            return structured;
        }

        if (show.modelInfo() != null) {
            for (Map.Entry<String, Object> entry : show.modelInfo().entrySet()) {
                if (entry.getKey().endsWith(".context_length")) {
                    structured = positiveInt(entry.getValue());
                    if (structured != null) {
                        return structured;
                    }
                }
            }
        }

        Integer fromText = findNumCtx(show.parameters());
        if (fromText != null) {
            return fromText;
        }
        fromText = findNumCtx(show.modelfile());
        return fromText != null ? fromText : defaultWindow;
    }

    private static Integer findNumCtx(final String text) {
        if (text == null) {
            return null;
        }
        final Matcher matcher = NUM_CTX_PATTERN.matcher(text);
        if (matcher.find()) {
            return positiveInt(matcher.group(1));
        }
        return null;
    }

    private static Integer positiveInt(final Object value) {
        if (value == null) {
            return null;
        }
        try {
            final int parsed = value instanceof Number number ? number.intValue() : Integer.parseInt(value.toString().trim());
            return parsed > 0 ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

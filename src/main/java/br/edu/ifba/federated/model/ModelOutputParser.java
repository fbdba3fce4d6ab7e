package br.edu.ifba.federated.model;

import br.edu.ifba.federated.shared.MalformedModelResponseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw model text into the structures the pipelines consume.
 */
public final class ModelOutputParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern LIST_SEPARATOR = Pattern.compile("[,;\\n]");
    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*\\u2022]|\\d+[.)])\\s*");
    private static final String NONE_SENTINEL = "none";

    private ModelOutputParser() {
    }

    /**
     * Removes a surrounding Markdown code fence such as {@code ```json ... ```}.
     */
    public static String stripCodeFence(final String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.trim();
        if (text.startsWith("```")) {
            final int firstNewline = text.indexOf('\n');
            text = firstNewline >= 0 ? text.substring(firstNewline + 1) : text.substring(3);
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3);
            }
        }
        return text.trim();
    }

    /**
     * Strips whitespace and surrounding double quotes from a one-line answer.
     */
    public static String cleanLine(final String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.trim();
        while (text.length() > 1 && text.startsWith("\"") && text.endsWith("\"")) {
            text = text.substring(1, text.length() - 1).trim();
        }
        return text;
    }

    /**
     * Parses a graph extraction answer.
     *
     * @throws MalformedModelResponseException when the answer is not a JSON object
     */
    public static ExtractedGraph parseGraph(final String raw) {
        final String json = stripCodeFence(raw);
        if (json.isEmpty()) {
            throw new MalformedModelResponseException("Empty graph extraction response");
        }
        try {
            final ExtractedGraph graph = MAPPER.readValue(json, ExtractedGraph.class);
            return graph != null ? graph : ExtractedGraph.empty();
        } catch (JsonProcessingException e) {
            throw new MalformedModelResponseException("Graph extraction is not valid JSON: " + abbreviate(json), e);
        }
    }

    /**
     * Parses an entity list answer: a JSON array, or names separated by commas, semicolons or lines.
     * The sentinel {@code None} yields an empty list.
     *
     * @param raw         model answer
     * @param maxEntities maximum number of names to keep
     * @return distinct names in answer order
     */
    public static List<String> parseEntityList(final String raw, final int maxEntities) {
        final String text = stripCodeFence(raw);
        if (text.isEmpty() || isNone(text)) {
            return List.of();
        }

        List<String> candidates = null;
        if (text.startsWith("[")) {
            try {
                candidates = MAPPER.readValue(text, new TypeReference<List<String>>() {});
            } catch (JsonProcessingException e) {
                candidates = null;
            }
        }
        if (candidates == null) {
            candidates = new ArrayList<>();
            for (String part : LIST_SEPARATOR.split(text)) {
                candidates.add(part);
            }
        }

        final Set<String> names = new LinkedHashSet<>();
        for (String candidate : candidates) {
            final String name = cleanName(candidate);
            if (!name.isEmpty() && !isNone(name)) {
                names.add(name);
            }
            if (names.size() >= maxEntities) {
                break;
            }
        }
        return List.copyOf(names);
    }

    private static String cleanName(final String candidate) {
        if (candidate == null) {
            return "";
        }
        String name = LIST_MARKER.matcher(candidate.trim()).replaceFirst("");
        name = name.replaceAll("^[\\[\\]\"'`\\s]+|[\\[\\]\"'`\\s.]+$", "");
        return name.trim();
    }

    private static boolean isNone(final String text) {
        return cleanName(text).toLowerCase(Locale.ROOT).equals(NONE_SENTINEL);
    }

    private static String abbreviate(final String text) {
        return text.length() <= 120 ? text : text.substring(0, 120) + "...";
    }
}

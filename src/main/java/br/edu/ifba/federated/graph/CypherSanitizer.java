package br.edu.ifba.federated.graph;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Single place where text is prepared for graph queries.
 *
 * <p>Values travel as query parameters. Relation types cannot be parameterized, so they are
 * reduced to {@code [A-Z0-9_]} before being placed in the query text.</p>
 */
public final class CypherSanitizer {

    public static final String DEFAULT_RELATION = "RELATED_TO";

    private static final Pattern INVALID_RELATION_CHARS = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_{2,}");
    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n\\u2028\\u2029]+");

    private CypherSanitizer() {
    }

    /**
     * Normalizes a relation label to an uppercase token safe for the query text.
     * Blank or fully invalid labels become {@value #DEFAULT_RELATION}; a leading digit gets an {@code R_} prefix.
     */
    public static String relationType(final String relation) {
        if (relation == null) {
            return DEFAULT_RELATION;
        }
        String token = INVALID_RELATION_CHARS.matcher(relation.trim()).replaceAll("_");
        token = REPEATED_UNDERSCORES.matcher(token).replaceAll("_");
        token = trimUnderscores(token).toUpperCase(Locale.ROOT);
        if (token.isEmpty()) {
            return DEFAULT_RELATION;
        }
        if (Character.isDigit(token.charAt(0))) {
            token = "R_" + token;
        }
        return token;
    }

    /**
     * Prepares a string query parameter. The client wraps parameters in double quotes and
     * escapes embedded double quotes but not backslashes, so backslashes are doubled here
     * and line breaks are folded into spaces.
     */
    public static String parameter(final String value) {
        if (value == null) {
            return "";
        }
        final String singleLine = LINE_BREAKS.matcher(value).replaceAll(" ");
        return singleLine.replace("\\", "\\\\");
    }

    private static String trimUnderscores(final String token) {
        int start = 0;
        int end = token.length();
        while (start < end && token.charAt(start) == '_') {
            start++;
        }
        while (end > start && token.charAt(end - 1) == '_') {
            end--;
        }
        return token.substring(start, end);
    }
}

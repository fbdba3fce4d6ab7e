package br.edu.ifba.federated.model;

/**
 * Per-request authentication for OpenAI-compatible backends. Absent values are sent as null and omitted.
 *
 * @param authorization value for the {@code Authorization} header
 * @param apiKey        value for the Azure {@code api-key} header
 * @param apiVersion    value for the Azure {@code api-version} query parameter
 */
public record ChannelCredentials(String authorization, String apiKey, String apiVersion) {

    public static final ChannelCredentials NONE = new ChannelCredentials(null, null, null);

    public static ChannelCredentials bearer(final String token) {
        return token == null || token.isBlank() ? NONE : new ChannelCredentials("Bearer " + token, null, null);
    }

    public static ChannelCredentials azure(final String apiKey, final String apiVersion) {
        return new ChannelCredentials(null, apiKey, apiVersion);
    }
}

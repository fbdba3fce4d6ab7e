package br.edu.ifba.federated.model;

import br.edu.ifba.federated.model.client.EmbeddingClient;
import br.edu.ifba.federated.model.client.EmbeddingRequest;
import br.edu.ifba.federated.model.client.EmbeddingResponse;
import br.edu.ifba.federated.shared.MalformedModelResponseException;

/**
 * Embedding channel over any OpenAI-compatible {@code /embeddings} endpoint.
 */
public class OpenAiEmbeddingChannel implements EmbeddingChannel {

    private final EmbeddingClient client;
    private final String model;
    private final ChannelCredentials credentials;
    private final int dimension;
    private final boolean sendDimension;

    /**
     * @param sendDimension pass {@code dimensions} in the request, for models that support shortening
     */
    public OpenAiEmbeddingChannel(
            final EmbeddingClient client,
            final String model,
            final ChannelCredentials credentials,
            final int dimension,
            final boolean sendDimension) {
        this.client = client;
        this.model = model;
        this.credentials = credentials;
        this.dimension = dimension;
        this.sendDimension = sendDimension;
    }

    @Override
    public float[] embed(final String text) {
        final EmbeddingResponse response = client.embed(
            credentials.authorization(),
            credentials.apiKey(),
            credentials.apiVersion(),
            new EmbeddingRequest(model, text, sendDimension ? dimension : null));

        if (response == null || response.data() == null || response.data().isEmpty()
                || response.data().get(0).embedding() == null
                || response.data().get(0).embedding().length == 0) {
            throw new MalformedModelResponseException("Empty embedding returned for model " + model);
        }
        final float[] vector = response.data().get(0).embedding();
        if (vector.length != dimension) {
            throw new MalformedModelResponseException(String.format(
                "Embedding model %s returned %d dimensions, expected %d", model, vector.length, dimension));
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }
}

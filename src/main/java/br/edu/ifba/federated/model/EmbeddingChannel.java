package br.edu.ifba.federated.model;

public interface EmbeddingChannel {

    float[] embed(String text);

    /**
     * Dimensionality of the vectors this channel produces.
     */
    int dimension();
}

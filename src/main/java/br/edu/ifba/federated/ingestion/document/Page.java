package br.edu.ifba.federated.ingestion.document;

import java.util.Objects;

/**
 * @param number 1-based page number
 * @param text   extracted text, possibly empty
 */
public record Page(int number, String text) {

    public Page {
        if (number < 1) {
            throw new IllegalArgumentException("page number must be >= 1, got: " + number);
        }
        text = Objects.requireNonNullElse(text, "");
    }
}

package br.edu.ifba.federated.ingestion;

public enum JobOutcome {
    COMPLETED,
    SKIPPED,
    FAILED
}

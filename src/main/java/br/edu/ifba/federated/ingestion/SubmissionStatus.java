package br.edu.ifba.federated.ingestion;

public enum SubmissionStatus {
    QUEUED,
    SKIPPED
}

package br.edu.ifba.federated.notification;

public enum ProgressStatus {
    PROCESSING,
    SKIPPED,
    COMPLETED,
    FAILED
}

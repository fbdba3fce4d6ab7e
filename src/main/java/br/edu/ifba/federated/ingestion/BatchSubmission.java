package br.edu.ifba.federated.ingestion;

import java.util.List;

/**
 * Result of an upload.
 *
 * @param batchId       id of the new batch
 * @param results       one entry per submitted file, in submission order
 * @param streamChannel notification channel carrying the batch's progress events
 */
public record BatchSubmission(String batchId, List<FileResult> results, String streamChannel) {

    public BatchSubmission {
        results = List.copyOf(results);
    }

    public record FileResult(String file, SubmissionStatus status, String message) {
    }
}

package br.edu.ifba.federated.ingestion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Queue message for one uploaded file.
 *
 * @param path stored file path
 * @param batch upload batch id
 * @param hash  MD5 of the file content, lowercase hex
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IngestionJob(
    @JsonProperty("path") String path,
    @JsonProperty("batch") String batch,
    @JsonProperty("hash") String hash
) {

    /**
     * @throws IngestionValidationException when a field is missing or blank
     */
    public IngestionJob validate() {
        if (path == null || path.isBlank()) {
            throw new IngestionValidationException("job has no path");
        }
        if (batch == null || batch.isBlank()) {
            throw new IngestionValidationException("job has no batch");
        }
        if (hash == null || hash.isBlank()) {
            throw new IngestionValidationException("job has no hash");
        }
        return this;
    }
}

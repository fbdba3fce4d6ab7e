package br.edu.ifba.federated.ingestion;

import br.edu.ifba.federated.ingestion.BatchSubmission.FileResult;
import br.edu.ifba.federated.ledger.JobLedger;
import br.edu.ifba.federated.ledger.JobStatus;
import br.edu.ifba.federated.notification.NotificationChannel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;

/**
 * Enqueue side of ingestion: hashes files, reserves their content hash and sends
 * one job per new file.
 */
@ApplicationScoped
public class IngestionSubmitter {

    private static final Logger LOG = Logger.getLogger(IngestionSubmitter.class);

    private final Producer<String, String> producer;
    private final JobLedger ledger;
    private final ObjectMapper objectMapper;
    private final String topic;
    private final long maxFileBytes;

    @Inject
    public IngestionSubmitter(
            final Producer<String, String> producer,
            final JobLedger ledger,
            final ObjectMapper objectMapper,
            final IngestionConfig config,
            @ConfigProperty(name = "federated.kafka.topic", defaultValue = "doc_ingest") final String topic) {
        this(producer, ledger, objectMapper, topic, config.maxFileBytes());
    }

    public IngestionSubmitter(
            @NotNull final Producer<String, String> producer,
            @NotNull final JobLedger ledger,
            @NotNull final ObjectMapper objectMapper,
            @NotNull final String topic,
            final long maxFileBytes) {
        this.producer = producer;
        this.ledger = ledger;
        this.objectMapper = objectMapper;
        this.topic = topic;
        this.maxFileBytes = maxFileBytes;
    }

    /**
     * Submits files as a new batch. Every file is validated before any is queued.
     *
     * @throws IngestionValidationException when a file is missing or above the size limit
     * @throws JobEnqueueException          when a job could not be sent
     */
    public BatchSubmission submit(@NotNull final List<Path> files) {
        if (files.isEmpty()) {
            throw new IngestionValidationException("no files submitted");
        }
        files.forEach(this::validate);

        final String batchId = UUID.randomUUID().toString();
        final List<FileResult> results = new ArrayList<>(files.size());
        for (Path file : files) {
            results.add(submitFile(batchId, file));
        }
        LOG.infof("Batch %s: %d files submitted", batchId, files.size());
        return new BatchSubmission(batchId, results, NotificationChannel.channelName(batchId));
    }

    @NotNull
    public JobStatus status(@NotNull final String batch, @NotNull final String path) {
        return ledger.jobState(batch, path);
    }

    FileResult submitFile(final String batchId, final Path file) {
        final String path = file.toString();
        final String hash = md5Hex(read(file));

        final boolean reserved;
        try {
            reserved = ledger.reserveHash(hash);
        } catch (RuntimeException e) {
            throw new JobEnqueueException("Could not reserve content hash for " + path, e);
        }
        if (!reserved) {
            LOG.infof("Skipping %s: identical content already queued or indexed", path);
            return new FileResult(path, SubmissionStatus.SKIPPED, "Duplicate content already queued or indexed.");
        }

        try {
            final String payload = objectMapper.writeValueAsString(new IngestionJob(path, batchId, hash));
            producer.send(new ProducerRecord<>(topic, batchId, payload)).get();
        } catch (JsonProcessingException | ExecutionException e) {
            ledger.releaseHash(hash);
            throw new JobEnqueueException("Could not enqueue " + path, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            ledger.releaseHash(hash);
            Thread.currentThread().interrupt();
            throw new JobEnqueueException("Interrupted while enqueuing " + path, e);
        } catch (RuntimeException e) {
            // send() throws directly for serializer, size, metadata and closed-producer errors
            ledger.releaseHash(hash);
            throw new JobEnqueueException("Could not enqueue " + path, e);
        }
        return new FileResult(path, SubmissionStatus.QUEUED, "Queued for processing.");
    }

    private void validate(final Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IngestionValidationException("File not found: " + file);
        }
        try {
            final long size = Files.size(file);
            if (size > maxFileBytes) {
                throw new IngestionValidationException(
                    "File " + file + " is " + size + " bytes, above the limit of " + maxFileBytes);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static byte[] read(final Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String md5Hex(final byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not available", e);
        }
    }
}

package br.edu.ifba.federated.ingestion;

import br.edu.ifba.federated.graph.GraphStore;
import br.edu.ifba.federated.ingestion.document.DocumentLoader;
import br.edu.ifba.federated.ingestion.document.LoadedDocument;
import br.edu.ifba.federated.ingestion.document.PageLocator;
import br.edu.ifba.federated.ingestion.text.RecursiveSummarizer;
import br.edu.ifba.federated.ingestion.text.TextChunker;
import br.edu.ifba.federated.ledger.HashState;
import br.edu.ifba.federated.ledger.JobLedger;
import br.edu.ifba.federated.ledger.JobState;
import br.edu.ifba.federated.model.ExtractedGraph;
import br.edu.ifba.federated.model.ExtractedGraph.ExtractedRelationship;
import br.edu.ifba.federated.model.ModelPrompts;
import br.edu.ifba.federated.model.ModelProvider;
import br.edu.ifba.federated.notification.NotificationChannel;
import br.edu.ifba.federated.notification.ProgressEvent;
import br.edu.ifba.federated.shared.RecoveryEventLogger;
import br.edu.ifba.federated.shared.UuidUtils;
import br.edu.ifba.federated.vector.ChunkMetadata;
import br.edu.ifba.federated.vector.VectorStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Runs one ingestion job from announcement to completion or failure.
 *
 * <ol>
 *   <li>Mark the job PROCESSING and announce it.</li>
 *   <li>Skip content whose hash is already COMPLETED.</li>
 *   <li>Load the document into a page map and summarize it.</li>
 *   <li>For each chunk, in order: write its graph triples and mention links, then
 *       resolve its page, write a contextual header and upsert its vector.</li>
 *   <li>Mark job and hash COMPLETED, or mark the job FAILED and release the hash.</li>
 * </ol>
 *
 * <p>The graph step and the vector step of a chunk fail independently. A failure in
 * either is logged and the job carries on with the next step.</p>
 */
@ApplicationScoped
public class IngestionWorker {

    private static final Logger LOG = Logger.getLogger(IngestionWorker.class);

    private final JobLedger ledger;
    private final NotificationChannel notifications;
    private final DocumentLoader documentLoader;
    private final ModelProvider modelProvider;
    private final GraphStore graphStore;
    private final VectorStore vectorStore;
    private final RecoveryEventLogger recoveryLogger;
    private final TextChunker chunker;
    private final RecursiveSummarizer summarizer;

    @Inject
    public IngestionWorker(
            final JobLedger ledger,
            final NotificationChannel notifications,
            final DocumentLoader documentLoader,
            final ModelProvider modelProvider,
            final GraphStore graphStore,
            final VectorStore vectorStore,
            final RecoveryEventLogger recoveryLogger,
            final IngestionConfig config) {
        this(ledger, notifications, documentLoader, modelProvider, graphStore, vectorStore, recoveryLogger,
            new TextChunker(config.chunkSize(), config.chunkOverlap()),
            new RecursiveSummarizer(modelProvider, config.summaryThreshold(), config.summaryMaxDepth()));
    }

    public IngestionWorker(
            @NotNull final JobLedger ledger,
            @NotNull final NotificationChannel notifications,
            @NotNull final DocumentLoader documentLoader,
            @NotNull final ModelProvider modelProvider,
            @NotNull final GraphStore graphStore,
            @NotNull final VectorStore vectorStore,
            @NotNull final RecoveryEventLogger recoveryLogger,
            @NotNull final TextChunker chunker,
            @NotNull final RecursiveSummarizer summarizer) {
        this.ledger = ledger;
        this.notifications = notifications;
        this.documentLoader = documentLoader;
        this.modelProvider = modelProvider;
        this.graphStore = graphStore;
        this.vectorStore = vectorStore;
        this.recoveryLogger = recoveryLogger;
        this.chunker = chunker;
        this.summarizer = summarizer;
    }

    /**
     * Processes a validated job. Never throws for a job-level failure; the failure
     * is recorded in the ledger and published instead.
     */
    public JobOutcome process(@NotNull final IngestionJob job) {
        final String file = job.path();
        final String batch = job.batch();
        final long startTime = System.currentTimeMillis();

        ledger.markJob(batch, file, JobState.PROCESSING);
        notifications.publish(batch, ProgressEvent.step(file, "Started processing"));
        LOG.infof("Processing %s (batch %s)", file, batch);

        try {
            if (ledger.hashState(job.hash()) == HashState.COMPLETED) {
                LOG.infof("Content of %s already indexed, skipping", file);
                ledger.markJob(batch, file, JobState.COMPLETED);
                notifications.publish(batch, ProgressEvent.skipped(file));
                return JobOutcome.SKIPPED;
            }

            final LoadedDocument document = documentLoader.load(Path.of(file));

            notifications.publish(batch, ProgressEvent.step(file, "Summarizing document"));
            final String summary = summarizer.summarize(document.text());

            final List<String> texts = chunker.split(document.text());
            final PageLocator locator = document.map().locator();
            LOG.infof("%s: %d chunks", file, texts.size());

            for (int i = 0; i < texts.size(); i++) {
                final Chunk chunk = new Chunk(UuidUtils.chunkId(batch, file, i), i, texts.get(i));
                indexGraph(chunk, file);
                indexVector(chunk, summary, locator.locate(chunk.text()), file, batch);
                notifications.publish(batch, ProgressEvent.chunk(file, i + 1, texts.size()));
            }

            ledger.markJob(batch, file, JobState.COMPLETED);
            ledger.completeHash(job.hash());
            notifications.publish(batch, ProgressEvent.completed(file));
            LOG.infof("Completed %s in %d ms", file, System.currentTimeMillis() - startTime);
            return JobOutcome.COMPLETED;
        } catch (RuntimeException e) {
            final String error = describe(e);
            LOG.errorf(e, "Job %s failed: %s", file, error);
            recordFailure(job, error);
            return JobOutcome.FAILED;
        }
    }

    private void indexGraph(final Chunk chunk, final String source) {
        try {
            final ExtractedGraph graph = modelProvider.extractGraph(chunk.text()).join();
            for (ExtractedRelationship relationship : graph.completeRelationships()) {
                graphStore.upsertTriple(
                    relationship.source().trim(), relationship.relation(), relationship.target().trim()).join();
            }
            final Set<String> touched = graph.touchedEntities();
            if (!touched.isEmpty()) {
                graphStore.linkChunkToEntities(chunk.id(), touched, source).join();
            }
        } catch (RuntimeException e) {
            recoveryLogger.logSkipped("graph-extraction", source + "#" + chunk.index(), unwrap(e));
        }
    }

    private void indexVector(
            final Chunk chunk,
            final String summary,
            final int pageNumber,
            final String source,
            final String batch) {
        try {
            final String header = modelProvider
                .generate(ModelPrompts.contextualHeader(summary, chunk.text()), ModelPrompts.DEFAULT_SYSTEM)
                .join();
            final String content = "CONTEXT: " + (header != null ? header.strip() : "") + "\n\nCONTENT: " + chunk.text();
            final float[] vector = modelProvider.embed(content).join();
            vectorStore.upsert(chunk.id(), content, vector,
                new ChunkMetadata(source, batch, chunk.index(), chunk.id(), pageNumber)).join();
        } catch (RuntimeException e) {
            recoveryLogger.logSkipped("vector-indexing", source + "#" + chunk.index(), unwrap(e));
        }
    }

    private void recordFailure(final IngestionJob job, final String error) {
        try {
            ledger.markJob(job.batch(), job.path(), JobState.FAILED, error);
            ledger.releaseHash(job.hash());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Could not record failure of %s in the ledger", job.path());
        }
        notifications.publish(job.batch(), ProgressEvent.failed(job.path(), error));
    }

    static Throwable unwrap(final Throwable e) {
        Throwable current = e;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static String describe(final Throwable e) {
        final Throwable cause = unwrap(e);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

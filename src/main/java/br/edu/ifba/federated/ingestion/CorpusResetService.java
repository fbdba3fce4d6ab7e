package br.edu.ifba.federated.ingestion;

import br.edu.ifba.federated.graph.GraphStore;
import br.edu.ifba.federated.ledger.JobLedger;
import br.edu.ifba.federated.vector.VectorStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Wipes the indexed corpus: the vector collection, the graph and every ledger record.
 */
@ApplicationScoped
public class CorpusResetService {

    private static final Logger LOG = Logger.getLogger(CorpusResetService.class);

    private final VectorStore vectorStore;
    private final GraphStore graphStore;
    private final JobLedger ledger;

    @Inject
    public CorpusResetService(final VectorStore vectorStore, final GraphStore graphStore, final JobLedger ledger) {
        this.vectorStore = vectorStore;
        this.graphStore = graphStore;
        this.ledger = ledger;
    }

    /**
     * @return number of ledger keys removed
     */
    public long reset() {
        LOG.warn("Resetting corpus");
        vectorStore.clear().join();
        graphStore.reset().join();
        final long removed = ledger.clear();
        LOG.infof("Corpus reset, %d ledger keys removed", removed);
        return removed;
    }
}

package br.edu.ifba.federated.ingestion;

import br.edu.ifba.federated.graph.InMemoryGraphStore;
import br.edu.ifba.federated.ledger.InMemoryJobLedger;
import br.edu.ifba.federated.ledger.JobState;
import br.edu.ifba.federated.vector.ChunkMetadata;
import br.edu.ifba.federated.vector.InMemoryVectorStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CorpusResetServiceTest {

    @Test
    @DisplayName("reset empties both stores and the ledger")
    void resetsEverything() {
        final InMemoryVectorStore vectorStore = new InMemoryVectorStore();
        final InMemoryGraphStore graphStore = new InMemoryGraphStore();
        final InMemoryJobLedger ledger = new InMemoryJobLedger();
        vectorStore.upsert("c1", "text", new float[]{1f}, new ChunkMetadata("a.pdf", "b1", 0, "c1", 1)).join();
        graphStore.upsertTriple("Acme", "located in", "Paris").join();
        ledger.reserveHash("h1");
        ledger.completeHash("h1");
        ledger.markJob("b1", "a.pdf", JobState.COMPLETED);

        final long removed = new CorpusResetService(vectorStore, graphStore, ledger).reset();

        assertEquals(2, removed);
        assertEquals(0, vectorStore.size());
        assertEquals(0, graphStore.edgeCount());
        assertTrue(ledger.reserveHash("h1"));
    }
}

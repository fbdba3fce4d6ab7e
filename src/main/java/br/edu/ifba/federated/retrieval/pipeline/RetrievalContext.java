package br.edu.ifba.federated.retrieval.pipeline;

import br.edu.ifba.federated.graph.GraphTriple;
import br.edu.ifba.federated.rerank.RankedCandidate;
import br.edu.ifba.federated.retrieval.RetrievalCandidate;
import br.edu.ifba.federated.retrieval.RetrievalMode;
import br.edu.ifba.federated.retrieval.RetrievalRequest;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mutable state carried through the retrieval stages of a single query.
 *
 * <p>Not thread-safe. Stages run one after the other and each one owns the
 * context while it runs.</p>
 */
public class RetrievalContext {

    private final RetrievalRequest request;

    private String refinedQuery;
    private List<String> entities = new ArrayList<>();
    private List<GraphTriple> triples = new ArrayList<>();
    private List<RetrievalCandidate> graphCandidates = new ArrayList<>();
    private List<RetrievalCandidate> vectorCandidates = new ArrayList<>();
    private List<RetrievalCandidate> pool = new ArrayList<>();
    private List<RankedCandidate> ranked = new ArrayList<>();
    private int rerankedCount;
    private String prompt = "";
    private String answer;

    public RetrievalContext(@NotNull final RetrievalRequest request) {
        this.request = Objects.requireNonNull(request, "request must not be null");
        this.refinedQuery = request.query();
    }

    @NotNull
    public RetrievalRequest getRequest() {
        return request;
    }

    @NotNull
    public RetrievalMode getMode() {
        return request.mode();
    }

    @Nullable
    public String getSourceFilter() {
        return request.sourceFilter();
    }

    @NotNull
    public String getRefinedQuery() {
        return refinedQuery;
    }

    public void setRefinedQuery(@NotNull final String refinedQuery) {
        this.refinedQuery = refinedQuery;
    }

    @NotNull
    public List<String> getEntities() {
        return entities;
    }

    public void setEntities(@NotNull final List<String> entities) {
        this.entities = new ArrayList<>(entities);
    }

    @NotNull
    public List<GraphTriple> getTriples() {
        return triples;
    }

    public void setTriples(@NotNull final List<GraphTriple> triples) {
        this.triples = new ArrayList<>(triples);
    }

    @NotNull
    public List<RetrievalCandidate> getGraphCandidates() {
        return graphCandidates;
    }

    public void setGraphCandidates(@NotNull final List<RetrievalCandidate> graphCandidates) {
        this.graphCandidates = new ArrayList<>(graphCandidates);
    }

    @NotNull
    public List<RetrievalCandidate> getVectorCandidates() {
        return vectorCandidates;
    }

    public void setVectorCandidates(@NotNull final List<RetrievalCandidate> vectorCandidates) {
        this.vectorCandidates = new ArrayList<>(vectorCandidates);
    }

    @NotNull
    public List<RetrievalCandidate> getPool() {
        return pool;
    }

    public void setPool(@NotNull final List<RetrievalCandidate> pool) {
        this.pool = new ArrayList<>(pool);
    }

    @NotNull
    public List<RankedCandidate> getRanked() {
        return ranked;
    }

    public void setRanked(@NotNull final List<RankedCandidate> ranked) {
        this.ranked = new ArrayList<>(ranked);
    }

    /**
     * Number of candidates the reranker scored; zero when it did not run.
     */
    public int getRerankedCount() {
        return rerankedCount;
    }

    public void setRerankedCount(final int rerankedCount) {
        this.rerankedCount = rerankedCount;
    }

    @NotNull
    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(@NotNull final String prompt) {
        this.prompt = prompt;
    }

    @Nullable
    public String getAnswer() {
        return answer;
    }

    public void setAnswer(@NotNull final String answer) {
        this.answer = answer;
    }
}

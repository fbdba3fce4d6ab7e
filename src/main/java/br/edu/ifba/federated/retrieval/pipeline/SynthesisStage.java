package br.edu.ifba.federated.retrieval.pipeline;

import br.edu.ifba.federated.graph.GraphTriple;
import br.edu.ifba.federated.model.ModelPrompts;
import br.edu.ifba.federated.model.ModelProvider;
import br.edu.ifba.federated.rerank.RankedCandidate;
import br.edu.ifba.federated.retrieval.RetrievalMode;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Builds the synthesis prompt and asks the cloud channel for the answer.
 *
 * <p>With no ranked passages the not-found answer is returned without a model call.
 * The prompt is still built so it shows up in the debug trace.</p>
 */
public class SynthesisStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(SynthesisStage.class);
    private static final String STAGE_NAME = "synthesis";

    static final String GRAPH_NOT_USED = "N/A";
    static final String NO_RELATIONSHIPS = "No relationships found.";

    private final ModelProvider modelProvider;

    public SynthesisStage(@NotNull final ModelProvider modelProvider) {
        this.modelProvider = modelProvider;
    }

    @Override
    public CompletableFuture<RetrievalContext> process(@NotNull final RetrievalContext context) {
        final String prompt = ModelPrompts.synthesis(
            context.getRequest().query(),
            context.getRefinedQuery(),
            graphSection(context.getMode(), context.getTriples()),
            context.getMode().id(),
            knowledgeSection(context.getRanked()));
        context.setPrompt(prompt);

        if (context.getRanked().isEmpty()) {
            logger.info("No passages retrieved, answering without synthesis");
            context.setAnswer(ModelPrompts.NOT_FOUND_ANSWER);
            return CompletableFuture.completedFuture(context);
        }

        return modelProvider.generateCloud(prompt, ModelPrompts.DEFAULT_SYSTEM).thenApply(answer -> {
            context.setAnswer(answer != null ? answer.trim() : "");
            return context;
        });
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }

    static String graphSection(final RetrievalMode mode, final List<GraphTriple> triples) {
        if (!mode.usesGraph()) {
            return GRAPH_NOT_USED;
        }
        if (triples.isEmpty()) {
            return NO_RELATIONSHIPS;
        }
        return triples.stream().map(GraphTriple::describe).collect(Collectors.joining("\n"));
    }

    static String knowledgeSection(final List<RankedCandidate> ranked) {
        return ranked.stream()
            .map(r -> "- " + r.candidate().text() + " (Src: " + r.candidate().metadata().source() + ")")
            .collect(Collectors.joining("\n"));
    }
}

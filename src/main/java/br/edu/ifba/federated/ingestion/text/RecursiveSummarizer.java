package br.edu.ifba.federated.ingestion.text;

import br.edu.ifba.federated.model.ModelPrompts;
import br.edu.ifba.federated.model.ModelProvider;
import org.jboss.logging.Logger;

/**
 * Summarizes text of any length with bounded prompts.
 *
 * <p>Text shorter than the threshold is summarized in one call. Longer text is split
 * at its midpoint, each half is summarized on its own and the two summaries are
 * merged with one more call. The recursion depth is derived from the text length
 * and capped; text still too long at the last level is cut to the threshold.
 * Merge inputs are cut to half the threshold.</p>
 */
public class RecursiveSummarizer {

    private static final Logger LOG = Logger.getLogger(RecursiveSummarizer.class);

    private final ModelProvider modelProvider;
    private final int threshold;
    private final int maxDepthCap;

    public RecursiveSummarizer(final ModelProvider modelProvider, final int threshold, final int maxDepthCap) {
        if (threshold <= 1) {
            throw new IllegalArgumentException("threshold must be > 1, got: " + threshold);
        }
        this.modelProvider = modelProvider;
        this.threshold = threshold;
        this.maxDepthCap = Math.max(1, maxDepthCap);
    }

    /**
     * @return the summary; may be empty when the model returns nothing
     */
    public String summarize(final String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        final int depth = depthFor(text.length());
        LOG.debugf("Summarizing %d characters, max depth %d", text.length(), depth);
        return summarize(text, depth);
    }

    private String summarize(final String text, final int remainingDepth) {
        if (text.length() < threshold) {
            return nonNull(modelProvider.summarize(text).join());
        }
        if (remainingDepth <= 0) {
            return nonNull(modelProvider.summarize(text.substring(0, threshold)).join());
        }

        final int mid = text.length() / 2;
        final String first = summarize(text.substring(0, mid), remainingDepth - 1);
        final String second = summarize(text.substring(mid), remainingDepth - 1);

        final String prompt = ModelPrompts.summaryMerge(truncate(first), truncate(second));
        return nonNull(modelProvider.generate(prompt, ModelPrompts.DEFAULT_SYSTEM).join());
    }

    /**
     * Halvings needed to bring the text under the threshold, capped.
     */
    int depthFor(final int length) {
        int depth = 0;
        long size = length;
        while (size >= threshold && depth < maxDepthCap) {
            size = (size + 1) / 2;
            depth++;
        }
        return depth;
    }

    private String truncate(final String summary) {
        final int limit = threshold / 2;
        return summary.length() > limit ? summary.substring(0, limit) : summary;
    }

    private static String nonNull(final String value) {
        return value != null ? value.strip() : "";
    }
}

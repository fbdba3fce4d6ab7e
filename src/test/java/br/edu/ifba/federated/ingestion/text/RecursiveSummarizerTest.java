package br.edu.ifba.federated.ingestion.text;

import br.edu.ifba.federated.model.FakeModelProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecursiveSummarizerTest {

    private FakeModelProvider provider;
    private List<Integer> summarizedLengths;

    @BeforeEach
    void setUp() {
        provider = new FakeModelProvider();
        summarizedLengths = new CopyOnWriteArrayList<>();
        provider.summary = text -> {
            summarizedLengths.add(text.length());
            return "part summary";
        };
        provider.generate = (prompt, system) -> "merged summary";
    }

    @Test
    @DisplayName("short text is summarized in one call")
    void shortText() {
        final String summary = new RecursiveSummarizer(provider, 100, 8).summarize("x".repeat(50));

        assertEquals("part summary", summary);
        assertEquals(List.of(50), summarizedLengths);
        assertEquals(0, provider.callCount("generate"));
    }

    @Test
    @DisplayName("long text is split in halves and merged")
    void splitsAndMerges() {
        final String summary = new RecursiveSummarizer(provider, 100, 8).summarize("y".repeat(250));

        assertEquals("merged summary", summary);
        assertEquals(4, provider.callCount("summarize"));
        assertEquals(3, provider.callCount("generate"));
        assertTrue(summarizedLengths.stream().allMatch(length -> length < 100));
    }

    @Test
    @DisplayName("at the depth cap the text is cut to the threshold")
    void depthCap() {
        new RecursiveSummarizer(provider, 100, 1).summarize("z".repeat(400));

        assertEquals(List.of(100, 100), summarizedLengths);
        assertEquals(1, provider.callCount("generate"));
    }

    @Test
    @DisplayName("depth counts halvings until below the threshold")
    void depthFor() {
        final RecursiveSummarizer summarizer = new RecursiveSummarizer(provider, 100, 8);

        assertEquals(0, summarizer.depthFor(99));
        assertEquals(2, summarizer.depthFor(250));
        assertEquals(8, summarizer.depthFor(10_000_000));
    }

    @Test
    @DisplayName("blank text needs no model call")
    void blank() {
        assertEquals("", new RecursiveSummarizer(provider, 100, 8).summarize("   "));
        assertTrue(provider.calls().isEmpty());
    }

    @Test
    @DisplayName("threshold must allow a split")
    void invalidThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new RecursiveSummarizer(provider, 1, 8));
    }
}

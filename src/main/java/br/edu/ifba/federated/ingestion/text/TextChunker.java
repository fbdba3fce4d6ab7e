package br.edu.ifba.federated.ingestion.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into overlapping windows of at most {@code chunkSize} characters.
 *
 * <p>When a window does not reach the end of the text, its end moves back to the
 * last paragraph break, newline or space found in the final 20% of the window, in
 * that order of preference. The next window starts {@code overlap} characters
 * before the previous end and always moves forward. Every chunk is a substring of
 * the input.</p>
 */
public class TextChunker {

    private static final String[] SEPARATORS = {"\n\n", "\n", " "};
    private static final double BOUNDARY_WINDOW = 0.2;

    private final int chunkSize;
    private final int overlap;

    public TextChunker(final int chunkSize, final int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0, got: " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be in [0, chunkSize), got: " + overlap);
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<String> split(final String text) {
        final List<String> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return chunks;
        }

        final int length = text.length();
        int start = 0;
        while (start < length) {
            int end = Math.min(start + chunkSize, length);
            if (end < length) {
                end = boundaryEnd(text, start, end);
            }

            final String chunk = text.substring(start, end).strip();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }
            if (end >= length) {
                break;
            }
            start = Math.max(end - overlap, start + 1);
        }
        return chunks;
    }

    private int boundaryEnd(final String text, final int start, final int end) {
        final int floor = start + (int) Math.ceil(chunkSize * (1 - BOUNDARY_WINDOW));
        for (String separator : SEPARATORS) {
            final int at = text.lastIndexOf(separator, end - separator.length());
            if (at >= floor && at > start) {
                return at + separator.length();
            }
        }
        return end;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int overlap() {
        return overlap;
    }
}

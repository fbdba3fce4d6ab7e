package br.edu.ifba.federated.ingestion.document;

import java.util.ArrayList;
import java.util.List;

/**
 * Concatenated document text with the character range each page occupies.
 *
 * <p>Every page is followed by a blank line ({@code "\n\n"}) and the result is
 * stripped. Offsets are into the stripped text.</p>
 */
public final class PageMap {

    static final String PAGE_SEPARATOR = "\n\n";

    private final String text;
    private final List<Range> ranges;

    private PageMap(final String text, final List<Range> ranges) {
        this.text = text;
        this.ranges = List.copyOf(ranges);
    }

    public static PageMap of(final List<Page> pages) {
        final StringBuilder full = new StringBuilder();
        final List<Range> ranges = new ArrayList<>(pages.size());
        for (Page page : pages) {
            final int start = full.length();
            full.append(page.text()).append(PAGE_SEPARATOR);
            ranges.add(new Range(start, full.length(), page.number()));
        }

        final String raw = full.toString();
        final String stripped = raw.strip();
        final int lead = stripped.isEmpty() ? 0 : raw.indexOf(stripped);
        final List<Range> shifted = new ArrayList<>(ranges.size());
        for (Range range : ranges) {
            shifted.add(new Range(Math.max(0, range.start() - lead), Math.max(0, range.end() - lead), range.page()));
        }
        return new PageMap(stripped, shifted);
    }

    public String text() {
        return text;
    }

    /**
     * @return the page containing the offset, or 0 when no page does
     */
    public int pageAt(final int offset) {
        for (Range range : ranges) {
            if (offset >= range.start() && offset < range.end()) {
                return range.page();
            }
        }
        return 0;
    }

    public int pageCount() {
        return ranges.size();
    }

    public PageLocator locator() {
        return new PageLocator(this);
    }

    record Range(int start, int end, int page) {
    }
}

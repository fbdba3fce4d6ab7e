package br.edu.ifba.federated.ingestion.document;

/**
 * Resolves chunks to pages in document order.
 *
 * <p>Each lookup searches from just after the previous match, so a repeated
 * passage resolves to its next occurrence rather than its first. One locator
 * serves one pass over a document.</p>
 */
public final class PageLocator {

    private final PageMap pageMap;
    private int searchStart = 0;

    PageLocator(final PageMap pageMap) {
        this.pageMap = pageMap;
    }

    /**
     * @return the page of the chunk's next occurrence, or 0 when it is not found
     */
    public int locate(final String chunk) {
        final int index = pageMap.text().indexOf(chunk, searchStart);
        if (index < 0) {
            return 0;
        }
        searchStart = index + 1;
        return pageMap.pageAt(index);
    }

    int searchStart() {
        return searchStart;
    }
}

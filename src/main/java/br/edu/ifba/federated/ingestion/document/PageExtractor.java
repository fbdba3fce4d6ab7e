package br.edu.ifba.federated.ingestion.document;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads one document format into pages.
 */
public interface PageExtractor {

    /**
     * @return pages in document order, numbered from 1
     */
    List<Page> extract(InputStream inputStream) throws IOException;

    boolean supports(String fileName);
}

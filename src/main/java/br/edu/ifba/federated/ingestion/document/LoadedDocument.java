package br.edu.ifba.federated.ingestion.document;

import java.util.List;

/**
 * @param path  source path as given in the job
 * @param pages extracted pages
 * @param map   concatenated text and page ranges
 */
public record LoadedDocument(String path, List<Page> pages, PageMap map) {

    public LoadedDocument {
        pages = List.copyOf(pages);
    }

    public String text() {
        return map.text();
    }
}

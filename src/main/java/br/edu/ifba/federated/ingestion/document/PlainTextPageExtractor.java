package br.edu.ifba.federated.ingestion.document;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Reads any file as UTF-8 text on a single page. Used when no other extractor
 * supports the file name.
 */
public class PlainTextPageExtractor implements PageExtractor {

    @Override
    public List<Page> extract(final InputStream inputStream) throws IOException {
        return List.of(new Page(1, new String(inputStream.readAllBytes(), StandardCharsets.UTF_8)));
    }

    @Override
    public boolean supports(final String fileName) {
        return true;
    }
}

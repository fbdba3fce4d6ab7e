package br.edu.ifba.federated.ingestion.document;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

/**
 * Loads a document from disk into a {@link PageMap}, picking the extractor by file name.
 * Files no extractor claims are read as plain text.
 */
@ApplicationScoped
public class DocumentLoader {

    private static final Logger LOG = Logger.getLogger(DocumentLoader.class);

    private final List<PageExtractor> extractors;
    private final PageExtractor fallback = new PlainTextPageExtractor();

    @Inject
    public DocumentLoader(final Instance<PageExtractor> extractors) {
        this(extractors.stream().toList());
    }

    public DocumentLoader(final List<PageExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    public LoadedDocument load(final Path path) {
        if (!Files.isRegularFile(path)) {
            throw new DocumentLoadException("File not found: " + path);
        }
        final PageExtractor extractor = extractorFor(path.getFileName().toString());
        final List<Page> pages;
        try (InputStream in = Files.newInputStream(path)) {
            pages = extractor.extract(in);
        } catch (IOException | RuntimeException e) {
            throw new DocumentLoadException("Could not read " + path + ": " + e.getMessage(), e);
        }

        final PageMap map = PageMap.of(pages);
        if (map.text().isEmpty()) {
            throw new DocumentLoadException("No text extracted from " + path);
        }
        LOG.infof("Loaded %s: %d pages, %d characters", path, pages.size(), map.text().length());
        return new LoadedDocument(path.toString(), pages, map);
    }

    PageExtractor extractorFor(final String fileName) {
        return extractors.stream()
                .filter(extractor -> extractor.supports(fileName))
                .findFirst()
                .orElse(fallback);
    }
}

package br.edu.ifba.federated.ingestion.document;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;

import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * DOCX files carry no reliable page layout, so the whole body is page 1.
 */
@ApplicationScoped
public class WordPageExtractor implements PageExtractor {

    @Override
    public List<Page> extract(final InputStream inputStream) throws IOException {
        try (XWPFDocument document = new XWPFDocument(inputStream);
             XWPFWordExtractor extractor = new XWPFWordExtractor(document)) {
            return List.of(new Page(1, extractor.getText()));
        }
    }

    @Override
    public boolean supports(final String fileName) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(".docx");
    }
}

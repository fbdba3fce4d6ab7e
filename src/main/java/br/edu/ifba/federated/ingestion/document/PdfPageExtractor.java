package br.edu.ifba.federated.ingestion.document;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import jakarta.enterprise.context.ApplicationScoped;

@ApplicationScoped
public class PdfPageExtractor implements PageExtractor {

    @Override
    public List<Page> extract(final InputStream inputStream) throws IOException {
        try (PDDocument document = PDDocument.load(inputStream)) {
            final PDFTextStripper stripper = new PDFTextStripper();
            final List<Page> pages = new ArrayList<>(document.getNumberOfPages());
            for (int number = 1; number <= document.getNumberOfPages(); number++) {
                stripper.setStartPage(number);
                stripper.setEndPage(number);
                pages.add(new Page(number, stripper.getText(document)));
            }
            return pages;
        }
    }

    @Override
    public boolean supports(final String fileName) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }
}

package com.example.hybridretrieval.infrastructure.ingest;

import java.io.IOException;
import java.io.InputStream;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

@Component
public class PdfExtractor {

    /**
     * Extracts text page by page. Pages are separated by a blank line so the chunker can
     * treat page ends as line breaks.
     */
    public String extractText(InputStream pdfStream) throws IOException {
        try (PDDocument document = PDDocument.load(pdfStream)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);

            StringBuilder sb = new StringBuilder();
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = clean(stripper.getText(document));
                if (pageText.isEmpty()) {
                    continue;
                }
                if (sb.length() > 0) {
                    sb.append("\n\n");
                }
                sb.append(pageText);
            }
            return sb.toString();
        }
    }

    private static String clean(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\u0000", "").trim();
    }
}

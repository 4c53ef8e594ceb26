package com.example.hybridretrieval.infrastructure.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.Test;

class PdfExtractorTest {

    static byte[] pdf(String... pages) throws IOException {
        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (String text : pages) {
                PDPage page = new PDPage();
                doc.addPage(page);
                if (text.isEmpty()) {
                    continue;
                }
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    cs.beginText();
                    cs.setFont(PDType1Font.HELVETICA, 12);
                    cs.newLineAtOffset(72, 700);
                    cs.showText(text);
                    cs.endText();
                }
            }
            doc.save(out);
            return out.toByteArray();
        }
    }

    @Test
    void extractsPagesSeparatedByBlankLine() throws IOException {
        String text = new PdfExtractor().extractText(new ByteArrayInputStream(pdf("First page text", "Second page text")));

        assertThat(text).isEqualTo("First page text\n\nSecond page text");
    }

    @Test
    void emptyPagesAreSkipped() throws IOException {
        String text = new PdfExtractor().extractText(new ByteArrayInputStream(pdf("Only content", "")));

        assertThat(text).isEqualTo("Only content");
    }
}

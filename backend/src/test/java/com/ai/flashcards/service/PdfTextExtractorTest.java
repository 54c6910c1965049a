package com.ai.flashcards.service;

import com.ai.flashcards.exception.ExtractionException;
import com.ai.flashcards.model.ExtractionResult;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfTextExtractorTest {

    @TempDir
    Path tempDir;

    private final PdfTextExtractor extractor = new PdfTextExtractor();

    private Path writePdf(List<List<String>> pages) throws Exception {
        Path file = tempDir.resolve("doc.pdf");
        try (PDDocument doc = new PDDocument()) {
            for (List<String> lines : pages) {
                PDPage page = new PDPage();
                doc.addPage(page);
                if (lines.isEmpty()) {
                    continue;
                }
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    cs.beginText();
                    cs.setFont(PDType1Font.HELVETICA, 11);
                    cs.setLeading(14);
                    cs.newLineAtOffset(50, 700);
                    for (String line : lines) {
                        cs.showText(line);
                        cs.newLine();
                    }
                    cs.endText();
                }
            }
            doc.save(file.toFile());
        }
        return file;
    }

    private static final List<String> FIRST_PAGE = List.of(
            "Photosynthesis converts light energy into chemical energy.",
            "It takes place in the chloroplasts of plant cells.",
            "The light reactions produce ATP and NADPH for the Calvin cycle.");

    @Test
    void shouldExtractTextLayerUpToPageLimit() throws Exception {
        Path pdf = writePdf(List.of(FIRST_PAGE, List.of("Cellular respiration happens in the mitochondria.")));

        ExtractionResult result = extractor.extract(pdf, 1);

        assertThat(result.getPageCount()).isEqualTo(2);
        assertThat(result.getText()).contains("Photosynthesis converts light energy")
                .doesNotContain("mitochondria");
        assertThat(result.isScanned()).isFalse();
        assertThat(result.getConfidence()).isEqualTo(0.95);
    }

    @Test
    void shouldFlagDocumentWithoutTextLayerAsScanned() throws Exception {
        Path pdf = writePdf(List.of(List.of(), List.of()));

        ExtractionResult result = extractor.extract(pdf, 10);

        assertThat(result.getText()).isEmpty();
        assertThat(result.isScanned()).isTrue();
        assertThat(result.getConfidence()).isZero();
    }

    @Test
    void shouldCountPages() throws Exception {
        Path pdf = writePdf(List.of(FIRST_PAGE, List.of(), List.of()));

        assertThat(extractor.countPages(pdf)).isEqualTo(3);
    }

    @Test
    void shouldRejectFilesThatAreNotPdf() throws Exception {
        Path notPdf = Files.writeString(tempDir.resolve("fake.pdf"), "just some text");

        assertThatThrownBy(() -> extractor.countPages(notPdf))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("not a readable PDF");
    }
}

package com.ai.flashcards.service;

import com.ai.flashcards.exception.ExtractionException;
import com.ai.flashcards.model.ExtractionResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * PdfTextExtractor reads the text layer of uploaded PDF files using Apache PDFBox.
 */
@Slf4j
@Service
public class PdfTextExtractor implements TextExtractor {

    /** Below this many characters of text the document is treated as a scan. */
    static final int SCANNED_TEXT_THRESHOLD = 100;

    static final double TEXT_LAYER_CONFIDENCE = 0.95;

    @Override
    public ExtractionResult extract(Path document, int maxPages) throws IOException {
        log.info("Starting PDF text extraction: file={}, maxPages={}", document.getFileName(), maxPages);

        try (PDDocument pdf = load(document)) {
            int pageCount = pdf.getNumberOfPages();
            if (pageCount == 0) {
                throw new ExtractionException("PDF file has no pages.");
            }

            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true); // multi-column layouts
            stripper.setStartPage(1);
            stripper.setEndPage(Math.max(1, Math.min(maxPages, pageCount)));

            String text = stripper.getText(pdf);
            String trimmed = text == null ? "" : text.trim();
            boolean scanned = trimmed.length() < SCANNED_TEXT_THRESHOLD;

            if (scanned) {
                log.warn("PDF has little or no text layer ({} chars): {}", trimmed.length(), document.getFileName());
            }
            log.info("Text extraction complete. pages={}, characters={}", pageCount, trimmed.length());

            return ExtractionResult.builder()
                    .text(trimmed)
                    .pageCount(pageCount)
                    .scanned(scanned)
                    .confidence(scanned ? 0.0 : TEXT_LAYER_CONFIDENCE)
                    .build();
        }
    }

    @Override
    public int countPages(Path document) throws IOException {
        try (PDDocument pdf = load(document)) {
            return pdf.getNumberOfPages();
        }
    }

    private PDDocument load(Path document) throws IOException {
        PDDocument pdf;
        try {
            pdf = PDDocument.load(document.toFile());
        } catch (IOException e) {
            log.error("Failed to open PDF: {}", document.getFileName(), e);
            throw new ExtractionException("The file is not a readable PDF document.", e);
        }
        if (pdf.isEncrypted()) {
            pdf.close();
            log.warn("PDF is encrypted: {}", document.getFileName());
            throw new ExtractionException("Cannot process encrypted PDF files. Please provide an unprotected PDF.");
        }
        return pdf;
    }
}

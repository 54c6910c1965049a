package com.ai.flashcards.service;

import com.ai.flashcards.exception.ValidationException;
import com.ai.flashcards.model.DocumentHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Validates an upload, spools it to the temp directory and counts its pages.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentIntakeService {

    private static final String PDF_EXTENSION = ".pdf";

    private final TempFileService tempFileService;
    private final TextExtractor textExtractor;

    public DocumentHandle accept(MultipartFile file) throws IOException {
        validate(file);

        Path spooled = tempFileService.spool(file, PDF_EXTENSION);
        try {
            int pageCount = textExtractor.countPages(spooled);
            if (pageCount <= 0) {
                throw new ValidationException("PDF file has no pages.");
            }
            log.info("Accepted upload '{}': {} page(s), {}KB",
                    file.getOriginalFilename(), pageCount, file.getSize() / 1024);
            return DocumentHandle.builder()
                    .path(spooled)
                    .fileName(file.getOriginalFilename())
                    .sizeBytes(file.getSize())
                    .pageCount(pageCount)
                    .build();
        } catch (IOException | RuntimeException e) {
            tempFileService.release(spooled);
            throw e;
        }
    }

    private void validate(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("Uploaded file is empty. Please select a valid PDF.");
        }
        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || !originalFilename.toLowerCase().endsWith(PDF_EXTENSION)) {
            throw new ValidationException("Only PDF files are accepted. Received: " + originalFilename);
        }
        String contentType = file.getContentType();
        if (contentType != null && !contentType.equals("application/pdf")) {
            log.warn("Unexpected content type: {}. Proceeding with filename-based validation.", contentType);
        }
    }
}

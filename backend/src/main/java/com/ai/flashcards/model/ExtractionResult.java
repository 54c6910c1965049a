package com.ai.flashcards.model;

import lombok.Builder;
import lombok.Value;

/**
 * Text pulled out of a document plus what the extractor learned about it.
 */
@Value
@Builder
public class ExtractionResult {

    String text;

    /** Total pages in the document, not only the pages read. */
    int pageCount;

    /** True when the document carries almost no text layer (image-only scan). */
    boolean scanned;

    /** Extractor confidence in [0, 1]. */
    double confidence;
}

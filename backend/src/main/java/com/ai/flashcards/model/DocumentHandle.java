package com.ai.flashcards.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * An uploaded document spooled to local storage and analysed for its page count.
 * The job that receives it becomes responsible for deleting the file.
 */
@Value
@Builder
public class DocumentHandle {

    Path path;

    String fileName;

    long sizeBytes;

    int pageCount;
}

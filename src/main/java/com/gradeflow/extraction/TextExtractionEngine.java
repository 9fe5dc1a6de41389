package com.gradeflow.extraction;

import java.nio.file.Path;

/**
 * Turns one local file into plain text. Implementations must be safe to call from several threads.
 */
public interface TextExtractionEngine {

    boolean supports(String extension);

    /**
     * @param extension lower-case extension of the submitted file name; the local path may have none
     * @throws UnsupportedFormatException if the file's format is not handled by this engine
     * @throws ExtractionException        if the file is unreadable or contains no text
     */
    String extractText(Path file, String extension) throws ExtractionException;
}

package com.gradeflow.extraction;

import java.util.List;

/**
 * Text of one submission, concatenated over its readable files
 *
 * @param text     combined text with one header per file, empty when no file was readable
 * @param failures one message per file that could not be read
 */
public record ExtractionResult(String text, int readableFiles, List<String> failures) {

    public ExtractionResult {
        failures = List.copyOf(failures);
    }

    public boolean hasText() {
        return readableFiles > 0;
    }
}

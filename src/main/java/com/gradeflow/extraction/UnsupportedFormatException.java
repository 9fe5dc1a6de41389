package com.gradeflow.extraction;

/**
 * No extraction engine handles the file's format
 */
public class UnsupportedFormatException extends ExtractionException {
    private final String extension;

    public UnsupportedFormatException(String extension) {
        super("Unsupported file format: " + (extension.isEmpty() ? "<none>" : "." + extension));
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}

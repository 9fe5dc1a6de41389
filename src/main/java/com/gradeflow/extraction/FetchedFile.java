package com.gradeflow.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A submission file available on local disk. Downloaded copies are temporary and deleted on close.
 */
public final class FetchedFile implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FetchedFile.class);

    private final String name;
    private final Path path;
    private final boolean temporary;

    private FetchedFile(String name, Path path, boolean temporary) {
        this.name = name;
        this.path = path;
        this.temporary = temporary;
    }

    public static FetchedFile local(String name, Path path) {
        return new FetchedFile(name, path, false);
    }

    public static FetchedFile temporary(String name, Path path) {
        return new FetchedFile(name, path, true);
    }

    public String getName() { return name; }
    public Path getPath() { return path; }
    public boolean isTemporary() { return temporary; }

    @Override
    public void close() {
        if (!temporary) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}: {}", path, e.getMessage());
        }
    }
}

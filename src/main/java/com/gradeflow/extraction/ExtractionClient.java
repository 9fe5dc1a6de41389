package com.gradeflow.extraction;

import com.gradeflow.models.FileReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces the text of a submission from its files. A file that cannot be fetched or read is
 * skipped and reported; the caller decides what an all-failed result means.
 */
public class ExtractionClient {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionClient.class);

    private final FileFetcher fileFetcher;
    private final List<TextExtractionEngine> engines;

    public ExtractionClient() {
        this(new FileFetcher(), List.of(new PlainTextExtractionEngine()));
    }

    /**
     * Client restricted to the files {@code policy} allows, reading at most {@code maxFileBytes} per file
     */
    public ExtractionClient(FileAccessPolicy policy, long maxFileBytes) {
        this(new FileFetcher(policy, maxFileBytes), List.of(new PlainTextExtractionEngine(maxFileBytes)));
    }

    public ExtractionClient(FileFetcher fileFetcher, List<TextExtractionEngine> engines) {
        this.fileFetcher = fileFetcher;
        this.engines = List.copyOf(engines);
    }

    public ExtractionResult extract(List<FileReference> files) {
        StringBuilder text = new StringBuilder();
        List<String> failures = new ArrayList<>();
        int readable = 0;

        for (FileReference file : files) {
            try {
                String content = extractOne(file);
                if (text.length() > 0) {
                    text.append("\n\n");
                }
                text.append("=== File: ").append(file.name()).append(" ===\n");
                text.append(content);
                readable++;
            } catch (ExtractionException e) {
                logger.warn("Skipping file {}: {}", file.name(), e.getMessage());
                failures.add(file.name() + ": " + e.getMessage());
            }
        }

        logger.debug("Extracted text from {}/{} files", readable, files.size());
        return new ExtractionResult(text.toString(), readable, failures);
    }

    private String extractOne(FileReference file) throws ExtractionException {
        String extension = file.extension();
        TextExtractionEngine engine = engineFor(extension);
        try (FetchedFile fetched = fileFetcher.fetch(file)) {
            return engine.extractText(fetched.getPath(), extension);
        }
    }

    private TextExtractionEngine engineFor(String extension) throws UnsupportedFormatException {
        for (TextExtractionEngine engine : engines) {
            if (engine.supports(extension)) {
                return engine;
            }
        }
        throw new UnsupportedFormatException(extension);
    }
}

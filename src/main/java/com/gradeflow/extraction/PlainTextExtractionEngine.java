package com.gradeflow.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extraction engine for text-based formats: prose, markup, data files and source code.
 * Binary documents (PDF, images, office files) need a dedicated engine.
 */
public class PlainTextExtractionEngine implements TextExtractionEngine {
    private static final Logger logger = LoggerFactory.getLogger(PlainTextExtractionEngine.class);

    private static final Set<String> TEXT_EXTENSIONS = Set.of(
            "txt", "text", "md", "markdown", "rst", "tex", "csv", "tsv", "json", "xml", "yaml", "yml", "log",
            "html", "htm",
            "java", "py", "js", "ts", "c", "h", "cpp", "hpp", "cs", "go", "rb", "rs", "kt", "scala", "sql", "sh", "r", "m"
    );
    private static final Set<String> MARKUP_EXTENSIONS = Set.of("html", "htm");

    private static final Pattern SCRIPT_OR_STYLE = Pattern.compile("(?is)<(script|style)[^>]*>.*?</\\1>");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern TRAILING_SPACES = Pattern.compile("[ \\t]+\\n");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    private final long maxBytes;

    public PlainTextExtractionEngine() {
        this(10L * 1024 * 1024);
    }

    public PlainTextExtractionEngine(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    @Override
    public boolean supports(String extension) {
        return TEXT_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    @Override
    public String extractText(Path file, String extension) throws ExtractionException {
        if (!supports(extension)) {
            throw new UnsupportedFormatException(extension);
        }

        String content;
        try {
            long size = Files.size(file);
            if (size > maxBytes) {
                throw new ExtractionException("File too large for extraction: " + size + " bytes");
            }
            byte[] bytes = Files.readAllBytes(file);
            content = decode(bytes);
        } catch (IOException e) {
            throw new ExtractionException("Could not read " + file.getFileName() + ": " + e.getMessage(), e);
        }

        if (MARKUP_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT))) {
            content = stripMarkup(content);
        }
        String text = normalize(content);
        if (text.isEmpty()) {
            throw new ExtractionException("No text found in " + file.getFileName());
        }
        logger.debug("Extracted {} characters from {}", text.length(), file.getFileName());
        return text;
    }

    static String normalize(String content) {
        String text = content.replace("\uFEFF", "").replace("\r\n", "\n").replace('\r', '\n');
        text = TRAILING_SPACES.matcher(text).replaceAll("\n");
        text = BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.trim();
    }

    private static String stripMarkup(String html) {
        String text = SCRIPT_OR_STYLE.matcher(html).replaceAll(" ");
        text = TAG.matcher(text).replaceAll(" ");
        return text.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&amp;", "&");
    }

    private static String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            // not UTF-8; Latin-1 maps every byte
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }
}

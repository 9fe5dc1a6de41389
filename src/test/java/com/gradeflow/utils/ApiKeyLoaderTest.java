package com.gradeflow.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ApiKeyLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void environmentTakesPrecedence() throws Exception {
        Path dotEnv = tempDir.resolve(".env");
        Files.writeString(dotEnv, "OPENAI_API_KEY=from-file\n");

        assertEquals("from-env", ApiKeyLoader.loadOpenAIKey(
                Map.of("OPENAI_API_KEY", " from-env "), dotEnv, "from-config"));
    }

    @Test
    void dotEnvIsUsedWhenEnvironmentHasNoKey() throws Exception {
        Path dotEnv = tempDir.resolve(".env");
        Files.writeString(dotEnv, "# keys\nexport OTHER=1\nexport OPENAI_API_KEY=\"quoted-key\"\n");

        assertEquals("quoted-key", ApiKeyLoader.loadOpenAIKey(Map.of(), dotEnv, "from-config"));
    }

    @Test
    void placeholdersAreIgnored() {
        Path missing = tempDir.resolve("missing.env");

        assertEquals("from-config", ApiKeyLoader.loadOpenAIKey(
                Map.of("OPENAI_API_KEY", "your-openai-api-key-here"), missing, "from-config"));
        assertNull(ApiKeyLoader.loadOpenAIKey(Map.of(), missing, "  "));
    }
}

package com.gradeflow.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Resolves the provider API key from the environment, a .env file, or configuration, in that order
 */
public final class ApiKeyLoader {
    private static final Logger logger = LoggerFactory.getLogger(ApiKeyLoader.class);

    public static final String API_KEY_VARIABLE = "OPENAI_API_KEY";
    private static final String PLACEHOLDER = "your-openai-api-key-here";

    private ApiKeyLoader() {
    }

    /**
     * @param configuredKey the key from {@code gradeflow.provider.api-key}, may be null
     * @return the key, or null when none is available
     */
    public static String loadOpenAIKey(String configuredKey) {
        return loadOpenAIKey(System.getenv(), Paths.get(".env"), configuredKey);
    }

    static String loadOpenAIKey(Map<String, String> environment, Path dotEnv, String configuredKey) {
        String apiKey = environment.get(API_KEY_VARIABLE);
        if (isUsable(apiKey)) {
            logger.info("Using OpenAI API key from environment variable");
            return apiKey.trim();
        }

        apiKey = loadFromDotEnv(dotEnv, API_KEY_VARIABLE);
        if (isUsable(apiKey)) {
            logger.info("Using OpenAI API key from .env file");
            return apiKey.trim();
        }

        if (isUsable(configuredKey)) {
            logger.info("Using OpenAI API key from configuration");
            return configuredKey.trim();
        }

        logger.warn("No OpenAI API key found");
        return null;
    }

    public static boolean isUsable(String apiKey) {
        return apiKey != null && !apiKey.isBlank() && !apiKey.trim().equals(PLACEHOLDER);
    }

    /**
     * Load a key from a .env file (simple parser).
     */
    static String loadFromDotEnv(Path envPath, String keyName) {
        if (!Files.exists(envPath)) {
            return null;
        }
        try {
            for (String rawLine : Files.readAllLines(envPath)) {
                String line = rawLine.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                if (line.startsWith("export ")) line = line.substring(7).trim();
                int eq = line.indexOf('=');
                if (eq <= 0) continue;
                String k = line.substring(0, eq).trim();
                String v = line.substring(eq + 1).trim();
                if (v.length() >= 2 && ((v.startsWith("\"") && v.endsWith("\"")) || (v.startsWith("'") && v.endsWith("'")))) {
                    v = v.substring(1, v.length() - 1);
                }
                if (k.equals(keyName)) {
                    return v;
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to read .env file: {}", e.getMessage());
        }
        return null;
    }
}

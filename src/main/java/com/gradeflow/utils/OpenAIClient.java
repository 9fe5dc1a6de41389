package com.gradeflow.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeflow.grading.GradingPromptBuilder;
import com.gradeflow.grading.GradingProvider;
import com.gradeflow.grading.GradingRequest;
import com.gradeflow.grading.ProviderException;
import com.gradeflow.grading.RetryDelayParser;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client for the OpenAI chat completions API.
 * One HTTP request per call; retrying is left to the caller.
 */
public class OpenAIClient implements GradingProvider {
    private static final Logger logger = LoggerFactory.getLogger(OpenAIClient.class);

    private static final MediaType JSON = MediaType.get("application/json");
    private static final int MAX_ERROR_BODY = 500;
    private static final String SYSTEM_PROMPT =
            "You are an academic grading assistant. Always answer with a single JSON object.";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String model;

    public OpenAIClient(String apiKey, String baseUrl, String model, Duration requestTimeout) {
        this.apiKey = apiKey;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.model = model;
        this.objectMapper = new ObjectMapper();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public String requestGrading(GradingRequest gradingRequest) throws ProviderException {
        String prompt = GradingPromptBuilder.buildPrompt(gradingRequest);

        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(Map.of(
                    "model", model,
                    "messages", List.of(
                            Map.of("role", "system", "content", SYSTEM_PROMPT),
                            Map.of("role", "user", "content", prompt)),
                    "temperature", 0.0,
                    "max_tokens", 1500,
                    "response_format", Map.of("type", "json_object")
            ));
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.NO_STATUS, "Could not build request: " + e.getOriginalMessage(), null, e);
        }

        Request request = new Request.Builder()
                .url(baseUrl + "/chat/completions")
                .addHeader("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(requestBody, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String body = bodyText(response);
            if (!response.isSuccessful()) {
                throw failure(response, body);
            }
            return extractContent(body);
        } catch (IOException e) {
            throw new ProviderException(ProviderException.NO_STATUS, "OpenAI API request failed: " + e.getMessage(), null, e);
        }
    }

    @Override
    public boolean isConfigured() {
        return ApiKeyLoader.isUsable(apiKey) && baseUrl != null && !baseUrl.isBlank();
    }

    @Override
    public void ping(Duration timeout) throws ProviderException {
        OkHttpClient pingClient = httpClient.newBuilder()
                .callTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .build();
        Request request = new Request.Builder()
                .url(baseUrl + "/models")
                .addHeader("Authorization", "Bearer " + apiKey)
                .get()
                .build();
        try (Response response = pingClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw failure(response, bodyText(response));
            }
            logger.debug("OpenAI API reachable at {}", baseUrl);
        } catch (IOException e) {
            throw new ProviderException(ProviderException.NO_STATUS, "OpenAI API unreachable: " + e.getMessage(), null, e);
        }
    }

    @Override
    public String getName() {
        return "openai:" + model;
    }

    /**
     * Content of the first choice; an empty string when the response carries none
     */
    private String extractContent(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (content.isTextual()) {
                return content.asText();
            }
        } catch (JsonProcessingException e) {
            logger.warn("Unparseable OpenAI API response: {}", e.getOriginalMessage());
        }
        return "";
    }

    private ProviderException failure(Response response, String body) {
        Duration retryAfter = RetryDelayParser.parseRetryAfterHeader(response.header("Retry-After")).orElse(null);
        String detail = body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "..." : body;
        String message = "OpenAI API request failed: " + response.code() + " " + response.message()
                + (detail.isBlank() ? "" : " - " + detail);
        logger.debug("{}", message);
        return new ProviderException(response.code(), message, retryAfter, null);
    }

    private static String bodyText(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

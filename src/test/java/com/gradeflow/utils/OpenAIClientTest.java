package com.gradeflow.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeflow.grading.GradingRequest;
import com.gradeflow.grading.ProviderException;
import com.gradeflow.models.Criterion;
import com.gradeflow.models.RubricDefinition;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class OpenAIClientTest {

    private static final RubricDefinition RUBRIC = RubricDefinition.of(new Criterion("Clarity", 10, "Clear prose"));

    private MockWebServer server;
    private OpenAIClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new OpenAIClient("test-key", server.url("/v1/").toString(), "gpt-test", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void sendsPromptAndReturnsMessageContent() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"choices\": [{\"message\": {\"role\": \"assistant\", \"content\": \"{\\\"total_score\\\": 7}\"}}]}"));

        String content = client.requestGrading(new GradingRequest("My essay", RUBRIC, 0.5, 0));

        assertEquals("{\"total_score\": 7}", content);
        RecordedRequest recorded = server.takeRequest();
        assertEquals("/v1/chat/completions", recorded.getPath());
        assertEquals("Bearer test-key", recorded.getHeader("Authorization"));
        JsonNode body = new ObjectMapper().readTree(recorded.getBody().readUtf8());
        assertEquals("gpt-test", body.get("model").asText());
        assertTrue(body.get("messages").get(1).get("content").asText().contains("Clarity"));
        assertTrue(body.get("messages").get(1).get("content").asText().contains("My essay"));
    }

    @Test
    void errorResponseCarriesStatusAndRetryAfter() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "12")
                .setBody("{\"error\": {\"message\": \"Rate limit reached\"}}"));

        ProviderException e = assertThrows(ProviderException.class,
                () -> client.requestGrading(new GradingRequest("text", RUBRIC, 0.5, 0)));

        assertEquals(429, e.getStatusCode());
        assertEquals(Optional.of(Duration.ofSeconds(12)), e.getRetryAfter());
        assertTrue(e.getMessage().contains("Rate limit reached"));
    }

    @Test
    void missingContentIsEmptyAnswer() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"choices\": []}"));

        assertEquals("", client.requestGrading(new GradingRequest("text", RUBRIC, 0.5, 0)));
    }

    @Test
    void pingChecksModelsEndpoint() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"data\": []}"));
        client.ping(Duration.ofSeconds(2));
        assertEquals("/v1/models", server.takeRequest().getPath());

        server.enqueue(new MockResponse().setResponseCode(401));
        ProviderException e = assertThrows(ProviderException.class, () -> client.ping(Duration.ofSeconds(2)));
        assertEquals(401, e.getStatusCode());
    }

    @Test
    void configuredOnlyWithUsableKey() {
        assertTrue(client.isConfigured());
        assertFalse(new OpenAIClient(null, "https://api.example.com/v1", "m", Duration.ofSeconds(1)).isConfigured());
    }
}

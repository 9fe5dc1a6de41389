package com.gradeflow.grading;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class RetryDelayParserTest {

    @Test
    void parsesRetryDelayBlock() {
        String error = "429 Resource has been exhausted (e.g. check quota).\n"
                + "violations { quota_metric: \"generate_content_requests\" }\n"
                + "retry_delay {\n  seconds: 45\n}";
        assertEquals(Optional.of(Duration.ofSeconds(45)), RetryDelayParser.parse(error));
    }

    @Test
    void parsesFractionalSeconds() {
        assertEquals(Optional.of(Duration.ofMillis(2500)), RetryDelayParser.parse("retry_delay { seconds: 2.5 }"));
    }

    @Test
    void parsesJsonForm() {
        String error = "{\"error\": {\"details\": [{\"retryDelay\": \"12s\"}]}}";
        assertEquals(Optional.of(Duration.ofSeconds(12)), RetryDelayParser.parse(error));
    }

    @Test
    void noMatchIsEmpty() {
        assertTrue(RetryDelayParser.parse("Internal server error").isEmpty());
        assertTrue(RetryDelayParser.parse("").isEmpty());
        assertTrue(RetryDelayParser.parse(null).isEmpty());
        assertTrue(RetryDelayParser.parse("retry_delay { seconds: soon }").isEmpty());
    }

    @Test
    void parsesRetryAfterHeaderSeconds() {
        assertEquals(Optional.of(Duration.ofSeconds(7)), RetryDelayParser.parseRetryAfterHeader("7"));
        assertTrue(RetryDelayParser.parseRetryAfterHeader("Wed, 21 Oct 2015 07:28:00 GMT").isEmpty());
        assertTrue(RetryDelayParser.parseRetryAfterHeader(null).isEmpty());
    }
}

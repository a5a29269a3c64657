package io.webtimer4j.internal.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.webtimer4j.config.WebTimerProperties;
import io.webtimer4j.core.AttemptContext;
import io.webtimer4j.core.AttemptResult;
import io.webtimer4j.core.ErrorKind;
import io.webtimer4j.core.HttpMethod;
import io.webtimer4j.core.Schedule;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OkHttpRequestExecutorTest {

    private static final AttemptContext CTX = new AttemptContext("req-1", 1, Duration.ofSeconds(5));

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private WebTimerProperties.Http http;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        http = new WebTimerProperties.Http();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void successShouldCaptureStatusBodyAndTiming() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"status\":\"ok\"}"));

        AttemptResult result = executor().execute(get("health"), CTX);

        assertTrue(result.success());
        assertEquals(200, result.statusCode());
        assertEquals("{\"status\":\"ok\"}", result.bodyAsString());
        assertFalse(result.bodyTruncated());
        assertEquals("req-1", result.requestId());
        assertTrue(result.responseTimeMs() >= 0);

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("GET", recorded.getMethod());
        assertEquals("WebRequestTimer/1.0", recorded.getHeader("User-Agent"));
    }

    @Test
    void non2xxShouldBeStatusFailure() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));

        AttemptResult result = executor().execute(get("health"), CTX);

        assertFalse(result.success());
        assertEquals(ErrorKind.HTTP_STATUS, result.errorKind());
        assertEquals(500, result.statusCode());
        assertTrue(result.error().startsWith("HTTP 500"));
    }

    @Test
    void redirectStatusShouldFailWhenRedirectsAreNotFollowed() {
        http.setFollowRedirects(false);
        server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "/elsewhere"));

        AttemptResult result = executor().execute(get("moved"), CTX);

        assertFalse(result.success());
        assertEquals(302, result.statusCode());
    }

    @Test
    void configuredExtraStatusCodesShouldCountAsSuccess() {
        http.setSuccessStatusCodes(Set.of(304));
        server.enqueue(new MockResponse().setResponseCode(304));

        AttemptResult result = executor().execute(get("cached"), CTX);

        assertTrue(result.success());
        assertEquals(304, result.statusCode());
    }

    @Test
    void timeoutShouldBeTransportFailure() {
        server.enqueue(new MockResponse().setBody("late").setHeadersDelay(2, TimeUnit.SECONDS));

        AttemptResult result = executor().execute(get("slow"), new AttemptContext("req-2", 2, Duration.ofMillis(300)));

        assertFalse(result.success());
        assertEquals(ErrorKind.TRANSPORT, result.errorKind());
        assertNull(result.statusCode());
        assertEquals(2, result.attempt());
        assertTrue(result.error().contains("timeout"));
    }

    @Test
    void connectionRefusedShouldBeTransportFailure() throws IOException {
        String url = server.url("/gone").toString();
        server.shutdown();
        Schedule schedule = Schedule.builder("gone").url(url).everySeconds(60).build();

        AttemptResult result = executor().execute(schedule, CTX);

        assertFalse(result.success());
        assertEquals(ErrorKind.TRANSPORT, result.errorKind());
        assertNull(result.statusCode());
    }

    @Test
    void bodyShouldBeCappedAtMaxBodyBytes() {
        http.setMaxBodyBytes(10);
        server.enqueue(new MockResponse().setBody("0123456789ABCDEF"));

        AttemptResult result = executor().execute(get("big"), CTX);

        assertTrue(result.success());
        assertEquals("0123456789", result.bodyAsString());
        assertTrue(result.bodyTruncated());
    }

    @Test
    void jsonBodyShouldGetAutoTimestampAndJsonContentType() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));
        Schedule schedule = Schedule.builder("post")
                .url(server.url("/events").toString())
                .method(HttpMethod.POST)
                .header("X-Token", "secret")
                .body("{\"event\":\"ping\",\"timestamp\":\"auto\"}")
                .everySeconds(60)
                .build();

        AttemptResult result = executor().execute(schedule, CTX);
        assertTrue(result.success());

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("POST", recorded.getMethod());
        assertEquals("secret", recorded.getHeader("X-Token"));
        assertTrue(recorded.getHeader("Content-Type").startsWith("application/json"));
        JsonNode sent = objectMapper.readTree(recorded.getBody().readString(StandardCharsets.UTF_8));
        assertEquals("ping", sent.get("event").asText());
        assertNotEquals("auto", sent.get("timestamp").asText());
    }

    @Test
    void plainBodyShouldBeSentVerbatimAsText() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        Schedule schedule = Schedule.builder("put")
                .url(server.url("/raw").toString())
                .method(HttpMethod.PUT)
                .body("hello world")
                .everySeconds(60)
                .build();

        executor().execute(schedule, CTX);

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("hello world", recorded.getBody().readString(StandardCharsets.UTF_8));
        assertTrue(recorded.getHeader("Content-Type").startsWith("text/plain"));
    }

    @Test
    void postWithoutBodyShouldSendEmptyBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        Schedule schedule = Schedule.builder("empty").url(server.url("/hook").toString())
                .method(HttpMethod.POST).everySeconds(60).build();

        AttemptResult result = executor().execute(schedule, CTX);

        assertTrue(result.success());
        assertEquals(0, server.takeRequest(1, TimeUnit.SECONDS).getBodySize());
    }

    private OkHttpRequestExecutor executor() {
        return new OkHttpRequestExecutor(http, objectMapper);
    }

    private Schedule get(String path) {
        return Schedule.builder(path).url(server.url("/" + path).toString()).everySeconds(60).build();
    }
}

package io.webtimer4j.internal.udp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.webtimer4j.core.AttemptContext;
import io.webtimer4j.core.AttemptResult;
import io.webtimer4j.core.ChangeResult;
import io.webtimer4j.core.NotificationDeliveryException;
import io.webtimer4j.core.NotificationEvent;
import io.webtimer4j.core.NotificationSettings;
import io.webtimer4j.core.NotificationType;
import io.webtimer4j.core.Schedule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UdpNotificationDispatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final NotificationPayloadMapper mapper =
            new NotificationPayloadMapper(objectMapper, "WebRequestTimer", "1.0");

    private DatagramSocket receiver;
    private UdpNotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() throws Exception {
        receiver = new DatagramSocket(0, InetAddress.getLoopbackAddress());
        receiver.setSoTimeout(3000);
        dispatcher = new UdpNotificationDispatcher(mapper);
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
        receiver.close();
    }

    @Test
    void changedResponseShouldArriveAsOneJsonDatagram() throws Exception {
        NotificationEvent event = event(NotificationType.RESPONSE_CHANGED, success("{\"v\":2}"),
                new ChangeResult(true, "old-hash", "new-hash"));

        dispatcher.dispatch(event, settings(Duration.ZERO, 1024));
        JsonNode json = receive();

        assertEquals("WebRequestTimer", json.get("application").asText());
        assertEquals("1.0", json.get("version").asText());
        assertEquals("response_changed", json.get("notification_type").asText());
        assertEquals("api_check", json.get("schedule").get("id").asText());
        assertEquals("GET", json.get("schedule").get("method").asText());
        assertEquals("req-9", json.get("request_result").get("request_id").asText());
        assertEquals(200, json.get("request_result").get("status_code").asInt());
        assertEquals(2, json.get("request_result").get("attempt").asInt());
        assertTrue(json.get("additional_data").get("is_response_changed").asBoolean());
        assertEquals("new-hash", json.get("additional_data").get("response_hash").asText());
        assertEquals("old-hash", json.get("additional_data").get("previous_hash").asText());
        assertEquals(2, json.get("response_body").get("v").asInt());
        assertTrue(json.get("timestamp").asText().endsWith("Z"));
        assertEquals(1, dispatcher.sentCount());
    }

    @Test
    void failureShouldCarryErrorAndNoBody() throws Exception {
        AttemptContext ctx = new AttemptContext("req-3", 4, Duration.ofSeconds(1));
        AttemptResult failed = AttemptResult.statusFailure(ctx, "api_check", Instant.now(), 503,
                Duration.ofMillis(40), "HTTP 503 Service Unavailable", "down".getBytes(StandardCharsets.UTF_8), false);

        dispatcher.dispatch(event(NotificationType.FAILURE, failed, ChangeResult.notCompared("h")), settings(Duration.ZERO, 1024));
        JsonNode json = receive();

        assertEquals("failure", json.get("notification_type").asText());
        assertEquals("HTTP 503 Service Unavailable", json.get("error").asText());
        assertEquals(4, json.get("additional_data").get("attempt_count").asInt());
        assertFalse(json.get("request_result").get("success").asBoolean());
        assertFalse(json.has("response_body"));
    }

    @Test
    void oversizedBodyShouldBeCutAndFlagged() throws Exception {
        String body = "x".repeat(100);

        dispatcher.dispatch(event(NotificationType.FIRST_SUCCESS, success(body), new ChangeResult(true, null, "h")),
                settings(Duration.ZERO, 16));
        JsonNode json = receive();

        assertEquals("x".repeat(16), json.get("response_body").asText());
        assertTrue(json.get("response_body_truncated").asBoolean());
        assertEquals(100, json.get("response_size_bytes").asInt());
    }

    @Test
    void cutBodyShouldNotSplitMultiByteCharacters() throws Exception {
        // 'é' is two bytes in UTF-8, so a 5-byte limit falls inside the third character
        String body = "ééééé";

        dispatcher.dispatch(event(NotificationType.FIRST_SUCCESS, success(body), new ChangeResult(true, null, "h")),
                settings(Duration.ZERO, 5));
        JsonNode json = receive();

        assertEquals("éé", json.get("response_body").asText());
        assertFalse(json.get("response_body").asText().contains("\uFFFD"));
        assertEquals(10, json.get("response_size_bytes").asInt());
    }

    @Test
    void utf8BoundaryShouldBackOffToCharacterStart() {
        byte[] euro = "a€b".getBytes(StandardCharsets.UTF_8);

        assertEquals(1, NotificationPayloadMapper.utf8Boundary(euro, 2));
        assertEquals(1, NotificationPayloadMapper.utf8Boundary(euro, 3));
        assertEquals(4, NotificationPayloadMapper.utf8Boundary(euro, 4));
        assertEquals(5, NotificationPayloadMapper.utf8Boundary(euro, 5));
    }

    @Test
    void sendShouldBeDelayed() throws Exception {
        long started = System.nanoTime();

        dispatcher.dispatch(event(NotificationType.RECOVERY, success("ok"), new ChangeResult(true, "a", "b")),
                settings(Duration.ofMillis(300), 1024));
        JsonNode json = receive();

        assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() >= 250);
        assertEquals("recovery", json.get("notification_type").asText());
    }

    @Test
    void disabledSettingsShouldSendNothing() throws Exception {
        NotificationSettings off = NotificationSettings.disabled();

        dispatcher.dispatch(event(NotificationType.FAILURE, success("ok"), ChangeResult.notCompared(null)), off);

        receiver.setSoTimeout(300);
        assertThrows(SocketTimeoutException.class, () -> receiver.receive(new DatagramPacket(new byte[1024], 1024)));
    }

    @Test
    void sendFailureShouldBeCountedNotThrown() {
        UdpNotificationDispatcher failing = new UdpNotificationDispatcher(mapper) {
            @Override
            protected void send(InetSocketAddress target, byte[] payload) throws IOException {
                throw new IOException("network unreachable");
            }
        };

        failing.dispatch(event(NotificationType.FIRST_SUCCESS, success("ok"), new ChangeResult(true, null, "h")),
                settings(Duration.ZERO, 1024));
        failing.close();

        assertEquals(1, failing.failedCount());
        assertEquals(0, failing.sentCount());
    }

    @Test
    void closedDispatcherShouldRejectNewEvents() {
        dispatcher.close();

        assertThrows(NotificationDeliveryException.class, () -> dispatcher.dispatch(
                event(NotificationType.FIRST_SUCCESS, success("ok"), new ChangeResult(true, null, "h")),
                settings(Duration.ZERO, 1024)));
    }

    private JsonNode receive() throws Exception {
        byte[] buf = new byte[65_535];
        DatagramPacket packet = new DatagramPacket(buf, buf.length);
        receiver.receive(packet);
        return objectMapper.readTree(new String(packet.getData(), 0, packet.getLength(), StandardCharsets.UTF_8));
    }

    private NotificationSettings settings(Duration delay, int maxResponseSize) {
        return new NotificationSettings(true, "127.0.0.1", receiver.getLocalPort(), delay,
                true, true, true, maxResponseSize, false);
    }

    private static AttemptResult success(String body) {
        AttemptContext ctx = new AttemptContext("req-9", 2, Duration.ofSeconds(1));
        return AttemptResult.success(ctx, "api_check", Instant.now(), 200, Duration.ofMillis(12),
                body.getBytes(StandardCharsets.UTF_8), false);
    }

    private static NotificationEvent event(NotificationType type, AttemptResult result, ChangeResult change) {
        Schedule schedule = Schedule.builder("api_check")
                .name("API health")
                .url("https://example.com/health")
                .everySeconds(300)
                .build();
        return new NotificationEvent(type, schedule, result, change, Instant.now());
    }
}

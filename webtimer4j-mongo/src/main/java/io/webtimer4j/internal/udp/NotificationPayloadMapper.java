package io.webtimer4j.internal.udp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.webtimer4j.core.AttemptResult;
import io.webtimer4j.core.ChangeResult;
import io.webtimer4j.core.NotificationDeliveryException;
import io.webtimer4j.core.NotificationEvent;
import io.webtimer4j.core.NotificationType;
import io.webtimer4j.core.Schedule;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Builds the JSON datagram for a {@link NotificationEvent}.
 *
 * <pre>{@code
 * {
 *   "application": "WebRequestTimer", "version": "1.0", "timestamp": "...",
 *   "notification_type": "response_changed",
 *   "schedule": {"id", "name", "url", "method"},
 *   "request_result": {"request_id", "success", "status_code", "response_time_ms", "timestamp", "attempt"},
 *   "additional_data": {"is_response_changed", "response_hash", "previous_hash"},
 *   "response_body": ...
 * }
 * }</pre>
 */
public class NotificationPayloadMapper {

    private final ObjectMapper objectMapper;
    private final String application;
    private final String version;

    public NotificationPayloadMapper(ObjectMapper objectMapper, String application, String version) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.application = application;
        this.version = version;
    }

    public ObjectNode toJson(NotificationEvent event, int maxResponseSizeBytes) {
        Schedule schedule = event.schedule();
        AttemptResult result = event.result();
        NotificationType type = event.type();

        ObjectNode root = objectMapper.createObjectNode();
        root.put("application", application);
        root.put("version", version);
        root.put("timestamp", event.createdAt().toString());
        root.put("notification_type", type.wireName());

        ObjectNode s = root.putObject("schedule");
        s.put("id", schedule.id());
        s.put("name", schedule.name());
        s.put("url", schedule.url());
        s.put("method", schedule.method().name());

        ObjectNode r = root.putObject("request_result");
        r.put("request_id", result.requestId());
        r.put("success", result.success());
        r.put("status_code", result.statusCode());
        r.put("response_time_ms", result.responseTimeMs());
        r.put("timestamp", result.timestamp().toString());
        r.put("attempt", result.attempt());

        ObjectNode extra = root.putObject("additional_data");
        if (type.successClass()) {
            ChangeResult change = event.change();
            extra.put("is_response_changed", change.changed());
            extra.put("response_hash", change.currentHash());
            extra.put("previous_hash", change.previousHash());
            if (type == NotificationType.RECOVERY) {
                extra.put("message", "Request recovered from error state");
            }
            putBody(root, result, maxResponseSizeBytes);
        } else {
            extra.put("error_message", result.error());
            extra.put("status_code", result.statusCode());
            extra.put("attempt_count", result.attempt());
            root.put("error", result.error());
        }
        return root;
    }

    public byte[] toBytes(NotificationEvent event, int maxResponseSizeBytes) {
        try {
            return objectMapper.writeValueAsBytes(toJson(event, maxResponseSizeBytes));
        } catch (JsonProcessingException e) {
            throw new NotificationDeliveryException("unable to serialize notification: " + e.getMessage(), e);
        }
    }

    private void putBody(ObjectNode root, AttemptResult result, int max) {
        byte[] body = result.body();
        if (body == null || body.length == 0) {
            return;
        }
        if (body.length > max || result.bodyTruncated()) {
            int cut = utf8Boundary(body, Math.min(body.length, max));
            root.put("response_body", new String(Arrays.copyOf(body, cut), StandardCharsets.UTF_8));
            root.put("response_body_truncated", true);
            root.put("response_size_bytes", body.length);
            return;
        }
        String text = new String(body, StandardCharsets.UTF_8);
        JsonNode parsed = tryParse(text);
        if (parsed != null) {
            root.set("response_body", parsed);
        } else {
            root.put("response_body", text);
        }
    }

    /**
     * Largest length not above {@code end} that does not split a UTF-8 sequence.
     */
    static int utf8Boundary(byte[] bytes, int end) {
        int lead = end - 1;
        while (lead >= 0 && end - lead < 4 && (bytes[lead] & 0xC0) == 0x80) {
            lead--;
        }
        if (lead < 0) {
            return end;
        }
        int b = bytes[lead] & 0xFF;
        int needed = b >= 0xF0 ? 4 : b >= 0xE0 ? 3 : b >= 0xC0 ? 2 : 1;
        return end - lead >= needed ? end : lead;
    }

    private JsonNode tryParse(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return null;
        }
        try {
            return objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}

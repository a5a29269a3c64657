package io.webtimer4j.internal.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.webtimer4j.RequestExecutor;
import io.webtimer4j.config.WebTimerProperties;
import io.webtimer4j.core.AttemptContext;
import io.webtimer4j.core.AttemptResult;
import io.webtimer4j.core.HttpMethod;
import io.webtimer4j.core.Schedule;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RequestExecutor} backed by OkHttp.
 *
 * <p>Each attempt is bounded by a call timeout covering connect, write and body read; on expiry the call is
 * cancelled and the attempt reported as a transport failure. At most {@code http.maxBodyBytes} of the
 * response body are read.
 */
public class OkHttpRequestExecutor implements RequestExecutor {
    private static final Logger log = LoggerFactory.getLogger(OkHttpRequestExecutor.class);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final MediaType TEXT = MediaType.get("text/plain; charset=utf-8");
    private static final String AUTO_TIMESTAMP = "auto";

    private final OkHttpClient baseClient;
    private final ObjectMapper objectMapper;
    private final String userAgent;
    private final int maxBodyBytes;
    private final Set<Integer> extraSuccessCodes;
    private final Map<Duration, OkHttpClient> clientsByTimeout = new ConcurrentHashMap<>();

    public OkHttpRequestExecutor(WebTimerProperties.Http http, ObjectMapper objectMapper) {
        this(buildClient(Objects.requireNonNull(http, "http must not be null")), http, objectMapper);
    }

    public OkHttpRequestExecutor(OkHttpClient client, WebTimerProperties.Http http, ObjectMapper objectMapper) {
        this.baseClient = Objects.requireNonNull(client, "client must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.userAgent = http.getUserAgent();
        this.maxBodyBytes = http.getMaxBodyBytes();
        this.extraSuccessCodes = Set.copyOf(http.getSuccessStatusCodes());
    }

    @Override
    public AttemptResult execute(Schedule schedule, AttemptContext ctx) {
        Instant startedAt = Instant.now();
        long startNanos = System.nanoTime();

        Request request;
        try {
            request = buildRequest(schedule);
        } catch (IllegalArgumentException e) {
            return AttemptResult.transportFailure(ctx, schedule.id(), startedAt, Duration.ZERO,
                    "invalid request: " + e.getMessage());
        }

        Call call = clientFor(ctx.timeout()).newCall(request);
        try (Response response = call.execute()) {
            CappedBody body = readCapped(response.body());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            int code = response.code();

            log.debug("http response id={} requestId={} attempt={} status={} elapsedMs={} bytes={}",
                    schedule.id(), ctx.requestId(), ctx.attempt(), code, elapsed.toMillis(), body.bytes().length);

            if (isSuccess(code)) {
                return AttemptResult.success(ctx, schedule.id(), startedAt, code, elapsed, body.bytes(), body.truncated());
            }
            String reason = response.message();
            String error = "HTTP " + code + (reason == null || reason.isBlank() ? "" : " " + reason);
            return AttemptResult.statusFailure(ctx, schedule.id(), startedAt, code, elapsed, error,
                    body.bytes(), body.truncated());
        } catch (InterruptedIOException e) {
            call.cancel();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            return AttemptResult.transportFailure(ctx, schedule.id(), startedAt, elapsed,
                    "timeout after " + ctx.timeout().toMillis() + "ms");
        } catch (IOException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            return AttemptResult.transportFailure(ctx, schedule.id(), startedAt, elapsed,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    boolean isSuccess(int code) {
        return (code >= 200 && code < 300) || extraSuccessCodes.contains(code);
    }

    Request buildRequest(Schedule schedule) {
        Request.Builder b = new Request.Builder().url(schedule.url());
        if (userAgent != null && !userAgent.isBlank()) {
            b.header("User-Agent", userAgent);
        }
        schedule.headers().forEach(b::header);

        RequestBody body = null;
        String raw = schedule.body();
        if (raw != null && !raw.isEmpty()) {
            if (schedule.method().requiresBody() || schedule.method() == HttpMethod.DELETE) {
                body = toRequestBody(raw, hasContentType(schedule));
            } else {
                log.debug("http body ignored for method id={} method={}", schedule.id(), schedule.method());
            }
        } else if (schedule.method().requiresBody()) {
            body = RequestBody.create(new byte[0], (MediaType) null);
        }
        return b.method(schedule.method().name(), body).build();
    }

    /**
     * JSON bodies get {@code "timestamp": "auto"} replaced by the send time; anything else is sent verbatim.
     */
    RequestBody toRequestBody(String raw, boolean explicitContentType) {
        JsonNode json = parseJson(raw);
        if (json == null) {
            return RequestBody.create(raw, explicitContentType ? null : TEXT);
        }
        if (json instanceof ObjectNode node
                && node.path("timestamp").isTextual()
                && AUTO_TIMESTAMP.equals(node.get("timestamp").asText())) {
            node.put("timestamp", OffsetDateTime.now().toString());
            raw = node.toString();
        }
        return RequestBody.create(raw, explicitContentType ? null : JSON);
    }

    private static boolean hasContentType(Schedule schedule) {
        return schedule.headers().keySet().stream().anyMatch("Content-Type"::equalsIgnoreCase);
    }

    private JsonNode parseJson(String raw) {
        String trimmed = raw.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return null;
        }
        try {
            return objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private OkHttpClient clientFor(Duration timeout) {
        return clientsByTimeout.computeIfAbsent(timeout, t -> baseClient.newBuilder().callTimeout(t).build());
    }

    private CappedBody readCapped(ResponseBody body) throws IOException {
        if (body == null) {
            return new CappedBody(new byte[0], false);
        }
        BufferedSource source = body.source();
        boolean truncated = source.request(maxBodyBytes + 1L);
        Buffer buffer = source.getBuffer();
        byte[] bytes = buffer.readByteArray(Math.min(buffer.size(), maxBodyBytes));
        return new CappedBody(bytes, truncated);
    }

    private record CappedBody(byte[] bytes, boolean truncated) {
    }

    static OkHttpClient buildClient(WebTimerProperties.Http http) {
        OkHttpClient.Builder b = new OkHttpClient.Builder()
                .followRedirects(http.isFollowRedirects())
                .followSslRedirects(http.isFollowRedirects())
                .retryOnConnectionFailure(false);

        if (!http.isVerifySsl()) {
            log.warn("TLS certificate verification is disabled for scheduled requests");
            X509TrustManager trustAll = new X509TrustManager() {
                @Override
                public void checkClientTrusted(X509Certificate[] chain, String authType) {
                }

                @Override
                public void checkServerTrusted(X509Certificate[] chain, String authType) {
                }

                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[0];
                }
            };
            try {
                SSLContext ssl = SSLContext.getInstance("TLS");
                ssl.init(null, new TrustManager[]{trustAll}, new SecureRandom());
                b.sslSocketFactory(ssl.getSocketFactory(), trustAll);
                b.hostnameVerifier((host, session) -> true);
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("unable to create TLS context: " + e.getMessage(), e);
            }
        }
        return b.build();
    }
}

package io.webtimer4j.core;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable HTTP job definition.
 *
 * <p>{@code timeout}, {@code retryCount} and {@code retryDelay} may be null, in which case the engine's
 * {@link RequestDefaults} apply. A firing always works on the instance captured when it started; registry
 * updates produce a new instance that is picked up by the next firing.
 */
public record Schedule(
        String id,
        String name,
        boolean enabled,

        // request
        String url,
        HttpMethod method,
        Map<String, String> headers,
        String body,

        // timing
        Trigger trigger,
        boolean runImmediately,

        // attempt policy
        Duration timeout,
        Integer retryCount,
        Duration retryDelay
) {

    public Schedule {
        Objects.requireNonNull(id, "id must not be null");
        name = (name == null || name.isBlank()) ? id : name;
        method = method == null ? HttpMethod.GET : method;
        headers = (headers == null || headers.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(id)
                .name(name)
                .enabled(enabled)
                .url(url)
                .method(method)
                .headers(headers)
                .body(body)
                .trigger(trigger)
                .runImmediately(runImmediately)
                .timeout(timeout)
                .retryCount(retryCount)
                .retryDelay(retryDelay);
    }

    public Schedule withEnabled(boolean enabled) {
        return toBuilder().enabled(enabled).build();
    }

    public static final class Builder {
        private final String id;
        private String name;
        private boolean enabled = true;
        private String url;
        private HttpMethod method = HttpMethod.GET;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String body;
        private Trigger trigger;
        private boolean runImmediately;
        private Duration timeout;
        private Integer retryCount;
        private Duration retryDelay;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder method(HttpMethod method) {
            this.method = method;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.clear();
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name must not be null");
            if (value == null) {
                this.headers.remove(name);
            } else {
                this.headers.put(name, value);
            }
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder trigger(Trigger trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder everySeconds(long seconds) {
            return trigger(Trigger.interval(seconds));
        }

        public Builder cron(String expression) {
            return trigger(Trigger.cron(expression));
        }

        public Builder runImmediately(boolean runImmediately) {
            this.runImmediately = runImmediately;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryCount(Integer retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        /**
         * Build without validation. The registry validates on every mutation.
         */
        public Schedule build() {
            return new Schedule(id, name, enabled, url, method, headers, body, trigger, runImmediately,
                    timeout, retryCount, retryDelay);
        }
    }
}

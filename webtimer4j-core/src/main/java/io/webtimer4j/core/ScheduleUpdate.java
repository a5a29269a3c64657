package io.webtimer4j.core;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial change to a registered schedule. Null fields keep the current value.
 *
 * <p>{@code headers}, when present, replaces the whole header map.
 */
public final class ScheduleUpdate {

    private final String name;
    private final Boolean enabled;
    private final String url;
    private final HttpMethod method;
    private final Map<String, String> headers;
    private final String body;
    private final boolean clearBody;
    private final Trigger trigger;
    private final Duration timeout;
    private final Integer retryCount;
    private final Duration retryDelay;

    private ScheduleUpdate(Builder b) {
        this.name = b.name;
        this.enabled = b.enabled;
        this.url = b.url;
        this.method = b.method;
        this.headers = b.headers == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.body = b.body;
        this.clearBody = b.clearBody;
        this.trigger = b.trigger;
        this.timeout = b.timeout;
        this.retryCount = b.retryCount;
        this.retryDelay = b.retryDelay;
    }

    public Boolean enabled() {
        return enabled;
    }

    public Trigger trigger() {
        return trigger;
    }

    public ScheduleUpdate withTrigger(Trigger trigger) {
        Builder b = new Builder();
        b.name = name;
        b.enabled = enabled;
        b.url = url;
        b.method = method;
        b.headers = headers;
        b.body = body;
        b.clearBody = clearBody;
        b.trigger = trigger;
        b.timeout = timeout;
        b.retryCount = retryCount;
        b.retryDelay = retryDelay;
        b.touched = true;
        return new ScheduleUpdate(b);
    }

    /**
     * True when applying this update to {@code current} moves its next due time: the trigger is replaced or the
     * enabled flag flips.
     */
    public boolean affectsTiming(Schedule current) {
        return trigger != null || (enabled != null && enabled != current.enabled());
    }

    public Schedule applyTo(Schedule current) {
        Schedule.Builder b = current.toBuilder();
        if (name != null) {
            b.name(name);
        }
        if (enabled != null) {
            b.enabled(enabled);
        }
        if (url != null) {
            b.url(url);
        }
        if (method != null) {
            b.method(method);
        }
        if (headers != null) {
            b.headers(headers);
        }
        if (clearBody) {
            b.body(null);
        } else if (body != null) {
            b.body(body);
        }
        if (trigger != null) {
            b.trigger(trigger);
        }
        if (timeout != null) {
            b.timeout(timeout);
        }
        if (retryCount != null) {
            b.retryCount(retryCount);
        }
        if (retryDelay != null) {
            b.retryDelay(retryDelay);
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private Boolean enabled;
        private String url;
        private HttpMethod method;
        private Map<String, String> headers;
        private String body;
        private boolean clearBody;
        private Trigger trigger;
        private Duration timeout;
        private Integer retryCount;
        private Duration retryDelay;
        private boolean touched;

        public Builder name(String name) {
            this.name = name;
            touched = true;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            touched = true;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            touched = true;
            return this;
        }

        public Builder method(HttpMethod method) {
            this.method = method;
            touched = true;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers == null ? Map.of() : headers;
            touched = true;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            this.clearBody = body == null;
            touched = true;
            return this;
        }

        public Builder trigger(Trigger trigger) {
            this.trigger = trigger;
            touched = true;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            touched = true;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            touched = true;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            touched = true;
            return this;
        }

        public ScheduleUpdate build() {
            if (!touched) {
                throw new IllegalStateException("ScheduleUpdate must change at least one field");
            }
            return new ScheduleUpdate(this);
        }
    }
}

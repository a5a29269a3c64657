package io.webtimer4j.core;

import java.util.Locale;

public enum HttpMethod {
    GET(false),
    POST(true),
    PUT(true),
    DELETE(false),
    PATCH(true),
    HEAD(false),
    OPTIONS(false);

    private final boolean requiresBody;

    HttpMethod(boolean requiresBody) {
        this.requiresBody = requiresBody;
    }

    /**
     * True when the HTTP client requires a (possibly empty) request body for this method.
     */
    public boolean requiresBody() {
        return requiresBody;
    }

    public static HttpMethod parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("HTTP method must not be blank");
        }
        try {
            return HttpMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Unsupported HTTP method: " + value);
        }
    }
}

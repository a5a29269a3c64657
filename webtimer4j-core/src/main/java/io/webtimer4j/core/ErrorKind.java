package io.webtimer4j.core;

/**
 * Why an attempt failed. Both kinds are eligible for retry.
 */
public enum ErrorKind {
    /** Timeout, connection refused, DNS failure, TLS failure. */
    TRANSPORT,
    /** A response arrived but its status is not a success status. */
    HTTP_STATUS
}

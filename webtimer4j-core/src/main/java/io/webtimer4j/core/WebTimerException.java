package io.webtimer4j.core;

/**
 * Base type of every error raised by the engine.
 */
public class WebTimerException extends RuntimeException {

    public WebTimerException(String message) {
        super(message);
    }

    public WebTimerException(String message, Throwable cause) {
        super(message, cause);
    }
}

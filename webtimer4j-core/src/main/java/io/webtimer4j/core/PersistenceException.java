package io.webtimer4j.core;

/**
 * Storage-layer failure of the history store.
 *
 * <p>During a firing this is logged and absorbed; at startup it prevents the engine from starting.
 */
public class PersistenceException extends WebTimerException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

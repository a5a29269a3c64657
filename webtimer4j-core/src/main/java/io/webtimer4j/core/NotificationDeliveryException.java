package io.webtimer4j.core;

public class NotificationDeliveryException extends WebTimerException {

    public NotificationDeliveryException(String message) {
        super(message);
    }

    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}

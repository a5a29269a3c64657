package io.webtimer4j;

import io.webtimer4j.core.NotificationEvent;
import io.webtimer4j.core.NotificationSettings;

/**
 * Delivers classified events to external listeners.
 *
 * <p>Delivery is best-effort: failures are logged and dropped, never thrown back into the firing.
 */
public interface NotificationDispatcher extends AutoCloseable {

    void dispatch(NotificationEvent event, NotificationSettings settings);

    /**
     * Flush or discard pending deliveries and release resources.
     */
    @Override
    default void close() {
    }
}

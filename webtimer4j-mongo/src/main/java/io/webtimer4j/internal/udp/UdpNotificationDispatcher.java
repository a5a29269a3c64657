package io.webtimer4j.internal.udp;

import io.webtimer4j.NotificationDispatcher;
import io.webtimer4j.core.NotificationDeliveryException;
import io.webtimer4j.core.NotificationEvent;
import io.webtimer4j.core.NotificationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends each event as one JSON datagram, {@code settings.delay()} after it was dispatched.
 *
 * <p>Every event gets its own datagram; there is no coalescing. Delivery failures are logged and counted.
 */
public class UdpNotificationDispatcher implements NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(UdpNotificationDispatcher.class);

    static final int MAX_DATAGRAM_BYTES = 65_507;

    private final NotificationPayloadMapper payloadMapper;
    private final Duration closeTimeout;
    private final ScheduledExecutorService sender;

    private final AtomicLong sentCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    public UdpNotificationDispatcher(NotificationPayloadMapper payloadMapper) {
        this(payloadMapper, Duration.ofSeconds(5));
    }

    public UdpNotificationDispatcher(NotificationPayloadMapper payloadMapper, Duration closeTimeout) {
        this.payloadMapper = Objects.requireNonNull(payloadMapper, "payloadMapper must not be null");
        this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout must not be null");
        this.sender = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("webtimer.notifier");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void dispatch(NotificationEvent event, NotificationSettings settings) {
        Objects.requireNonNull(event, "event must not be null");
        if (settings == null || !settings.enabled()) {
            return;
        }

        byte[] payload = payloadMapper.toBytes(event, settings.maxResponseSizeBytes());
        if (payload.length > MAX_DATAGRAM_BYTES) {
            failedCount.incrementAndGet();
            throw new NotificationDeliveryException("notification payload too large for a datagram: " + payload.length + " bytes");
        }

        String host = settings.serverAddress();
        int port = settings.port();
        String label = event.type().wireName() + " id=" + event.schedule().id() + " requestId=" + event.result().requestId();
        try {
            sender.schedule(() -> sendQuietly(host, port, payload, label),
                    settings.delay().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            failedCount.incrementAndGet();
            throw new NotificationDeliveryException("notification dispatcher is closed", e);
        }
    }

    private void sendQuietly(String host, int port, byte[] payload, String label) {
        try {
            send(new InetSocketAddress(host, port), payload);
            sentCount.incrementAndGet();
            log.info("UDP notification sent type={} target={}:{}", label, host, port);
        } catch (IOException | RuntimeException e) {
            failedCount.incrementAndGet();
            log.error("UDP notification failed type={} target={}:{} msg={}", label, host, port, e.getMessage(), e);
        }
    }

    protected void send(InetSocketAddress target, byte[] payload) throws IOException {
        if (target.isUnresolved()) {
            throw new IOException("unresolved notification host: " + target.getHostString());
        }
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.send(new DatagramPacket(payload, payload.length, target));
        }
    }

    public long sentCount() {
        return sentCount.get();
    }

    public long failedCount() {
        return failedCount.get();
    }

    /**
     * Send what is already queued, waiting at most the close timeout, then drop the rest.
     */
    @Override
    public void close() {
        sender.shutdown();
        try {
            if (!sender.awaitTermination(closeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                int dropped = sender.shutdownNow().size();
                log.warn("UDP notifier closed with {} pending notifications dropped", dropped);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sender.shutdownNow();
        }
    }
}

package io.webtimer4j.config;

import io.webtimer4j.WebTimer;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges WebTimer start/stop with the Spring container lifecycle. Starts with the context only when
 * {@code webtimer.auto-start} is true; always stops (draining in-flight firings) when the context closes.
 */
public class WebTimerLifecycle implements SmartLifecycle {
    private final WebTimer webTimer;
    private final boolean autoStartup;

    public WebTimerLifecycle(WebTimer webTimer, boolean autoStartup) {
        this.webTimer = webTimer;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        webTimer.start();
    }

    @Override
    public void stop() {
        webTimer.stop();
    }

    @Override
    public boolean isRunning() {
        return webTimer.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}

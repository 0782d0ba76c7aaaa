package io.herald4j.config;

import io.herald4j.MessageScheduler;
import io.herald4j.telegram.TelegramUpdatePoller;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler and update poller start/stop with the Spring container lifecycle.
 * Schedules are recovered before the bot starts taking commands.
 */
public class HeraldLifecycle implements SmartLifecycle {
    private final MessageScheduler scheduler;
    private final TelegramUpdatePoller poller;
    private volatile boolean running = false;

    /**
     * @param poller may be null when updates are not polled
     */
    public HeraldLifecycle(MessageScheduler scheduler, TelegramUpdatePoller poller) {
        this.scheduler = scheduler;
        this.poller = poller;
    }

    @Override
    public void start() {
        scheduler.start();
        if (poller != null) {
            poller.start();
        }
        running = true;
    }

    @Override
    public void stop() {
        if (poller != null) {
            poller.stop();
        }
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}

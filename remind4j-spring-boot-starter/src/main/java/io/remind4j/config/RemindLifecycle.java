package io.remind4j.config;

import io.remind4j.Reminders;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the reminder loop start/stop with the Spring container lifecycle.
 */
public class RemindLifecycle implements SmartLifecycle {
    private final Reminders reminders;
    private final boolean autoStart;
    private volatile boolean running = false;

    public RemindLifecycle(Reminders reminders, boolean autoStart) {
        this.reminders = reminders;
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        reminders.start();
        running = true;
    }

    @Override
    public void stop() {
        reminders.stop();
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
        return autoStart;
    }
}

package io.sentinel.work.config;

import io.sentinel.work.WorkEngine;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges work engine start/stop with the Spring container lifecycle.
 *
 * <p>Starts in the last phase, after every {@link io.sentinel.work.WorkType} bean is registered.
 */
public class WorkLifecycle implements SmartLifecycle {
    private final WorkEngine engine;
    private volatile boolean running = false;

    public WorkLifecycle(WorkEngine engine) {
        this.engine = engine;
    }

    @Override
    public void start() {
        engine.start();
        running = true;
    }

    @Override
    public void stop() {
        engine.stop();
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

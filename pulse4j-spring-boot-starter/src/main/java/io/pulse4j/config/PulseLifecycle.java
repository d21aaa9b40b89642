package io.pulse4j.config;

import io.pulse4j.Orchestrator;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the orchestrator once the context is refreshed and stops it before beans are destroyed.
 */
public class PulseLifecycle implements SmartLifecycle {
    private final Orchestrator orchestrator;
    private volatile boolean running = false;

    public PulseLifecycle(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void start() {
        orchestrator.start();
        running = true;
    }

    @Override
    public void stop() {
        orchestrator.stop();
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

package io.pulse4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for scheduling and queue processing.
 */
@ConfigurationProperties(prefix = "pulse")
public class PulseProperties {
    private boolean enabled = true;
    private Duration pollInterval = Duration.ofSeconds(60); // schedule reconciliation
    private int timerThreads = 4;
    private int workers = 5; // queue worker loops
    private Duration processEvery = Duration.ofSeconds(1); // queue worker tick
    private int maxAttempts = 3;
    private Duration callTimeout = Duration.ofMinutes(5); // generation / delivery
    private Duration queueJobTimeout = Duration.ofMinutes(5);
    private Duration staleProcessingAfter = Duration.ofMinutes(30);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean startPaused = false;
    private boolean ensureIndexesOnStartup = false;

    /**
     * Fails fast on values the engine cannot run with.
     */
    public void validate() {
        requirePositive(pollInterval, "pulse.pollInterval");
        requirePositive(processEvery, "pulse.processEvery");
        requirePositive(callTimeout, "pulse.callTimeout");
        requirePositive(queueJobTimeout, "pulse.queueJobTimeout");
        requirePositive(staleProcessingAfter, "pulse.staleProcessingAfter");
        requirePositive(shutdownTimeout, "pulse.shutdownTimeout");
        if (timerThreads <= 0) {
            throw new IllegalArgumentException("pulse.timerThreads must be a positive number");
        }
        if (workers <= 0) {
            throw new IllegalArgumentException("pulse.workers must be a positive number");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("pulse.maxAttempts must be a positive number");
        }
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getTimerThreads() {
        return timerThreads;
    }

    public void setTimerThreads(int timerThreads) {
        this.timerThreads = timerThreads;
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public Duration getQueueJobTimeout() {
        return queueJobTimeout;
    }

    public void setQueueJobTimeout(Duration queueJobTimeout) {
        this.queueJobTimeout = queueJobTimeout;
    }

    public Duration getStaleProcessingAfter() {
        return staleProcessingAfter;
    }

    public void setStaleProcessingAfter(Duration staleProcessingAfter) {
        this.staleProcessingAfter = staleProcessingAfter;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isStartPaused() {
        return startPaused;
    }

    public void setStartPaused(boolean startPaused) {
        this.startPaused = startPaused;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}

package io.pulse4j.internal;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Delayed;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Timer pool that records one-shot tasks instead of running them; tests fire them explicitly.
 */
public final class ManualTimers extends ScheduledThreadPoolExecutor {

    private final List<Task> tasks = new ArrayList<>();

    public ManualTimers() {
        super(1);
    }

    @Override
    public synchronized ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
        if (isShutdown()) {
            throw new RejectedExecutionException("shut down");
        }
        Task task = new Task(command, unit.toMillis(delay));
        tasks.add(task);
        return task;
    }

    public synchronized List<Task> pending() {
        return tasks.stream().filter(t -> !t.isDone()).collect(Collectors.toList());
    }

    /**
     * Runs the pending task with the shortest delay on the calling thread.
     */
    public Task runNext() {
        Optional<Task> next;
        synchronized (this) {
            next = tasks.stream()
                    .filter(t -> !t.isDone())
                    .min(Comparator.comparingLong(Task::delayMs));
        }
        Task task = next.orElseThrow(() -> new AssertionError("no pending timer"));
        task.run();
        return task;
    }

    public static final class Task implements ScheduledFuture<Object> {
        private final Runnable command;
        private final long delayMs;
        private boolean cancelled;
        private boolean done;

        Task(Runnable command, long delayMs) {
            this.command = command;
            this.delayMs = delayMs;
        }

        public long delayMs() {
            return delayMs;
        }

        void run() {
            synchronized (this) {
                if (done) {
                    return;
                }
                done = true;
            }
            command.run();
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(delayMs, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }

        @Override
        public synchronized boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            done = true;
            return true;
        }

        @Override
        public synchronized boolean isCancelled() {
            return cancelled;
        }

        @Override
        public synchronized boolean isDone() {
            return done;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}

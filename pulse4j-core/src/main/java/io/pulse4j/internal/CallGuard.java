package io.pulse4j.internal;

import io.pulse4j.exception.PulseException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Runs collaborator calls on a dedicated pool with a hard deadline.
 *
 * <p>On expiry the call is interrupted and reported through the caller's exception type, so a hung
 * collaborator cannot stall a timer chain or a queue worker forever. The pool holds at most
 * {@code maxThreads} threads; a call that finds every thread busy fails at once instead of queueing.
 * {@link #close()} releases the threads and the next call starts a fresh pool.
 */
public class CallGuard implements AutoCloseable {

    private final String threadPrefix;
    private final int maxThreads;
    private final AtomicInteger seq = new AtomicInteger();

    private ThreadPoolExecutor pool;

    public CallGuard(String threadPrefix, int maxThreads) {
        this.threadPrefix = Objects.requireNonNull(threadPrefix, "threadPrefix must not be null");
        if (maxThreads < 1) {
            throw new IllegalArgumentException("maxThreads must be >= 1");
        }
        this.maxThreads = maxThreads;
    }

    /**
     * @param failureType exceptions of this type thrown by the task pass through unchanged
     * @param failure     builds the exception for every other failure (message, cause)
     */
    public <T, X extends PulseException> T call(Callable<T> task,
                                                Duration timeout,
                                                Class<X> failureType,
                                                BiFunction<String, Throwable, X> failure) {
        Future<T> future;
        try {
            future = pool().submit(task);
        } catch (RejectedExecutionException e) {
            throw failure.apply("no call thread free, " + maxThreads + " calls still running", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw failure.apply("timed out after " + timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw failure.apply("interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (failureType.isInstance(cause)) {
                throw failureType.cast(cause);
            }
            throw failure.apply(describe(cause), cause);
        }
    }

    /**
     * Threads currently running or idling in the pool.
     */
    public synchronized int poolSize() {
        return pool == null ? 0 : pool.getPoolSize();
    }

    static String describe(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
    }

    private synchronized ThreadPoolExecutor pool() {
        if (pool == null) {
            pool = new ThreadPoolExecutor(0, maxThreads, 60, TimeUnit.SECONDS, new SynchronousQueue<>(), r -> {
                Thread t = new Thread(r);
                t.setName(threadPrefix + "-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            }, new ThreadPoolExecutor.AbortPolicy());
        }
        return pool;
    }

    @Override
    public synchronized void close() {
        if (pool != null) {
            pool.shutdownNow();
            pool = null;
        }
    }
}

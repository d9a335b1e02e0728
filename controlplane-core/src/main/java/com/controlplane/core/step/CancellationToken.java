package com.controlplane.core.step;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Caller-owned signal that aborts a running task.
 * Cancelled at most once; the first reason wins.
 *
 * <pre>
 * CancellationToken token = CancellationToken.withTimeout(Duration.ofMinutes(10));
 * TaskRun run = engine.run(task, config, sink, token);
 * ...
 * token.cancel("operator abort");
 * </pre>
 */
public final class CancellationToken {

    public static final String DEADLINE_EXCEEDED = "deadline exceeded";

    private final List<Consumer<String>> listeners = new ArrayList<>();
    private String reason;

    /**
     * A token that only cancels when {@link #cancel} is called.
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * A token that cancels itself once the timeout elapses.
     */
    public static CancellationToken withTimeout(Duration timeout) {
        CancellationToken token = new CancellationToken();
        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .execute(() -> token.cancel(DEADLINE_EXCEEDED));
        return token;
    }

    /**
     * Cancel the token.
     *
     * @return true if this call cancelled it, false if it was already cancelled
     */
    public boolean cancel(String cancelReason) {
        List<Consumer<String>> toNotify;
        synchronized (this) {
            if (reason != null) {
                return false;
            }
            reason = cancelReason;
            toNotify = List.copyOf(listeners);
            listeners.clear();
        }
        toNotify.forEach(listener -> listener.accept(cancelReason));
        return true;
    }

    public synchronized boolean isCancelled() {
        return reason != null;
    }

    public synchronized Optional<String> reason() {
        return Optional.ofNullable(reason);
    }

    /**
     * Register a callback run exactly once on cancellation, immediately if already cancelled.
     *
     * @return Handle that unregisters the callback
     */
    public Registration onCancel(Consumer<String> listener) {
        String current;
        synchronized (this) {
            current = reason;
            if (current == null) {
                listeners.add(listener);
                return () -> {
                    synchronized (this) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.accept(current);
        return () -> { };
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}

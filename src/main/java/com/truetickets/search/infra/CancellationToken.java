package com.truetickets.search.infra;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Cooperative abort signal threaded through every lookup of a search session.
 * Callbacks registered after cancellation run immediately.
 */
public class CancellationToken {

    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    /**
     * A token nobody will ever cancel, for one-shot lookups.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(Runnable::run);
    }

    public Registration onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (this) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> { };
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Lookup cancelled");
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}

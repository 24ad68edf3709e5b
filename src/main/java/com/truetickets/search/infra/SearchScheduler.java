package com.truetickets.search.infra;

import java.time.Duration;

/**
 * The single search loop. Every task runs on the same thread, one at a time, in submission order.
 */
public interface SearchScheduler {

    void execute(Runnable task);

    ScheduledTask schedule(Runnable task, Duration delay);

    @FunctionalInterface
    interface ScheduledTask {
        void cancel();
    }
}

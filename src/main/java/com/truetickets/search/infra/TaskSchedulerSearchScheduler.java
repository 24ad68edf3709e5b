package com.truetickets.search.infra;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Search loop backed by a Spring {@link TaskScheduler}; the scheduler must have exactly one thread.
 */
@RequiredArgsConstructor
public class TaskSchedulerSearchScheduler implements SearchScheduler {

    private final TaskScheduler taskScheduler;

    @Override
    public void execute(Runnable task) {
        taskScheduler.schedule(task, Instant.now());
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = taskScheduler.schedule(task, Instant.now().plus(delay));
        return () -> future.cancel(false);
    }
}

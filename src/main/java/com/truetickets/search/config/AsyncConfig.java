package com.truetickets.search.config;

import com.truetickets.search.infra.SearchScheduler;
import com.truetickets.search.infra.TaskSchedulerSearchScheduler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class AsyncConfig {

    /**
     * Blocking backend calls. The queue is unbounded so submitting from the search loop never blocks.
     */
    @Bean(name = "lookupTaskExecutor")
    public ThreadPoolTaskExecutor lookupTaskExecutor(LookupProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.concurrency());
        executor.setMaxPoolSize(properties.concurrency());
        executor.setThreadNamePrefix("lookup-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean(name = "searchLoopScheduler")
    public ThreadPoolTaskScheduler searchLoopScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("search-loop-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public SearchScheduler searchScheduler(@Qualifier("searchLoopScheduler") ThreadPoolTaskScheduler searchLoopScheduler) {
        return new TaskSchedulerSearchScheduler(searchLoopScheduler);
    }
}

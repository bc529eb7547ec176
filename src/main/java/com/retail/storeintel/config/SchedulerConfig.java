package com.retail.storeintel.config;

import com.retail.storeintel.scheduler.PerStoreRunner;
import com.retail.storeintel.scheduler.RefreshJob;
import com.retail.storeintel.scheduler.RefreshScheduler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.List;

/**
 * Thread pools behind the refresh jobs. The loop scheduler only dispatches;
 * jobs run on their own executor and fan out per store over the worker pool.
 */
@Configuration
public class SchedulerConfig {

    @Bean
    public ThreadPoolTaskScheduler refreshLoopScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("refresh-loop-");
        scheduler.setDaemon(true);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor refreshJobExecutor(List<RefreshJob> jobs, SchedulerProperties properties) {
        return boundedExecutor("refresh-job-", Math.max(1, jobs.size()), properties);
    }

    @Bean
    public ThreadPoolTaskExecutor storeWorkerExecutor(SchedulerProperties properties) {
        return boundedExecutor("store-worker-", Math.max(1, properties.getWorkerPoolSize()), properties);
    }

    @Bean
    public PerStoreRunner perStoreRunner(@Qualifier("storeWorkerExecutor") ThreadPoolTaskExecutor workers) {
        return new PerStoreRunner(workers);
    }

    @Bean(destroyMethod = "stop")
    public RefreshScheduler refreshScheduler(List<RefreshJob> jobs, SchedulerProperties properties, Clock clock,
                                             @Qualifier("refreshLoopScheduler") ThreadPoolTaskScheduler loopScheduler,
                                             @Qualifier("refreshJobExecutor") ThreadPoolTaskExecutor jobExecutor) {
        return new RefreshScheduler(jobs, properties, clock, loopScheduler, jobExecutor);
    }

    private static ThreadPoolTaskExecutor boundedExecutor(String prefix, int size, SchedulerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix(prefix);
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) Math.max(1, properties.getStopTimeout().toSeconds()));
        return executor;
    }
}

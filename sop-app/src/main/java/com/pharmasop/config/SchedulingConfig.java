package com.pharmasop.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 调度器配置：daemon-scheduler 承载作业补偿投递与租约回收守护任务，
 * 生成调用本身在 worker 线程池中执行，不占用调度线程。
 */
@Slf4j
@Configuration
@EnableScheduling
public class SchedulingConfig {

    @Bean(name = "daemonScheduler")
    public ThreadPoolTaskScheduler daemonScheduler(
            @Value("${scheduling.daemon.pool-size:2}") int poolSize,
            @Value("${scheduling.daemon.thread-name-prefix:sop-daemon-}") String threadNamePrefix,
            @Value("${scheduling.daemon.await-termination-seconds:30}") int awaitTerminationSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(poolSize, 1));
        scheduler.setThreadNamePrefix(threadNamePrefix);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(Math.max(awaitTerminationSeconds, 0));
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(throwable ->
                log.error("Scheduled task execution failed. scheduler={}, error={}",
                        threadNamePrefix, throwable.getMessage(), throwable));
        return scheduler;
    }
}

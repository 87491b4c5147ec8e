package com.pharmasop.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * 1) sopJobWorkerExecutor：作业推进线程池，与调度线程解耦；
 * 2) sopGenerationCallExecutor：引擎调用线程池，推进线程在其上按截止时间等待结果，超时后中断调用。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "sopJobWorkerExecutor")
    @ConditionalOnMissingBean(name = "sopJobWorkerExecutor")
    public ThreadPoolExecutor sopJobWorkerExecutor(ThreadPoolConfigProperties properties) {
        return buildExecutor(properties.getWorker(), "sop-job-worker-");
    }

    @Bean(name = "sopGenerationCallExecutor")
    @ConditionalOnMissingBean(name = "sopGenerationCallExecutor")
    public ThreadPoolExecutor sopGenerationCallExecutor(ThreadPoolConfigProperties properties) {
        return buildExecutor(properties.getGenerationCall(), "sop-generation-call-");
    }

    private ThreadPoolExecutor buildExecutor(ThreadPoolConfigProperties.Pool pool, String defaultPrefix) {
        ThreadPoolConfigProperties.Pool source = pool == null ? new ThreadPoolConfigProperties.Pool() : pool;
        int coreSize = Math.max(source.getCoreSize() == null ? 1 : source.getCoreSize(), 1);
        int maxSize = Math.max(source.getMaxSize() == null ? coreSize : source.getMaxSize(), coreSize);
        long keepAliveSeconds = Math.max(source.getKeepAliveSeconds() == null ? 60L : source.getKeepAliveSeconds(), 0L);
        int queueCapacity = Math.max(source.getQueueCapacity() == null ? 0 : source.getQueueCapacity(), 0);
        String threadNamePrefix = source.getThreadNamePrefix() == null ? defaultPrefix : source.getThreadNamePrefix();
        BlockingQueue<Runnable> queue = queueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(queueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                coreSize,
                maxSize,
                keepAliveSeconds,
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(source.getRejectionPolicy()));
        log.info("Thread pool created. prefix={}, coreSize={}, maxSize={}, queueCapacity={}",
                threadNamePrefix, coreSize, maxSize, queueCapacity);
        return executor;
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if (policy == null || "AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}

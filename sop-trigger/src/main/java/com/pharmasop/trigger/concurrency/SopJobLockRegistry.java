package com.pharmasop.trigger.concurrency;

import com.google.common.util.concurrent.Striped;
import com.pharmasop.types.exception.AppException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * 作业级互斥锁：同一作业的推进、审核、取消与归档写入串行化。
 * <p>
 * 锁只包住「读取最新状态 → 迁移 → 持久化」这一小段，不覆盖生成引擎调用。
 * </p>
 */
@Component
public class SopJobLockRegistry {

    private final Striped<Lock> jobLocks;
    private final long waitMillis;

    public SopJobLockRegistry(@Qualifier("sopJobLockStripes") Striped<Lock> jobLocks,
                              @Value("${sop.pipeline.lock.review-wait-ms:3000}") long waitMillis) {
        this.jobLocks = jobLocks;
        this.waitMillis = waitMillis >= 0 ? waitMillis : 3000L;
    }

    /**
     * 阻塞获取作业锁后执行，供后台推进使用。
     */
    public <T> T withLock(String jobId, Supplier<T> action) {
        Lock lock = lockFor(jobId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 限时获取作业锁后执行，供外部请求使用；超时视为并发修改。
     */
    public <T> T tryWithLock(String jobId, Supplier<T> action) {
        Lock lock = lockFor(jobId);
        boolean locked;
        try {
            locked = lock.tryLock(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw AppException.invalidTransition("Interrupted while waiting for job " + jobId);
        }
        if (!locked) {
            throw AppException.invalidTransition("Job " + jobId + " is being modified concurrently, retry later");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private Lock lockFor(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw AppException.invalidRequest("jobId is required");
        }
        return jobLocks.get(jobId);
    }
}

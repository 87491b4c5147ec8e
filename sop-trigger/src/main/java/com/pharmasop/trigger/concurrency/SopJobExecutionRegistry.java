package com.pharmasop.trigger.concurrency;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 本进程内作业执行权登记：每个作业同一时刻最多一个推进者。
 * <p>
 * 同时承载取消请求：取消标记写入后，推进者在下一个检查点把作业置为 FAILED(Cancelled)，
 * 正在进行的引擎调用被尽力中断，退避等待被立即唤醒。
 * </p>
 */
@Component
public class SopJobExecutionRegistry {

    private final ConcurrentHashMap<String, Execution> executions = new ConcurrentHashMap<>();

    /**
     * 抢占执行权，已被占用时返回 false。
     */
    public boolean tryAcquire(String jobId) {
        return jobId != null && executions.putIfAbsent(jobId, new Execution()) == null;
    }

    public void release(String jobId) {
        if (jobId != null) {
            executions.remove(jobId);
        }
    }

    public boolean isOwned(String jobId) {
        return jobId != null && executions.containsKey(jobId);
    }

    public int ownedCount() {
        return executions.size();
    }

    /**
     * 登记取消请求；作业不在本进程执行时返回 false。
     */
    public boolean requestCancel(String jobId, String actor, String reason) {
        Execution execution = jobId == null ? null : executions.get(jobId);
        if (execution == null) {
            return false;
        }
        synchronized (execution) {
            if (execution.cancelRequest == null) {
                execution.cancelRequest = new CancelRequest(actor, reason, LocalDateTime.now());
            }
            execution.cancelSignal.countDown();
            if (execution.call != null) {
                execution.call.cancel(true);
            }
        }
        return true;
    }

    public CancelRequest cancelRequest(String jobId) {
        Execution execution = jobId == null ? null : executions.get(jobId);
        return execution == null ? null : execution.cancelRequest;
    }

    public boolean isCancelRequested(String jobId) {
        return cancelRequest(jobId) != null;
    }

    /**
     * 关联当前进行中的引擎调用；若取消已请求则立即中断。
     */
    public void attachCall(String jobId, Future<?> call) {
        Execution execution = executions.get(jobId);
        if (execution == null || call == null) {
            return;
        }
        synchronized (execution) {
            execution.call = call;
            if (execution.cancelRequest != null) {
                call.cancel(true);
            }
        }
    }

    public void detachCall(String jobId) {
        Execution execution = executions.get(jobId);
        if (execution == null) {
            return;
        }
        synchronized (execution) {
            execution.call = null;
        }
    }

    /**
     * 退避等待，期间收到取消请求立即返回 true。
     */
    public boolean awaitCancellation(String jobId, long millis) throws InterruptedException {
        Execution execution = executions.get(jobId);
        if (execution == null) {
            return false;
        }
        if (millis <= 0) {
            return execution.cancelRequest != null;
        }
        return execution.cancelSignal.await(millis, TimeUnit.MILLISECONDS);
    }

    public record CancelRequest(String actor, String reason, LocalDateTime requestedAt) {
    }

    private static final class Execution {
        private volatile CancelRequest cancelRequest;
        private volatile Future<?> call;
        private final CountDownLatch cancelSignal = new CountDownLatch(1);
    }
}

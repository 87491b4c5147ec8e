package com.pharmasop.trigger.job;

import com.pharmasop.trigger.application.command.SopJobAdvanceApplicationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 作业分发器：把待推进作业投递到 worker 线程池，同一作业同时只排队一次。
 * <p>
 * 线程池饱和时直接放弃，作业保持 PENDING，由 {@link SopJobDispatchDaemon} 下一轮补偿。
 * </p>
 */
@Slf4j
@Component
public class SopJobDispatcher {

    private final SopJobAdvanceApplicationService sopJobAdvanceApplicationService;
    private final Executor workerExecutor;
    private final Set<String> queuedJobIds = ConcurrentHashMap.newKeySet();

    public SopJobDispatcher(SopJobAdvanceApplicationService sopJobAdvanceApplicationService,
                            @Qualifier("sopJobWorkerExecutor") Executor workerExecutor) {
        this.sopJobAdvanceApplicationService = sopJobAdvanceApplicationService;
        this.workerExecutor = workerExecutor;
    }

    /**
     * @return 是否成功投递
     */
    public boolean dispatch(String jobId) {
        if (jobId == null || !queuedJobIds.add(jobId)) {
            return false;
        }
        try {
            workerExecutor.execute(() -> runAdvance(jobId));
            return true;
        } catch (RejectedExecutionException ex) {
            queuedJobIds.remove(jobId);
            log.warn("Job dispatch rejected by worker pool, will retry on next poll. jobId={}, error={}",
                    jobId, ex.getMessage());
            return false;
        }
    }

    public int queuedCount() {
        return queuedJobIds.size();
    }

    private void runAdvance(String jobId) {
        try {
            SopJobAdvanceApplicationService.AdvanceResult result = sopJobAdvanceApplicationService.advance(jobId);
            log.debug("Job advanced. jobId={}, outcome={}, message={}", jobId, result.outcome(), result.message());
        } catch (Exception ex) {
            log.error("Job advance failed unexpectedly. jobId={}, error={}", jobId, ex.getMessage(), ex);
        } finally {
            queuedJobIds.remove(jobId);
        }
    }
}

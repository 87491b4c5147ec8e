package com.pharmasop.trigger.job;

import com.pharmasop.domain.sop.adapter.repository.ISopJobRepository;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.types.enums.SopJobStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * PENDING 作业补偿调度：提交时即时投递失败或进程重启后，按创建顺序重新投递。
 */
@Slf4j
@Component
public class SopJobDispatchDaemon {

    private final ISopJobRepository sopJobRepository;
    private final SopJobDispatcher sopJobDispatcher;
    private final int batchSize;

    public SopJobDispatchDaemon(ISopJobRepository sopJobRepository,
                                SopJobDispatcher sopJobDispatcher,
                                @Value("${sop.pipeline.dispatch.batch-size:50}") int batchSize) {
        this.sopJobRepository = sopJobRepository;
        this.sopJobDispatcher = sopJobDispatcher;
        this.batchSize = batchSize > 0 ? batchSize : 50;
    }

    @Scheduled(fixedDelayString = "${sop.pipeline.dispatch.poll-interval-ms:2000}", scheduler = "daemonScheduler")
    public void dispatchPendingJobs() {
        List<SopJobEntity> pendingJobs;
        try {
            pendingJobs = sopJobRepository.findByStatus(SopJobStatusEnum.PENDING, batchSize);
        } catch (Exception ex) {
            log.warn("Failed to load pending jobs. error={}", ex.getMessage());
            return;
        }
        if (pendingJobs == null || pendingJobs.isEmpty()) {
            return;
        }
        int dispatched = 0;
        for (SopJobEntity job : pendingJobs) {
            if (job != null && sopJobDispatcher.dispatch(job.getJobId())) {
                dispatched++;
            }
        }
        if (dispatched > 0) {
            log.debug("Pending jobs dispatched. loaded={}, dispatched={}", pendingJobs.size(), dispatched);
        }
    }
}

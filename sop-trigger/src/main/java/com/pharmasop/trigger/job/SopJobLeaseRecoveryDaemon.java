package com.pharmasop.trigger.job;

import com.pharmasop.domain.audit.service.AuditTrailDomainService;
import com.pharmasop.domain.sop.adapter.repository.ISopJobRepository;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.trigger.application.command.SopJobPersistenceApplicationService;
import com.pharmasop.trigger.concurrency.SopJobExecutionRegistry;
import com.pharmasop.trigger.concurrency.SopJobLockRegistry;
import com.pharmasop.types.enums.SopJobErrorKindEnum;
import com.pharmasop.types.enums.SopJobStatusEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 租约回收守护：PROCESSING 租约已过期且本进程无推进者的作业，置为 FAILED(Interrupted)。
 */
@Slf4j
@Component
public class SopJobLeaseRecoveryDaemon {

    private final ISopJobRepository sopJobRepository;
    private final SopJobPersistenceApplicationService sopJobPersistenceApplicationService;
    private final AuditTrailDomainService auditTrailDomainService;
    private final SopJobLockRegistry sopJobLockRegistry;
    private final SopJobExecutionRegistry sopJobExecutionRegistry;
    private final int batchSize;
    private final Counter recoveredCounter;

    public SopJobLeaseRecoveryDaemon(ISopJobRepository sopJobRepository,
                                     SopJobPersistenceApplicationService sopJobPersistenceApplicationService,
                                     AuditTrailDomainService auditTrailDomainService,
                                     SopJobLockRegistry sopJobLockRegistry,
                                     SopJobExecutionRegistry sopJobExecutionRegistry,
                                     @Value("${sop.pipeline.lease-recovery.batch-size:100}") int batchSize) {
        this.sopJobRepository = sopJobRepository;
        this.sopJobPersistenceApplicationService = sopJobPersistenceApplicationService;
        this.auditTrailDomainService = auditTrailDomainService;
        this.sopJobLockRegistry = sopJobLockRegistry;
        this.sopJobExecutionRegistry = sopJobExecutionRegistry;
        this.batchSize = batchSize > 0 ? batchSize : 100;
        this.recoveredCounter = Counter.builder("sop.job.lease.recovered.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${sop.pipeline.lease-recovery.poll-interval-ms:30000}", scheduler = "daemonScheduler")
    public void recoverExpiredLeases() {
        LocalDateTime now = LocalDateTime.now();
        List<SopJobEntity> expiredJobs;
        try {
            expiredJobs = sopJobRepository.findExpiredProcessing(now, batchSize);
        } catch (Exception ex) {
            log.warn("Failed to load expired processing jobs. error={}", ex.getMessage());
            return;
        }
        if (expiredJobs == null || expiredJobs.isEmpty()) {
            return;
        }
        for (SopJobEntity expired : expiredJobs) {
            if (expired == null || sopJobExecutionRegistry.isOwned(expired.getJobId())) {
                continue;
            }
            try {
                recover(expired.getJobId(), now);
            } catch (Exception ex) {
                log.warn("Lease recovery failed. jobId={}, error={}", expired.getJobId(), ex.getMessage());
            }
        }
    }

    private void recover(String jobId, LocalDateTime now) {
        sopJobLockRegistry.withLock(jobId, () -> {
            SopJobEntity latest = sopJobRepository.findByJobId(jobId);
            if (latest == null || !latest.isLeaseExpired(now) || sopJobExecutionRegistry.isOwned(jobId)) {
                return null;
            }
            SopJobStatusEnum previousStatus = latest.getStatus();
            latest.fail(SopJobErrorKindEnum.INTERRUPTED,
                    "Processing lease expired at " + latest.getLeaseUntil() + " without an active worker");
            SopJobEntity saved = sopJobPersistenceApplicationService.updateJob(latest,
                    List.of(auditTrailDomainService.jobFailed(latest, previousStatus, null)));
            recoveredCounter.increment();
            log.warn("Expired processing lease recovered. jobId={}, attempts={}", jobId, saved.getGenerationAttempts());
            return saved;
        });
    }
}

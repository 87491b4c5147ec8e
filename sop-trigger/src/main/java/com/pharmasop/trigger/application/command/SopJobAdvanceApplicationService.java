package com.pharmasop.trigger.application.command;

import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import com.pharmasop.domain.audit.service.AuditTrailDomainService;
import com.pharmasop.domain.sop.adapter.gateway.ContentGenerationException;
import com.pharmasop.domain.sop.adapter.gateway.ISopContentGenerator;
import com.pharmasop.domain.sop.adapter.repository.ISopJobRepository;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.ContentSnapshot;
import com.pharmasop.domain.sop.model.valobj.GenerationRequest;
import com.pharmasop.domain.sop.model.valobj.SopGenerationPolicy;
import com.pharmasop.domain.sop.model.valobj.ValidationResult;
import com.pharmasop.domain.sop.service.ComplianceValidationDomainService;
import com.pharmasop.domain.sop.service.SopContentAssemblyDomainService;
import com.pharmasop.trigger.concurrency.SopJobExecutionRegistry;
import com.pharmasop.trigger.concurrency.SopJobLockRegistry;
import com.pharmasop.types.enums.SopJobErrorKindEnum;
import com.pharmasop.types.enums.SopJobStatusEnum;
import com.pharmasop.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 作业推进用例（Job Orchestrator 的 Advance）：把一个 PENDING 作业推进到 COMPLETED 或 FAILED。
 * <p>
 * 1) 同一作业只允许一个推进者，由 {@link SopJobExecutionRegistry} 保证；
 * 2) 每次状态写入都在作业锁内完成，并与对应审计条目同事务提交；
 * 3) 引擎调用在独立线程池上执行，每次尝试有截止时间，可重试错误按指数退避重试；
 * 4) 取消请求在每次尝试前后以及退避期间检查。
 * </p>
 */
@Slf4j
@Service
public class SopJobAdvanceApplicationService {

    private final ISopJobRepository sopJobRepository;
    private final ISopContentGenerator sopContentGenerator;
    private final SopContentAssemblyDomainService sopContentAssemblyDomainService;
    private final ComplianceValidationDomainService complianceValidationDomainService;
    private final AuditTrailDomainService auditTrailDomainService;
    private final SopJobPersistenceApplicationService sopJobPersistenceApplicationService;
    private final SopJobLockRegistry sopJobLockRegistry;
    private final SopJobExecutionRegistry sopJobExecutionRegistry;
    private final SopGenerationPolicy sopGenerationPolicy;
    private final ExecutorService generationCallExecutor;

    private final Counter attemptCounter;
    private final Counter retryCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter storageErrorCounter;

    public SopJobAdvanceApplicationService(ISopJobRepository sopJobRepository,
                                           ISopContentGenerator sopContentGenerator,
                                           SopContentAssemblyDomainService sopContentAssemblyDomainService,
                                           ComplianceValidationDomainService complianceValidationDomainService,
                                           AuditTrailDomainService auditTrailDomainService,
                                           SopJobPersistenceApplicationService sopJobPersistenceApplicationService,
                                           SopJobLockRegistry sopJobLockRegistry,
                                           SopJobExecutionRegistry sopJobExecutionRegistry,
                                           SopGenerationPolicy sopGenerationPolicy,
                                           @Qualifier("sopGenerationCallExecutor") ExecutorService generationCallExecutor) {
        this.sopJobRepository = sopJobRepository;
        this.sopContentGenerator = sopContentGenerator;
        this.sopContentAssemblyDomainService = sopContentAssemblyDomainService;
        this.complianceValidationDomainService = complianceValidationDomainService;
        this.auditTrailDomainService = auditTrailDomainService;
        this.sopJobPersistenceApplicationService = sopJobPersistenceApplicationService;
        this.sopJobLockRegistry = sopJobLockRegistry;
        this.sopJobExecutionRegistry = sopJobExecutionRegistry;
        this.sopGenerationPolicy = sopGenerationPolicy == null ? SopGenerationPolicy.defaults() : sopGenerationPolicy;
        this.generationCallExecutor = generationCallExecutor;
        this.attemptCounter = Counter.builder("sop.job.generation.attempt.total").register(Metrics.globalRegistry);
        this.retryCounter = Counter.builder("sop.job.generation.retry.total").register(Metrics.globalRegistry);
        this.completedCounter = Counter.builder("sop.job.completed.total").register(Metrics.globalRegistry);
        this.failedCounter = Counter.builder("sop.job.failed.total").register(Metrics.globalRegistry);
        this.storageErrorCounter = Counter.builder("sop.job.storage_error.total").register(Metrics.globalRegistry);
    }

    public AdvanceResult advance(String jobId) {
        if (StringUtils.isBlank(jobId)) {
            return AdvanceResult.skipped(jobId, "jobId is blank");
        }
        if (!sopJobExecutionRegistry.tryAcquire(jobId)) {
            log.debug("Advance skipped, job already owned. jobId={}", jobId);
            return AdvanceResult.skipped(jobId, "job is already being advanced");
        }
        try {
            Claim claim = sopJobLockRegistry.withLock(jobId, () -> claim(jobId));
            if (claim.rejection() != null) {
                return claim.rejection();
            }
            return runGeneration(claim.job());
        } catch (AppException ex) {
            storageErrorCounter.increment();
            log.error("Advance aborted by storage failure. jobId={}, code={}, error={}", jobId, ex.getCode(), ex.getInfo());
            markStorageFailure(jobId, ex);
            return AdvanceResult.aborted(jobId, ex.getInfo());
        } finally {
            sopJobExecutionRegistry.release(jobId);
        }
    }

    private Claim claim(String jobId) {
        SopJobEntity job = sopJobRepository.findByJobId(jobId);
        if (job == null) {
            return Claim.rejected(AdvanceResult.notFound(jobId));
        }
        if (job.getStatus() != SopJobStatusEnum.PENDING) {
            return Claim.rejected(AdvanceResult.skipped(jobId, "job status is " + job.getStatus()));
        }
        SopJobStatusEnum previousStatus = job.getStatus();
        job.startProcessing(sopGenerationPolicy.getProcessingLeaseSeconds());
        AuditEntryEntity started = auditTrailDomainService.processingStarted(job, previousStatus);
        SopJobEntity saved = sopJobPersistenceApplicationService.updateJob(job, List.of(started));
        log.debug("Job processing started. jobId={}, leaseUntil={}", jobId, saved.getLeaseUntil());
        return Claim.claimed(saved);
    }

    private AdvanceResult runGeneration(SopJobEntity claimedJob) {
        SopJobEntity job = claimedJob;
        String jobId = job.getJobId();
        int maxAttempts = sopGenerationPolicy.getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (sopJobExecutionRegistry.isCancelRequested(jobId)) {
                return finish(job, Resolution.failed(SopJobErrorKindEnum.CANCELLED, null), List.of());
            }
            job.recordGenerationAttempt();
            attemptCounter.increment();
            AttemptOutcome outcome = callEngine(job, attempt);
            if (outcome.snapshot() != null) {
                return complete(job, outcome.snapshot());
            }

            boolean cancelRequested = sopJobExecutionRegistry.isCancelRequested(jobId);
            boolean willRetry = !cancelRequested && outcome.kind().isRetryable() && attempt < maxAttempts;
            AuditEntryEntity attemptEntry = auditTrailDomainService.generationAttemptFailed(job, attempt,
                    outcome.kind(), outcome.message(), willRetry);
            if (!willRetry) {
                String detail = outcome.kind().isRetryable()
                        ? "Generation failed after " + attempt + " attempt(s): " + outcome.message()
                        : outcome.message();
                return finish(job, Resolution.failed(outcome.kind(), detail), List.of(attemptEntry));
            }

            long backoffMillis = sopGenerationPolicy.backoffMillis(attempt);
            retryCounter.increment();
            log.warn("Generation attempt failed, retrying. jobId={}, attempt={}, errorKind={}, backoffMs={}, error={}",
                    jobId, attempt, outcome.kind().getCode(), backoffMillis, outcome.message());
            SopJobEntity current = job;
            job = sopJobLockRegistry.withLock(jobId,
                    () -> sopJobPersistenceApplicationService.updateJob(current, List.of(attemptEntry)));
            try {
                if (sopJobExecutionRegistry.awaitCancellation(jobId, backoffMillis)) {
                    return finish(job, Resolution.failed(SopJobErrorKindEnum.CANCELLED, null), List.of());
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return finish(job, Resolution.failed(SopJobErrorKindEnum.INTERRUPTED,
                        "Worker interrupted during retry backoff"), List.of());
            }
        }
        // maxAttempts >= 1，不会走到这里
        return finish(job, Resolution.failed(SopJobErrorKindEnum.ENGINE_UNAVAILABLE, "No generation attempt made"), List.of());
    }

    private AttemptOutcome callEngine(SopJobEntity job, int attempt) {
        String jobId = job.getJobId();
        long timeoutMillis = sopGenerationPolicy.getAttemptTimeoutMs();
        GenerationRequest request = buildRequest(job, attempt, timeoutMillis);
        Future<ContentSnapshot> call;
        try {
            call = generationCallExecutor.submit(() -> sopContentGenerator.generate(request));
        } catch (RejectedExecutionException ex) {
            return AttemptOutcome.failed(SopJobErrorKindEnum.ENGINE_UNAVAILABLE,
                    "Generation call executor saturated: " + ex.getMessage());
        }
        sopJobExecutionRegistry.attachCall(jobId, call);
        try {
            ContentSnapshot snapshot = call.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (snapshot == null) {
                return AttemptOutcome.failed(SopJobErrorKindEnum.ENGINE_UNAVAILABLE, "Engine returned no content");
            }
            return AttemptOutcome.succeeded(snapshot);
        } catch (TimeoutException ex) {
            call.cancel(true);
            return AttemptOutcome.failed(SopJobErrorKindEnum.ENGINE_TIMEOUT,
                    "Generation attempt exceeded deadline of " + timeoutMillis + " ms");
        } catch (CancellationException ex) {
            return AttemptOutcome.failed(SopJobErrorKindEnum.CANCELLED, "Generation call cancelled");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof ContentGenerationException generationException && generationException.getKind() != null) {
                return AttemptOutcome.failed(generationException.getKind(), generationException.getMessage());
            }
            return AttemptOutcome.failed(SopJobErrorKindEnum.ENGINE_UNAVAILABLE,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return AttemptOutcome.failed(SopJobErrorKindEnum.INTERRUPTED, "Worker interrupted during generation call");
        } finally {
            sopJobExecutionRegistry.detachCall(jobId);
        }
    }

    private AdvanceResult complete(SopJobEntity job, ContentSnapshot snapshot) {
        ContentSnapshot aligned = sopContentAssemblyDomainService.alignToRequest(job.getSections(), snapshot,
                sopContentGenerator.engineId());
        ValidationResult validation = complianceValidationDomainService.validate(job, aligned,
                sopGenerationPolicy.getBaselineFramework());
        return finish(job, Resolution.completed(aligned, validation), List.of());
    }

    /**
     * 在作业锁内落定终态；若期间收到取消请求，以取消覆盖原结论。
     */
    private AdvanceResult finish(SopJobEntity job, Resolution resolution, List<AuditEntryEntity> pendingEntries) {
        String jobId = job.getJobId();
        return sopJobLockRegistry.withLock(jobId, () -> {
            SopJobStatusEnum previousStatus = job.getStatus();
            List<AuditEntryEntity> entries = new ArrayList<>(pendingEntries);
            SopJobExecutionRegistry.CancelRequest cancelRequest = sopJobExecutionRegistry.cancelRequest(jobId);
            if (cancelRequest != null) {
                job.fail(SopJobErrorKindEnum.CANCELLED, cancelDetail(cancelRequest));
                entries.add(auditTrailDomainService.jobFailed(job, previousStatus, cancelRequest.actor()));
                SopJobEntity saved = sopJobPersistenceApplicationService.updateJob(job, entries);
                failedCounter.increment();
                log.info("SOP job cancelled. jobId={}, attempts={}, actor={}", jobId,
                        saved.getGenerationAttempts(), cancelRequest.actor());
                return AdvanceResult.failed(saved);
            }
            if (resolution.snapshot() != null) {
                String previousContentHash = job.contentHash();
                job.complete(resolution.snapshot(), resolution.validation());
                entries.add(auditTrailDomainService.validationCompleted(job, resolution.validation()));
                entries.add(auditTrailDomainService.jobCompleted(job, previousStatus, previousContentHash));
                SopJobEntity saved = sopJobPersistenceApplicationService.updateJob(job, entries);
                completedCounter.increment();
                log.info("SOP job completed. jobId={}, attempts={}, complianceScore={}, sections={}, words={}",
                        jobId, saved.getGenerationAttempts(), resolution.validation().getScore(),
                        resolution.snapshot().getSectionCount(), resolution.snapshot().getWordCount());
                return AdvanceResult.completed(saved);
            }
            job.fail(resolution.kind(), resolution.detail());
            entries.add(auditTrailDomainService.jobFailed(job, previousStatus, null));
            SopJobEntity saved = sopJobPersistenceApplicationService.updateJob(job, entries);
            failedCounter.increment();
            log.warn("SOP job failed. jobId={}, attempts={}, errorKind={}, error={}",
                    jobId, saved.getGenerationAttempts(), resolution.kind().getCode(), saved.getErrorDetail());
            return AdvanceResult.failed(saved);
        });
    }

    /**
     * 存储失败后尽力把作业置为 FAILED(StorageError)；再次失败则留给租约回收。
     */
    private void markStorageFailure(String jobId, AppException cause) {
        try {
            sopJobLockRegistry.withLock(jobId, () -> {
                SopJobEntity latest = sopJobRepository.findByJobId(jobId);
                if (latest == null || latest.getStatus() != SopJobStatusEnum.PROCESSING) {
                    return null;
                }
                SopJobStatusEnum previousStatus = latest.getStatus();
                latest.fail(SopJobErrorKindEnum.STORAGE_ERROR, "Storage failure while advancing job: " + cause.getInfo());
                return sopJobPersistenceApplicationService.updateJob(latest,
                        List.of(auditTrailDomainService.jobFailed(latest, previousStatus, null)));
            });
        } catch (RuntimeException ex) {
            log.error("Failed to mark job after storage failure, lease recovery will resolve it. jobId={}, error={}",
                    jobId, ex.getMessage());
        }
    }

    private GenerationRequest buildRequest(SopJobEntity job, int attempt, long timeoutMillis) {
        GenerationRequest request = new GenerationRequest();
        request.setJobId(job.getJobId());
        request.setAttempt(attempt);
        request.setTitle(job.getTitle());
        request.setDescription(job.getDescription());
        request.setDepartment(job.getDepartment());
        request.setPriority(job.getPriority());
        request.setSections(new ArrayList<>(job.getSections()));
        request.setFrameworks(new ArrayList<>(job.getRegulatoryFrameworks()));
        request.setEquipment(copy(job.getEquipment()));
        request.setMaterials(copy(job.getMaterials()));
        request.setSafetyNotes(job.getSafetyNotes());
        request.setQualityCheckpoints(copy(job.getQualityCheckpoints()));
        request.setCustomRequirements(job.getCustomRequirements());
        request.setDeadline(Instant.now().plusMillis(timeoutMillis));
        return request;
    }

    private String cancelDetail(SopJobExecutionRegistry.CancelRequest request) {
        String detail = "Cancelled by " + request.actor();
        return StringUtils.isBlank(request.reason()) ? detail : detail + ": " + request.reason().trim();
    }

    private static List<String> copy(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }

    private record Claim(SopJobEntity job, AdvanceResult rejection) {
        static Claim claimed(SopJobEntity job) {
            return new Claim(job, null);
        }

        static Claim rejected(AdvanceResult rejection) {
            return new Claim(null, rejection);
        }
    }

    private record AttemptOutcome(ContentSnapshot snapshot, SopJobErrorKindEnum kind, String message) {
        static AttemptOutcome succeeded(ContentSnapshot snapshot) {
            return new AttemptOutcome(snapshot, null, null);
        }

        static AttemptOutcome failed(SopJobErrorKindEnum kind, String message) {
            return new AttemptOutcome(null, kind, message);
        }
    }

    private record Resolution(ContentSnapshot snapshot, ValidationResult validation,
                              SopJobErrorKindEnum kind, String detail) {
        static Resolution completed(ContentSnapshot snapshot, ValidationResult validation) {
            return new Resolution(snapshot, validation, null, null);
        }

        static Resolution failed(SopJobErrorKindEnum kind, String detail) {
            return new Resolution(null, null, kind, detail);
        }
    }

    public enum AdvanceOutcome {
        COMPLETED,
        FAILED,
        SKIPPED,
        NOT_FOUND,
        ABORTED
    }

    public record AdvanceResult(AdvanceOutcome outcome, String jobId, SopJobEntity job, String message) {
        public static AdvanceResult completed(SopJobEntity job) {
            return new AdvanceResult(AdvanceOutcome.COMPLETED, job.getJobId(), job, null);
        }

        public static AdvanceResult failed(SopJobEntity job) {
            return new AdvanceResult(AdvanceOutcome.FAILED, job.getJobId(), job, job.getErrorDetail());
        }

        public static AdvanceResult skipped(String jobId, String message) {
            return new AdvanceResult(AdvanceOutcome.SKIPPED, jobId, null, message);
        }

        public static AdvanceResult notFound(String jobId) {
            return new AdvanceResult(AdvanceOutcome.NOT_FOUND, jobId, null, "job not found");
        }

        public static AdvanceResult aborted(String jobId, String message) {
            return new AdvanceResult(AdvanceOutcome.ABORTED, jobId, null, message);
        }

        public boolean isTerminal() {
            return outcome == AdvanceOutcome.COMPLETED || outcome == AdvanceOutcome.FAILED;
        }
    }
}

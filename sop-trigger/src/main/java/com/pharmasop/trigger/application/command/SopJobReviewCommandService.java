package com.pharmasop.trigger.application.command;

import com.pharmasop.api.dto.SopJobDetailDTO;
import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import com.pharmasop.domain.audit.service.AuditTrailDomainService;
import com.pharmasop.domain.sop.adapter.repository.ISopJobRepository;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.trigger.application.common.SopJobDetailViewAssembler;
import com.pharmasop.trigger.concurrency.SopJobLockRegistry;
import com.pharmasop.types.enums.ReviewOutcomeEnum;
import com.pharmasop.types.enums.SopJobStatusEnum;
import com.pharmasop.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 人工审核用例：开始审核与审核结论（批准/驳回）。
 * <p>
 * 非可审核状态一律返回 INVALID_TRANSITION，作业保持原状态；
 * 从 COMPLETED 直接给出结论时，在同一事务内经过 UNDER_REVIEW。
 * </p>
 */
@Slf4j
@Service
public class SopJobReviewCommandService {

    private final ISopJobRepository sopJobRepository;
    private final AuditTrailDomainService auditTrailDomainService;
    private final SopJobPersistenceApplicationService sopJobPersistenceApplicationService;
    private final SopJobLockRegistry sopJobLockRegistry;
    private final SopJobDetailViewAssembler sopJobDetailViewAssembler;

    public SopJobReviewCommandService(ISopJobRepository sopJobRepository,
                                      AuditTrailDomainService auditTrailDomainService,
                                      SopJobPersistenceApplicationService sopJobPersistenceApplicationService,
                                      SopJobLockRegistry sopJobLockRegistry,
                                      SopJobDetailViewAssembler sopJobDetailViewAssembler) {
        this.sopJobRepository = sopJobRepository;
        this.auditTrailDomainService = auditTrailDomainService;
        this.sopJobPersistenceApplicationService = sopJobPersistenceApplicationService;
        this.sopJobLockRegistry = sopJobLockRegistry;
        this.sopJobDetailViewAssembler = sopJobDetailViewAssembler;
    }

    public SopJobDetailDTO beginReview(String jobId, String reviewer) {
        if (StringUtils.isBlank(reviewer)) {
            throw AppException.invalidRequest("reviewer is required");
        }
        SopJobEntity saved = sopJobLockRegistry.tryWithLock(jobId, () -> {
            SopJobEntity job = loadJob(jobId);
            if (job.getStatus() != SopJobStatusEnum.COMPLETED) {
                throw AppException.invalidTransition("Job " + jobId + " is " + job.getStatus()
                        + " and cannot enter review");
            }
            SopJobStatusEnum previousStatus = job.getStatus();
            job.beginReview(reviewer.trim());
            return sopJobPersistenceApplicationService.updateJob(job,
                    List.of(auditTrailDomainService.reviewStarted(job, previousStatus, reviewer.trim())));
        });
        log.info("SOP review started. jobId={}, reviewer={}", jobId, saved.getReviewedBy());
        return sopJobDetailViewAssembler.toDetailDTO(saved);
    }

    public SopJobDetailDTO review(String jobId, String outcomeCode, String reviewer, String comment) {
        ReviewOutcomeEnum outcome = parseOutcome(outcomeCode);
        if (StringUtils.isBlank(reviewer)) {
            throw AppException.invalidRequest("reviewer is required");
        }
        String normalizedReviewer = reviewer.trim();
        String normalizedComment = StringUtils.trimToNull(comment);
        SopJobEntity saved = sopJobLockRegistry.tryWithLock(jobId, () -> {
            SopJobEntity job = loadJob(jobId);
            if (job.getStatus() == null || !job.getStatus().isReviewable()) {
                throw AppException.invalidTransition("Job " + jobId + " is " + job.getStatus()
                        + " and cannot be reviewed");
            }
            List<AuditEntryEntity> entries = new ArrayList<>();
            if (job.getStatus() == SopJobStatusEnum.COMPLETED) {
                job.beginReview(normalizedReviewer);
                entries.add(auditTrailDomainService.reviewStarted(job, SopJobStatusEnum.COMPLETED, normalizedReviewer));
            }
            SopJobStatusEnum previousStatus = job.getStatus();
            job.review(outcome, normalizedReviewer, normalizedComment);
            entries.add(auditTrailDomainService.reviewed(job, previousStatus, outcome));
            return sopJobPersistenceApplicationService.updateJob(job, entries);
        });
        log.info("SOP reviewed. jobId={}, outcome={}, reviewer={}", jobId, outcome.getCode(), normalizedReviewer);
        return sopJobDetailViewAssembler.toDetailDTO(saved);
    }

    private ReviewOutcomeEnum parseOutcome(String outcomeCode) {
        if (StringUtils.isBlank(outcomeCode)) {
            throw AppException.invalidRequest("review outcome is required");
        }
        try {
            return ReviewOutcomeEnum.fromCode(outcomeCode.trim());
        } catch (IllegalArgumentException ex) {
            throw AppException.invalidRequest("review outcome must be approve or reject: " + outcomeCode);
        }
    }

    private SopJobEntity loadJob(String jobId) {
        SopJobEntity job = StringUtils.isBlank(jobId) ? null : sopJobRepository.findByJobId(jobId);
        if (job == null) {
            throw AppException.notFound("SOP job not found: " + jobId);
        }
        return job;
    }
}

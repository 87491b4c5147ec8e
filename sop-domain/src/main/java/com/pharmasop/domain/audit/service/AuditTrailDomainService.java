package com.pharmasop.domain.audit.service;

import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.ValidationResult;
import com.pharmasop.types.common.Constants;
import com.pharmasop.types.common.HashUtils;
import com.pharmasop.types.enums.AuditActionEnum;
import com.pharmasop.types.enums.AuditSeverityEnum;
import com.pharmasop.types.enums.ReviewOutcomeEnum;
import com.pharmasop.types.enums.SopJobErrorKindEnum;
import com.pharmasop.types.enums.SopJobStatusEnum;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 审计追踪领域服务：为作业生命周期中的每个动作构造审计条目，并计算校验和与复核标记。
 * <p>
 * 构造出的条目尚未持久化，由调用方在同一事务中与作业状态一起写入。
 * </p>
 */
@Service
public class AuditTrailDomainService {

    public AuditEntryEntity jobCreated(SopJobEntity job, String actor) {
        Map<String, Object> newValues = statusValues(job.getStatus());
        newValues.put("title", job.getTitle());
        newValues.put("frameworks", job.getRegulatoryFrameworks() == null ? null
                : job.getRegulatoryFrameworks().stream().map(framework -> framework.getCode()).toList());
        newValues.put("sectionCount", job.getSections() == null ? 0 : job.getSections().size());
        AuditEntryEntity entry = forJob(job, actor, AuditActionEnum.CREATE, AuditSeverityEnum.LOW,
                "SOP generation job created: " + job.getTitle(), null, newValues);
        if (job.getSourceJobId() != null) {
            entry.getAdditionalData().put("sourceJobId", job.getSourceJobId());
        }
        return seal(entry);
    }

    public AuditEntryEntity processingStarted(SopJobEntity job, SopJobStatusEnum previousStatus) {
        Map<String, Object> newValues = statusValues(job.getStatus());
        newValues.put("leaseUntil", job.getLeaseUntil() == null ? null : job.getLeaseUntil().toString());
        return seal(forJob(job, Constants.SYSTEM_ACTOR, AuditActionEnum.START_PROCESSING, AuditSeverityEnum.LOW,
                "Job processing started", statusValues(previousStatus), newValues));
    }

    public AuditEntryEntity generationAttemptFailed(SopJobEntity job, int attempt, SopJobErrorKindEnum kind,
                                                    String message, boolean willRetry) {
        AuditEntryEntity entry = forJob(job, Constants.SYSTEM_ACTOR, AuditActionEnum.GENERATION_ATTEMPT_FAILED,
                AuditSeverityEnum.MEDIUM, "Generation attempt " + attempt + " failed: " + kind.getCode(), null, null);
        entry.getAdditionalData().put("attempt", attempt);
        entry.getAdditionalData().put("errorKind", kind.getCode());
        entry.getAdditionalData().put("message", message);
        entry.getAdditionalData().put("willRetry", willRetry);
        return seal(entry);
    }

    public AuditEntryEntity validationCompleted(SopJobEntity job, ValidationResult result) {
        boolean failed = result != null && result.hasFailures();
        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("score", result == null ? null : result.getScore());
        newValues.put("issues", result == null ? null : result.getIssues());
        AuditEntryEntity entry = forJob(job, Constants.SYSTEM_ACTOR, AuditActionEnum.VALIDATE,
                failed ? AuditSeverityEnum.HIGH : AuditSeverityEnum.LOW,
                "Compliance validation completed with score " + (result == null ? "n/a" : result.getScore()),
                null, newValues);
        entry.setRequiresReview(failed);
        return seal(entry);
    }

    public AuditEntryEntity jobCompleted(SopJobEntity job, SopJobStatusEnum previousStatus, String previousContentHash) {
        Map<String, Object> oldValues = statusValues(previousStatus);
        oldValues.put("contentHash", previousContentHash);
        Map<String, Object> newValues = statusValues(job.getStatus());
        newValues.put("contentHash", job.contentHash());
        newValues.put("sectionCount", job.getContent() == null ? 0 : job.getContent().getSectionCount());
        newValues.put("wordCount", job.getContent() == null ? 0 : job.getContent().getWordCount());
        newValues.put("complianceScore", job.getValidation() == null ? null : job.getValidation().getScore());
        AuditEntryEntity entry = forJob(job, Constants.SYSTEM_ACTOR, AuditActionEnum.COMPLETE, AuditSeverityEnum.MEDIUM,
                "SOP content generated after " + job.getGenerationAttempts() + " attempt(s)", oldValues, newValues);
        entry.getAdditionalData().put("engineId", job.getContent() == null ? null : job.getContent().getEngineId());
        return seal(entry);
    }

    public AuditEntryEntity jobFailed(SopJobEntity job, SopJobStatusEnum previousStatus, String actor) {
        Map<String, Object> newValues = statusValues(job.getStatus());
        newValues.put("errorKind", job.getErrorKind() == null ? null : job.getErrorKind().getCode());
        newValues.put("errorDetail", job.getErrorDetail());
        return seal(forJob(job, actor == null ? Constants.SYSTEM_ACTOR : actor, AuditActionEnum.FAIL,
                AuditSeverityEnum.HIGH, "Job failed: " + job.getErrorDetail(), statusValues(previousStatus), newValues));
    }

    public AuditEntryEntity cancelled(SopJobEntity job, SopJobStatusEnum previousStatus, String actor, String reason) {
        AuditEntryEntity entry = forJob(job, actor, AuditActionEnum.CANCEL, AuditSeverityEnum.MEDIUM,
                "Job cancellation requested" + (hasText(reason) ? ": " + reason.trim() : ""),
                statusValues(previousStatus), statusValues(job.getStatus()));
        entry.getAdditionalData().put("reason", reason);
        return seal(entry);
    }

    public AuditEntryEntity reviewStarted(SopJobEntity job, SopJobStatusEnum previousStatus, String reviewer) {
        return seal(forJob(job, reviewer, AuditActionEnum.BEGIN_REVIEW, AuditSeverityEnum.LOW,
                "Human review started", statusValues(previousStatus), statusValues(job.getStatus())));
    }

    public AuditEntryEntity reviewed(SopJobEntity job, SopJobStatusEnum previousStatus, ReviewOutcomeEnum outcome) {
        Map<String, Object> newValues = statusValues(job.getStatus());
        newValues.put("reviewedBy", job.getReviewedBy());
        newValues.put("reviewedAt", job.getReviewedAt() == null ? null : job.getReviewedAt().toString());
        newValues.put("comment", job.getReviewComment());
        AuditEntryEntity entry = forJob(job, job.getReviewedBy(), outcome.getAuditAction(), AuditSeverityEnum.HIGH,
                "SOP " + (outcome == ReviewOutcomeEnum.APPROVE ? "approved" : "rejected") + " by " + job.getReviewedBy(),
                statusValues(previousStatus), newValues);
        return seal(entry);
    }

    public AuditEntryEntity resubmitted(SopJobEntity sourceJob, SopJobEntity newJob, String actor) {
        AuditEntryEntity entry = forJob(sourceJob, actor, AuditActionEnum.RESUBMIT, AuditSeverityEnum.LOW,
                "Job resubmitted as " + newJob.getJobId(), null, null);
        entry.getAdditionalData().put("newJobId", newJob.getJobId());
        return seal(entry);
    }

    public AuditEntryEntity archived(SopJobEntity job, String actor) {
        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("archived", true);
        newValues.put("archivedAt", job.getArchivedAt() == null ? null : job.getArchivedAt().toString());
        Map<String, Object> oldValues = new LinkedHashMap<>();
        oldValues.put("archived", false);
        return seal(forJob(job, actor, AuditActionEnum.ARCHIVE, AuditSeverityEnum.MEDIUM,
                "Job archived", oldValues, newValues));
    }

    public AuditEntryEntity exported(SopJobEntity job, String actor, String fileName) {
        AuditEntryEntity entry = forJob(job, actor, AuditActionEnum.EXPORT, AuditSeverityEnum.LOW,
                "SOP document exported: " + fileName, null, null);
        entry.getAdditionalData().put("fileName", fileName);
        entry.getAdditionalData().put("contentHash", job.contentHash());
        return seal(entry);
    }

    /**
     * 复核确认：以新条目引用原条目，原条目的业务内容保持不变
     */
    public AuditEntryEntity acknowledged(AuditEntryEntity original) {
        AuditEntryEntity entry = new AuditEntryEntity();
        entry.setResourceType(original.getResourceType());
        entry.setResourceId(original.getResourceId());
        entry.setActor(original.getReviewedBy());
        entry.setAction(AuditActionEnum.ACKNOWLEDGE);
        entry.setSeverity(AuditSeverityEnum.LOW);
        entry.setDescription("Audit entry " + original.getId() + " reviewed: "
                + (original.getReviewStatus() == null ? null : original.getReviewStatus().getCode()));
        entry.setReferenceEntryId(original.getId());
        entry.getAdditionalData().put("comment", original.getReviewComment());
        entry.setRequiresReview(false);
        entry.setCreatedAt(now());
        return seal(entry);
    }

    /**
     * 复核标记：审批动作、CRITICAL 级别或已被显式标记的条目。
     */
    public boolean requiresReview(AuditEntryEntity entry) {
        if (entry == null) {
            return false;
        }
        if (Boolean.TRUE.equals(entry.getRequiresReview())) {
            return true;
        }
        if (entry.getAction() != null && entry.getAction().isApprovalAction()) {
            return true;
        }
        return entry.getSeverity() == AuditSeverityEnum.CRITICAL;
    }

    public String checksum(AuditEntryEntity entry) {
        String source = String.join("|",
                String.valueOf(entry.getActor()),
                entry.getAction() == null ? "null" : entry.getAction().getCode(),
                String.valueOf(entry.getResourceType()),
                String.valueOf(entry.getResourceId()),
                entry.getCreatedAt() == null ? "null" : entry.getCreatedAt().toString(),
                String.valueOf(entry.getDescription()));
        return HashUtils.sha256Hex(source);
    }

    public boolean verifyChecksum(AuditEntryEntity entry) {
        return entry != null && entry.getChecksum() != null && entry.getChecksum().equals(checksum(entry));
    }

    private AuditEntryEntity forJob(SopJobEntity job,
                                    String actor,
                                    AuditActionEnum action,
                                    AuditSeverityEnum severity,
                                    String description,
                                    Map<String, Object> oldValues,
                                    Map<String, Object> newValues) {
        AuditEntryEntity entry = new AuditEntryEntity();
        entry.setResourceType(Constants.RESOURCE_TYPE_SOP_JOB);
        entry.setResourceId(job.getJobId());
        entry.setActor(hasText(actor) ? actor.trim() : Constants.SYSTEM_ACTOR);
        entry.setAction(action);
        entry.setSeverity(severity);
        entry.setDescription(description);
        if (oldValues != null) {
            entry.setOldValues(oldValues);
        }
        if (newValues != null) {
            entry.setNewValues(newValues);
        }
        entry.setRequiresReview(false);
        entry.setCreatedAt(now());
        return entry;
    }

    private AuditEntryEntity seal(AuditEntryEntity entry) {
        entry.setRequiresReview(requiresReview(entry));
        entry.setChecksum(checksum(entry));
        return entry;
    }

    private Map<String, Object> statusValues(SopJobStatusEnum status) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("status", status == null ? null : status.getCode());
        return values;
    }

    // 与数据库 timestamp 精度保持一致，保证读回后校验和可复算
    private LocalDateTime now() {
        return LocalDateTime.now().truncatedTo(ChronoUnit.MICROS);
    }

    private boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}

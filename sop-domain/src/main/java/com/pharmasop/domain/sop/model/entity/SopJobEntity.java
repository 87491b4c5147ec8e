package com.pharmasop.domain.sop.model.entity;

import com.pharmasop.domain.sop.model.valobj.ContentSnapshot;
import com.pharmasop.domain.sop.model.valobj.SopSectionSpec;
import com.pharmasop.domain.sop.model.valobj.ValidationResult;
import com.pharmasop.types.enums.PharmaDepartmentEnum;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import com.pharmasop.types.enums.ReviewOutcomeEnum;
import com.pharmasop.types.enums.SopJobErrorKindEnum;
import com.pharmasop.types.enums.SopJobStatusEnum;
import com.pharmasop.types.enums.SopPriorityEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * SOP 生成作业领域实体（聚合根）
 * <p>
 * 作业进入终态后除审核（批准/驳回）与逻辑归档外不再被修改；
 * 内容快照与合规校验结果总是作为一组整体更新。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Data
public class SopJobEntity {

    /**
     * 作业 ID（UUID），分配后不可变
     */
    private String jobId;

    /**
     * 标题
     */
    private String title;

    /**
     * 描述
     */
    private String description;

    /**
     * 部门
     */
    private PharmaDepartmentEnum department;

    /**
     * 优先级
     */
    private SopPriorityEnum priority;

    /**
     * 适用法规框架（非空）
     */
    private List<RegulatoryFrameworkEnum> regulatoryFrameworks = new ArrayList<>();

    /**
     * 请求章节（有序，标题唯一）
     */
    private List<SopSectionSpec> sections = new ArrayList<>();

    private List<String> equipment = new ArrayList<>();

    private List<String> materials = new ArrayList<>();

    private String safetyNotes;

    private List<String> qualityCheckpoints = new ArrayList<>();

    private String customRequirements;

    /**
     * 提交人
     */
    private String requestedBy;

    /**
     * 状态
     */
    private SopJobStatusEnum status;

    /**
     * 当前内容快照
     */
    private ContentSnapshot content;

    /**
     * 当前合规校验结果
     */
    private ValidationResult validation;

    private SopJobErrorKindEnum errorKind;

    private String errorDetail;

    /**
     * 已发起的生成尝试次数
     */
    private Integer generationAttempts;

    /**
     * PROCESSING 租约过期时间
     */
    private LocalDateTime leaseUntil;

    private String reviewedBy;

    private LocalDateTime reviewedAt;

    private String reviewComment;

    private Boolean archived;

    private LocalDateTime archivedAt;

    /**
     * 重新提交时指向来源作业
     */
    private String sourceJobId;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime completedAt;

    /**
     * 验证作业是否有效
     */
    public void validate() {
        if (jobId == null || jobId.trim().isEmpty()) {
            throw new IllegalStateException("Job ID cannot be empty");
        }
        if (title == null || title.trim().isEmpty()) {
            throw new IllegalStateException("Title cannot be empty");
        }
        if (regulatoryFrameworks == null || regulatoryFrameworks.isEmpty()) {
            throw new IllegalStateException("Regulatory frameworks cannot be empty");
        }
        if (sections == null || sections.isEmpty()) {
            throw new IllegalStateException("Sections cannot be empty");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
    }

    /**
     * 开始处理，并设置处理租约
     */
    public void startProcessing(long leaseSeconds) {
        transitTo(SopJobStatusEnum.PROCESSING);
        this.leaseUntil = this.updatedAt.plusSeconds(Math.max(leaseSeconds, 1L));
    }

    /**
     * 记录一次生成尝试
     */
    public int recordGenerationAttempt() {
        if (this.status != SopJobStatusEnum.PROCESSING) {
            throw new IllegalStateException("Job must be in PROCESSING status to record a generation attempt");
        }
        this.generationAttempts = (this.generationAttempts == null ? 0 : this.generationAttempts) + 1;
        this.updatedAt = LocalDateTime.now();
        return this.generationAttempts;
    }

    /**
     * 完成生成：快照与校验结果整体替换
     */
    public void complete(ContentSnapshot content, ValidationResult validation) {
        if (content == null || validation == null) {
            throw new IllegalStateException("Content snapshot and validation result are required to complete");
        }
        transitTo(SopJobStatusEnum.COMPLETED);
        this.content = content;
        this.validation = validation;
        this.errorKind = null;
        this.errorDetail = null;
        this.leaseUntil = null;
        this.completedAt = this.updatedAt;
    }

    /**
     * 生成失败，失败原因不能为空
     */
    public void fail(SopJobErrorKindEnum kind, String detail) {
        if (kind == null) {
            throw new IllegalStateException("Error kind is required to fail a job");
        }
        transitTo(SopJobStatusEnum.FAILED);
        this.errorKind = kind;
        this.errorDetail = detail == null || detail.trim().isEmpty()
                ? "Job failed: " + kind.getCode()
                : detail.trim();
        this.leaseUntil = null;
        this.completedAt = this.updatedAt;
    }

    /**
     * 开始人工审核
     */
    public void beginReview(String reviewer) {
        if (this.status != SopJobStatusEnum.COMPLETED) {
            throw new IllegalStateException("Job must be in COMPLETED status to begin review, current: " + this.status);
        }
        transitTo(SopJobStatusEnum.UNDER_REVIEW);
        this.reviewedBy = reviewer;
    }

    /**
     * 审核结论；COMPLETED 状态下先进入 UNDER_REVIEW 再落定结论
     */
    public void review(ReviewOutcomeEnum outcome, String reviewer, String comment) {
        if (outcome == null) {
            throw new IllegalStateException("Review outcome cannot be null");
        }
        if (this.status == null || !this.status.isReviewable()) {
            throw new IllegalStateException("Job must be in COMPLETED or UNDER_REVIEW status to be reviewed, current: "
                    + this.status);
        }
        if (this.status == SopJobStatusEnum.COMPLETED) {
            transitTo(SopJobStatusEnum.UNDER_REVIEW);
        }
        transitTo(outcome.getTargetStatus());
        this.reviewedBy = reviewer;
        this.reviewedAt = this.updatedAt;
        this.reviewComment = comment;
    }

    /**
     * 逻辑归档，仅允许 APPROVED / REJECTED / FAILED
     */
    public void archive() {
        if (this.status != SopJobStatusEnum.APPROVED
                && this.status != SopJobStatusEnum.REJECTED
                && this.status != SopJobStatusEnum.FAILED) {
            throw new IllegalStateException("Only APPROVED, REJECTED or FAILED jobs can be archived, current: " + this.status);
        }
        if (isArchived()) {
            throw new IllegalStateException("Job is already archived");
        }
        this.archived = true;
        this.archivedAt = LocalDateTime.now();
        this.updatedAt = this.archivedAt;
    }

    public boolean isArchived() {
        return Boolean.TRUE.equals(this.archived);
    }

    public boolean isLeaseExpired(LocalDateTime now) {
        return this.status == SopJobStatusEnum.PROCESSING
                && this.leaseUntil != null
                && now != null
                && this.leaseUntil.isBefore(now);
    }

    public boolean includesFramework(RegulatoryFrameworkEnum framework) {
        return framework != null && regulatoryFrameworks != null && regulatoryFrameworks.contains(framework);
    }

    public String contentHash() {
        return content == null ? null : content.getContentHash();
    }

    private void transitTo(SopJobStatusEnum target) {
        if (this.status == null || !this.status.canTransitTo(target)) {
            throw new IllegalStateException("Illegal job status transition: " + this.status + " -> " + target);
        }
        this.status = target;
        this.updatedAt = LocalDateTime.now();
    }
}

package com.pharmasop.domain.audit.model.entity;

import com.pharmasop.types.enums.AuditActionEnum;
import com.pharmasop.types.enums.AuditReviewStatusEnum;
import com.pharmasop.types.enums.AuditSeverityEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 审计条目领域实体
 * <p>
 * 只追加，不修改业务内容；唯一允许的后续写入是一次性的复核信息。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Data
public class AuditEntryEntity {

    /**
     * 主键 ID，单调递增，决定同一作业内条目的先后顺序
     */
    private Long id;

    private String resourceType;

    private String resourceId;

    /**
     * 操作者
     */
    private String actor;

    private AuditActionEnum action;

    private AuditSeverityEnum severity;

    private String description;

    /**
     * 变更前的字段值
     */
    private Map<String, Object> oldValues = new LinkedHashMap<>();

    /**
     * 变更后的字段值
     */
    private Map<String, Object> newValues = new LinkedHashMap<>();

    private Map<String, Object> additionalData = new LinkedHashMap<>();

    private Boolean requiresReview;

    /**
     * 更正或确认时引用的原条目
     */
    private Long referenceEntryId;

    private String checksum;

    private String reviewedBy;

    private LocalDateTime reviewedAt;

    private AuditReviewStatusEnum reviewStatus;

    private String reviewComment;

    private LocalDateTime createdAt;

    public boolean isReviewRequired() {
        return Boolean.TRUE.equals(requiresReview);
    }

    public boolean isReviewed() {
        return reviewedAt != null;
    }

    /**
     * 记录复核信息，只能写入一次
     */
    public void acknowledge(String reviewer, AuditReviewStatusEnum status, String comment) {
        if (reviewer == null || reviewer.trim().isEmpty()) {
            throw new IllegalStateException("Reviewer cannot be empty");
        }
        if (isReviewed()) {
            throw new IllegalStateException("Audit entry " + id + " has already been reviewed");
        }
        this.reviewedBy = reviewer.trim();
        this.reviewStatus = status == null ? AuditReviewStatusEnum.ACKNOWLEDGED : status;
        this.reviewComment = comment;
        this.reviewedAt = LocalDateTime.now();
    }
}

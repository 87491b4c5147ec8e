package com.pharmasop.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 审计条目 PO（表 sop_audit_entry）
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntryPO {

    /**
     * 主键 ID (BIGSERIAL)
     */
    private Long id;

    private String resourceType;

    private String resourceId;

    private String actor;

    private String action;

    private String severity;

    private String description;

    /**
     * 变更前字段 (JSONB)
     */
    private String oldValues;

    /**
     * 变更后字段 (JSONB)
     */
    private String newValues;

    /**
     * 附加数据 (JSONB)
     */
    private String additionalData;

    private Boolean requiresReview;

    private Long referenceEntryId;

    private String checksum;

    private String reviewedBy;

    private LocalDateTime reviewedAt;

    private String reviewStatus;

    private String reviewComment;

    private LocalDateTime createdAt;
}

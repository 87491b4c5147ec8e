package com.pharmasop.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * SOP 生成作业 PO（表 sop_job）
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SopJobPO {

    /**
     * 作业 ID (UUID)
     */
    private String jobId;

    private String title;

    private String description;

    /**
     * 部门编码
     */
    private String department;

    /**
     * 优先级编码
     */
    private String priority;

    /**
     * 法规框架编码数组 (JSONB)
     */
    private String regulatoryFrameworks;

    /**
     * 请求章节 (JSONB)
     */
    private String sections;

    /**
     * 设备清单 (JSONB)
     */
    private String equipment;

    /**
     * 物料清单 (JSONB)
     */
    private String materials;

    private String safetyNotes;

    /**
     * 质量检查点 (JSONB)
     */
    private String qualityCheckpoints;

    private String customRequirements;

    private String requestedBy;

    private String status;

    /**
     * 内容快照 (JSONB)
     */
    private String contentSnapshot;

    /**
     * 合规校验结果 (JSONB)
     */
    private String validationResult;

    /**
     * 合规得分（冗余列，用于检索）
     */
    private Integer complianceScore;

    private String errorKind;

    private String errorDetail;

    private Integer generationAttempts;

    private LocalDateTime leaseUntil;

    private String reviewedBy;

    private LocalDateTime reviewedAt;

    private String reviewComment;

    private Boolean archived;

    private LocalDateTime archivedAt;

    private String sourceJobId;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime completedAt;
}

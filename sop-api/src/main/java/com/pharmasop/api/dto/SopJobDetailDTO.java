package com.pharmasop.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * SOP 生成作业详情 DTO。
 */
@Data
public class SopJobDetailDTO {

    private String jobId;
    private String title;
    private String description;
    private String department;
    private String priority;
    private List<String> regulatoryFrameworks;
    private List<SopSectionDTO> sections;
    private List<String> equipment;
    private List<String> materials;
    private String safetyNotes;
    private List<String> qualityCheckpoints;
    private String customRequirements;
    private String requestedBy;
    private String status;
    private ContentSnapshotDTO content;
    private ValidationResultDTO validation;
    private Integer complianceScore;
    private String errorKind;
    private String errorDetail;
    private Integer generationAttempts;
    private String reviewedBy;
    private LocalDateTime reviewedAt;
    private String reviewComment;
    private Boolean archived;
    private LocalDateTime archivedAt;
    private String sourceJobId;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;
}

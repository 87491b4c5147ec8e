package com.pharmasop.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 审计条目 DTO。
 */
@Data
public class AuditEntryDTO {

    private Long id;
    private String resourceType;
    private String resourceId;
    private String actor;
    private String action;
    private String severity;
    private String description;
    private Map<String, Object> oldValues;
    private Map<String, Object> newValues;
    private Map<String, Object> additionalData;
    private Boolean requiresReview;
    private Long referenceEntryId;
    private String checksum;
    private String reviewedBy;
    private LocalDateTime reviewedAt;
    private String reviewStatus;
    private String reviewComment;
    private LocalDateTime createdAt;
}

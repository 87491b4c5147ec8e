package com.pharmasop.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * SOP 生成作业列表项 DTO。
 */
@Data
public class SopJobSummaryDTO {

    private String jobId;
    private String title;
    private String department;
    private String priority;
    private List<String> regulatoryFrameworks;
    private String status;
    private Integer complianceScore;
    private String errorKind;
    private String requestedBy;
    private Boolean archived;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;
}

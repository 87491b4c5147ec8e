package com.pharmasop.api.dto;

import lombok.Data;

import java.util.List;

/**
 * SOP 生成作业提交请求 DTO。
 */
@Data
public class SopJobSubmitRequestDTO {

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
}

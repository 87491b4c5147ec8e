package com.pharmasop.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * SOP 生成作业提交结果 DTO。
 */
@Data
public class SopJobSubmitResultDTO {

    private String jobId;
    private String status;
    private LocalDateTime estimatedCompletion;
    private Integer estimatedCompletionMinutes;
}

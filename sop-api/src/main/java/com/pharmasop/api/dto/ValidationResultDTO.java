package com.pharmasop.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 合规校验结果 DTO。
 */
@Data
public class ValidationResultDTO {

    private Integer score;
    private List<ComplianceCheckDTO> checks;
    private Map<String, String> indicators;
    private List<String> issues;
    private LocalDateTime validatedAt;
}

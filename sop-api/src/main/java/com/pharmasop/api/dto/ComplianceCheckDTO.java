package com.pharmasop.api.dto;

import lombok.Data;

/**
 * 单项合规检查 DTO。
 */
@Data
public class ComplianceCheckDTO {

    private String dimension;
    private String name;
    private String outcome;
    private String message;
}

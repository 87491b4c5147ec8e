package com.pharmasop.api.dto;

import lombok.Data;

/**
 * 审计条目确认请求 DTO，status 取值 acknowledged / escalated。
 */
@Data
public class AuditEntryAcknowledgeRequestDTO {

    private String reviewer;
    private String status;
    private String comment;
}

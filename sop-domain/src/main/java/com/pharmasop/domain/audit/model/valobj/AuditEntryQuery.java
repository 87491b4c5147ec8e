package com.pharmasop.domain.audit.model.valobj;

import com.pharmasop.types.enums.AuditActionEnum;
import com.pharmasop.types.enums.AuditSeverityEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 审计导出查询条件，结果按条目 ID 升序。
 */
@Data
public class AuditEntryQuery {

    private String resourceType;
    private String resourceId;
    private String actor;
    private AuditActionEnum action;
    private AuditSeverityEnum severity;
    private LocalDateTime from;
    private LocalDateTime to;
    private Boolean requiresReview;

    /**
     * 仅返回需要复核且尚未复核的条目
     */
    private Boolean pendingReview;

    private int limit = 200;
    private int offset = 0;
}

package com.pharmasop.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 审计条目检索条件 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntryQueryPO {

    private String resourceType;
    private String resourceId;
    private String actor;
    private String action;
    private String severity;
    private LocalDateTime from;
    private LocalDateTime to;
    private Boolean requiresReview;
    private Boolean pendingReview;
    private Integer offset;
    private Integer limit;
}

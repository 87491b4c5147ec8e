package com.pharmasop.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * SOP 作业检索条件 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SopJobQueryPO {

    private String status;
    private String department;
    private String priority;

    /**
     * 单元素 JSON 数组，用于 jsonb 包含查询
     */
    private String frameworkJson;

    private String requestedBy;
    private LocalDateTime createdFrom;
    private LocalDateTime createdTo;
    private Integer minScore;
    private Boolean includeArchived;
    private Integer offset;
    private Integer limit;
}

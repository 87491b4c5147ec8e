package com.pharmasop.domain.sop.model.valobj;

import com.pharmasop.types.enums.PharmaDepartmentEnum;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import com.pharmasop.types.enums.SopJobStatusEnum;
import com.pharmasop.types.enums.SopPriorityEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 作业检索条件值对象，page 从 1 开始。
 */
@Data
public class SopJobSearchCriteria {

    private SopJobStatusEnum status;
    private PharmaDepartmentEnum department;
    private SopPriorityEnum priority;
    private RegulatoryFrameworkEnum framework;
    private String requestedBy;
    private LocalDateTime createdFrom;
    private LocalDateTime createdTo;
    private Integer minScore;
    private Boolean includeArchived;
    private int page = 1;
    private int size = 20;

    public int offset() {
        return Math.max(page - 1, 0) * size;
    }
}

package com.pharmasop.domain.sop.model.valobj;

import com.pharmasop.types.enums.PharmaDepartmentEnum;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import com.pharmasop.types.enums.SopPriorityEnum;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 生成引擎调用请求值对象。
 * <p>
 * deadline 为本次尝试的截止时间，适配器应据此设置出站调用超时。
 * </p>
 */
@Data
public class GenerationRequest {

    private String jobId;
    private int attempt;
    private String title;
    private String description;
    private PharmaDepartmentEnum department;
    private SopPriorityEnum priority;
    private List<SopSectionSpec> sections = new ArrayList<>();
    private List<RegulatoryFrameworkEnum> frameworks = new ArrayList<>();
    private List<String> equipment = new ArrayList<>();
    private List<String> materials = new ArrayList<>();
    private String safetyNotes;
    private List<String> qualityCheckpoints = new ArrayList<>();
    private String customRequirements;
    private Instant deadline;

    public long remainingMillis() {
        if (deadline == null) {
            return Long.MAX_VALUE;
        }
        return Math.max(0L, deadline.toEpochMilli() - System.currentTimeMillis());
    }
}

package com.pharmasop.domain.sop.model.valobj;

import com.pharmasop.types.enums.PharmaDepartmentEnum;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import com.pharmasop.types.enums.SopPriorityEnum;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 作业提交命令值对象：HTTP 层完成类型转换后的强类型描述。
 */
@Data
public class SopJobSubmitCommand {

    private String title;
    private String description;
    private PharmaDepartmentEnum department;
    private SopPriorityEnum priority;
    private List<RegulatoryFrameworkEnum> regulatoryFrameworks = new ArrayList<>();
    private List<SopSectionSpec> sections = new ArrayList<>();
    private List<String> equipment = new ArrayList<>();
    private List<String> materials = new ArrayList<>();
    private String safetyNotes;
    private List<String> qualityCheckpoints = new ArrayList<>();
    private String customRequirements;
    private String requestedBy;
}

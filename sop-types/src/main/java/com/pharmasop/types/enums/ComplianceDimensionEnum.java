package com.pharmasop.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 合规维度枚举，每个维度对应一项固定的合规检查，声明顺序即检查顺序。
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public enum ComplianceDimensionEnum {

    REQUIRED_FIELDS_PRESENT("required-fields-present", "Basic Information"),

    FRAMEWORK_SELECTED("framework-selected", "Regulatory Framework"),

    SECTION_COMPLETENESS("section-completeness", "SOP Sections"),

    SAFETY_DOCUMENTED("safety-documented", "Safety Considerations"),

    QUALITY_CHECKPOINTS_DEFINED("quality-checkpoints-defined", "Quality Checkpoints"),

    EQUIPMENT_DEFINED("equipment-defined", "Equipment Requirements"),

    MANDATORY_FRAMEWORK_PRESENT("mandatory-framework-present", "Pharmaceutical Compliance");

    private final String code;

    /**
     * 检查项展示名称
     */
    private final String checkName;

    ComplianceDimensionEnum(String code, String checkName) {
        this.code = code;
        this.checkName = checkName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getCheckName() {
        return checkName;
    }

    public static ComplianceDimensionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ComplianceDimensionEnum dimension : ComplianceDimensionEnum.values()) {
            if (dimension.code.equals(code)) {
                return dimension;
            }
        }
        throw new IllegalArgumentException("Unknown compliance dimension code: " + code);
    }
}

package com.pharmasop.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 制药部门枚举
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public enum PharmaDepartmentEnum {

    PRODUCTION("production", "Production"),

    QUALITY_CONTROL("quality_control", "Quality Control"),

    QUALITY_ASSURANCE("quality_assurance", "Quality Assurance"),

    REGULATORY_AFFAIRS("regulatory_affairs", "Regulatory Affairs"),

    MANUFACTURING("manufacturing", "Manufacturing"),

    PACKAGING("packaging", "Packaging"),

    WAREHOUSE("warehouse", "Warehouse"),

    MAINTENANCE("maintenance", "Maintenance");

    private final String code;
    private final String label;

    PharmaDepartmentEnum(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public static PharmaDepartmentEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (PharmaDepartmentEnum department : PharmaDepartmentEnum.values()) {
            if (department.code.equalsIgnoreCase(code)) {
                return department;
            }
        }
        throw new IllegalArgumentException("Unknown pharma department code: " + code);
    }
}

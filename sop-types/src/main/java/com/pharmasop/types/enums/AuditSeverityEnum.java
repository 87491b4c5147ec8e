package com.pharmasop.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 审计严重级别枚举
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public enum AuditSeverityEnum {

    LOW("LOW"),

    MEDIUM("MEDIUM"),

    HIGH("HIGH"),

    CRITICAL("CRITICAL");

    private final String code;

    AuditSeverityEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static AuditSeverityEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AuditSeverityEnum severity : AuditSeverityEnum.values()) {
            if (severity.code.equalsIgnoreCase(code)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown audit severity code: " + code);
    }
}

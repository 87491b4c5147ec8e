package com.pharmasop.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 审计条目复核状态枚举
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public enum AuditReviewStatusEnum {

    ACKNOWLEDGED("acknowledged"),

    ESCALATED("escalated");

    private final String code;

    AuditReviewStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static AuditReviewStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AuditReviewStatusEnum status : AuditReviewStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown audit review status code: " + code);
    }
}

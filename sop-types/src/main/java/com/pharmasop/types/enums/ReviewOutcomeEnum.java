package com.pharmasop.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 人工审核结果枚举
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public enum ReviewOutcomeEnum {

    APPROVE("approve", SopJobStatusEnum.APPROVED, AuditActionEnum.APPROVE),

    REJECT("reject", SopJobStatusEnum.REJECTED, AuditActionEnum.REJECT);

    private final String code;
    private final SopJobStatusEnum targetStatus;
    private final AuditActionEnum auditAction;

    ReviewOutcomeEnum(String code, SopJobStatusEnum targetStatus, AuditActionEnum auditAction) {
        this.code = code;
        this.targetStatus = targetStatus;
        this.auditAction = auditAction;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public SopJobStatusEnum getTargetStatus() {
        return targetStatus;
    }

    public AuditActionEnum getAuditAction() {
        return auditAction;
    }

    public static ReviewOutcomeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ReviewOutcomeEnum outcome : ReviewOutcomeEnum.values()) {
            if (outcome.code.equalsIgnoreCase(code)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown review outcome code: " + code);
    }
}

package com.pharmasop.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 审计动作枚举
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public enum AuditActionEnum {

    /**
     * 作业受理
     */
    CREATE("CREATE"),

    /**
     * PENDING → PROCESSING
     */
    START_PROCESSING("START_PROCESSING"),

    /**
     * 单次生成尝试失败
     */
    GENERATION_ATTEMPT_FAILED("GENERATION_ATTEMPT_FAILED"),

    /**
     * 合规校验完成
     */
    VALIDATE("VALIDATE"),

    /**
     * PROCESSING → COMPLETED
     */
    COMPLETE("COMPLETE"),

    /**
     * PROCESSING → FAILED
     */
    FAIL("FAIL"),

    BEGIN_REVIEW("BEGIN_REVIEW"),

    APPROVE("APPROVE"),

    REJECT("REJECT"),

    CANCEL("CANCEL"),

    RESUBMIT("RESUBMIT"),

    ARCHIVE("ARCHIVE"),

    EXPORT("EXPORT"),

    /**
     * 审计条目人工确认
     */
    ACKNOWLEDGE("ACKNOWLEDGE");

    private final String code;

    AuditActionEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 审批类动作固定需要人工复核。
     */
    public boolean isApprovalAction() {
        return this == APPROVE || this == REJECT;
    }

    public static AuditActionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AuditActionEnum action : AuditActionEnum.values()) {
            if (action.code.equalsIgnoreCase(code)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown audit action code: " + code);
    }
}

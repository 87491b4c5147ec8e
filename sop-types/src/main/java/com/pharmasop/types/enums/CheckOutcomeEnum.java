package com.pharmasop.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 合规检查结果枚举
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public enum CheckOutcomeEnum {

    PASS("pass", 0),

    WARNING("warning", 5),

    FAIL("fail", 25);

    private final String code;

    /**
     * 该结果在合规得分中的扣分值
     */
    private final int penalty;

    CheckOutcomeEnum(String code, int penalty) {
        this.code = code;
        this.penalty = penalty;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getPenalty() {
        return penalty;
    }

    public static CheckOutcomeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (CheckOutcomeEnum outcome : CheckOutcomeEnum.values()) {
            if (outcome.code.equals(code)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown check outcome code: " + code);
    }
}

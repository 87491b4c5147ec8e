package com.pharmasop.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * SOP 作业优先级枚举
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public enum SopPriorityEnum {

    LOW("low"),

    MEDIUM("medium"),

    HIGH("high"),

    CRITICAL("critical");

    private final String code;

    SopPriorityEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static SopPriorityEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SopPriorityEnum priority : SopPriorityEnum.values()) {
            if (priority.code.equalsIgnoreCase(code)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown sop priority code: " + code);
    }
}

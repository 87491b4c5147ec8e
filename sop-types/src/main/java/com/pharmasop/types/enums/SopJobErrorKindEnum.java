package com.pharmasop.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * SOP 作业失败原因枚举（机器可读的错误类型）
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public enum SopJobErrorKindEnum {

    /**
     * 引擎不可达（连接失败），可重试
     */
    ENGINE_UNAVAILABLE("EngineUnavailable", true),

    /**
     * 单次调用超过截止时间，可重试
     */
    ENGINE_TIMEOUT("EngineTimeout", true),

    /**
     * 引擎拒绝请求（输入不合法），不可重试
     */
    ENGINE_REJECTED("EngineRejected", false),

    /**
     * 用户取消
     */
    CANCELLED("Cancelled", false),

    /**
     * 处理租约过期，执行者丢失
     */
    INTERRUPTED("Interrupted", false),

    STORAGE_ERROR("StorageError", false);

    private final String code;
    private final boolean retryable;

    SopJobErrorKindEnum(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static SopJobErrorKindEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SopJobErrorKindEnum kind : SopJobErrorKindEnum.values()) {
            if (kind.code.equals(code) || kind.name().equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown sop job error kind code: " + code);
    }
}

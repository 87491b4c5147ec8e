package com.pharmasop.domain.sop.adapter.gateway;

import com.pharmasop.types.enums.SopJobErrorKindEnum;

/**
 * 生成引擎调用失败。
 * <p>
 * 只在编排器内部流转，由重试逻辑吸收或转为作业 FAILED，不会穿过提交/查询接口。
 * </p>
 */
public class ContentGenerationException extends Exception {

    private static final long serialVersionUID = -2630174937186503817L;

    private final SopJobErrorKindEnum kind;

    public ContentGenerationException(SopJobErrorKindEnum kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ContentGenerationException(SopJobErrorKindEnum kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ContentGenerationException unavailable(String message, Throwable cause) {
        return new ContentGenerationException(SopJobErrorKindEnum.ENGINE_UNAVAILABLE, message, cause);
    }

    public static ContentGenerationException timeout(String message) {
        return new ContentGenerationException(SopJobErrorKindEnum.ENGINE_TIMEOUT, message);
    }

    public static ContentGenerationException rejected(String message, Throwable cause) {
        return new ContentGenerationException(SopJobErrorKindEnum.ENGINE_REJECTED, message, cause);
    }

    public SopJobErrorKindEnum getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind != null && kind.isRetryable();
    }
}

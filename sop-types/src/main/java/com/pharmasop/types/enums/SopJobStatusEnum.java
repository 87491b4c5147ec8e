package com.pharmasop.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * SOP 生成作业状态枚举
 * <p>
 * 合法迁移：PENDING → PROCESSING → {COMPLETED | FAILED}；
 * COMPLETED → UNDER_REVIEW → {APPROVED | REJECTED}。任何迁移都不能重新进入 PENDING。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public enum SopJobStatusEnum {

    /**
     * 待处理 - 已受理，等待调度
     */
    PENDING("PENDING"),

    /**
     * 处理中 - 正在调用生成引擎
     */
    PROCESSING("PROCESSING"),

    /**
     * 已完成 - 内容已生成并完成合规校验
     */
    COMPLETED("COMPLETED"),

    /**
     * 失败 - 生成失败或被取消
     */
    FAILED("FAILED"),

    /**
     * 审核中 - 人工审核进行中
     */
    UNDER_REVIEW("UNDER_REVIEW"),

    /**
     * 已批准
     */
    APPROVED("APPROVED"),

    /**
     * 已驳回
     */
    REJECTED("REJECTED");

    private final String code;

    SopJobStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 是否为可审核状态（COMPLETED 或 UNDER_REVIEW）。
     */
    public boolean isReviewable() {
        return this == COMPLETED || this == UNDER_REVIEW;
    }

    /**
     * 是否已结束处理流程（不再被调度器推进）。
     */
    public boolean isFinished() {
        return this == COMPLETED || this == FAILED || this == APPROVED || this == REJECTED;
    }

    /**
     * 校验状态机是否允许从当前状态迁移到目标状态。
     */
    public boolean canTransitTo(SopJobStatusEnum target) {
        if (target == null) {
            return false;
        }
        switch (this) {
            case PENDING:
                return target == PROCESSING;
            case PROCESSING:
                return target == COMPLETED || target == FAILED;
            case COMPLETED:
                return target == UNDER_REVIEW;
            case UNDER_REVIEW:
                return target == APPROVED || target == REJECTED;
            default:
                return false;
        }
    }

    public static SopJobStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SopJobStatusEnum status : SopJobStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown sop job status code: " + code);
    }
}

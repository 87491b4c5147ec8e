package com.pharmasop.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义 API 响应码：ILLEGAL_PARAMETER 对应请求形状校验失败（InvalidRequest），
 * INVALID_TRANSITION 对应非法状态迁移，STORAGE_ERROR 对应作业存储不可用。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 资源不存在 */
    NOT_FOUND("0003", "资源不存在"),

    /** 非法状态迁移 */
    INVALID_TRANSITION("0004", "非法状态迁移"),

    /** 存储失败 */
    STORAGE_ERROR("0005", "存储失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}

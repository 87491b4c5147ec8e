package com.pharmasop.types.exception;

import com.pharmasop.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 统一承载 SOP 作业流水线中的业务异常，包含响应码和异常描述信息。
 * 请求校验失败、作业不存在、非法状态迁移以及存储失败均通过此类抛出，
 * 由 HTTP 层统一转换为响应码。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 3816905526401273914L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    /**
     * 创建包含异常码的 AppException。
     *
     * @param code 异常码
     */
    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    /**
     * 创建包含异常码和描述信息的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     */
    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * 创建包含异常码、描述信息和原因的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    public static AppException invalidRequest(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), message);
    }

    public static AppException notFound(String message) {
        return new AppException(ResponseCode.NOT_FOUND.getCode(), message);
    }

    public static AppException invalidTransition(String message) {
        return new AppException(ResponseCode.INVALID_TRANSITION.getCode(), message);
    }

    public static AppException storageError(String message, Throwable cause) {
        return new AppException(ResponseCode.STORAGE_ERROR.getCode(), message, cause);
    }

    public boolean hasCode(ResponseCode responseCode) {
        return responseCode != null && responseCode.getCode().equals(this.code);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "com.pharmasop.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}

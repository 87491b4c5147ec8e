package com.pharmasop.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果封装类。
 * <p>
 * 所有 SOP 作业接口的返回都使用该信封，响应码见 ResponseCode。
 * </p>
 *
 * @param <T> 响应数据的类型
 * @author pharmasop
 * @since 2026-10-01
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 4410271187338216490L;

    /** 响应码，成功为"0000" */
    private String code;

    /** 响应描述信息 */
    private String info;

    /** 响应数据 */
    private T data;

}

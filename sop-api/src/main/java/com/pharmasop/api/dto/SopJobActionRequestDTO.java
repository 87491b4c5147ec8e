package com.pharmasop.api.dto;

import lombok.Data;

/**
 * 作业操作请求 DTO（开始审核、取消、重新提交、归档）。
 */
@Data
public class SopJobActionRequestDTO {

    private String actor;
    private String reason;
}

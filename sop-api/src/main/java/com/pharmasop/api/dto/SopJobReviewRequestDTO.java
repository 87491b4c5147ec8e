package com.pharmasop.api.dto;

import lombok.Data;

/**
 * 人工审核请求 DTO，outcome 取值 approve / reject。
 */
@Data
public class SopJobReviewRequestDTO {

    private String outcome;
    private String reviewer;
    private String comment;
}

package com.pharmasop.api.dto;

import lombok.Data;

import java.util.List;

/**
 * SOP 生成作业分页结果 DTO。
 */
@Data
public class SopJobPageDTO {

    private List<SopJobSummaryDTO> items;
    private Long total;
    private Integer page;
    private Integer size;
}

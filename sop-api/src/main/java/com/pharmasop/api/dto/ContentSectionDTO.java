package com.pharmasop.api.dto;

import lombok.Data;

/**
 * 生成内容章节 DTO。
 */
@Data
public class ContentSectionDTO {

    private String title;
    private String body;
    private Boolean placeholder;
}

package com.pharmasop.api.dto;

import lombok.Data;

/**
 * SOP 章节描述 DTO。
 */
@Data
public class SopSectionDTO {

    private String title;
    private String description;
}

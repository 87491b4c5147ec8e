package com.pharmasop.domain.sop.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 请求的 SOP 章节描述值对象，标题在同一作业内唯一。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SopSectionSpec {

    private String title;
    private String description;
}

package com.pharmasop.domain.sop.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 生成内容章节值对象。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContentSection {

    private String title;
    private String body;

    /**
     * 引擎未返回该章节时由适配器补齐的占位正文
     */
    private boolean placeholder;
}

package com.pharmasop.domain.sop.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 渲染后的文档产物，对调用方不透明。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RenderedDocument {

    private String fileName;
    private String mediaType;
    private String content;
}

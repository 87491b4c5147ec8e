package com.pharmasop.domain.sop.adapter.gateway;

import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.RenderedDocument;

/**
 * 文档渲染端口：消费已定稿的快照和作业元数据，产出不透明的文档。
 */
public interface ISopDocumentRenderer {

    RenderedDocument render(SopJobEntity job);
}

package com.pharmasop.domain.sop.adapter.gateway;

import com.pharmasop.domain.sop.model.valobj.ContentSnapshot;
import com.pharmasop.domain.sop.model.valobj.GenerationRequest;

/**
 * 内容生成引擎端口：把作业的章节/法规描述翻译为一次外部调用。
 * <p>
 * 实现不得写作业存储或审计记录，持久化全部由编排器负责。
 * </p>
 */
public interface ISopContentGenerator {

    /**
     * 生成内容快照。引擎少返回的章节须以占位正文补齐，不能丢弃。
     *
     * @param request 生成请求（含截止时间）
     * @return 每个请求章节各一段正文的快照
     * @throws ContentGenerationException 引擎不可用、超时或拒绝
     */
    ContentSnapshot generate(GenerationRequest request) throws ContentGenerationException;

    /**
     * 引擎标识，记录在快照上。
     */
    String engineId();
}

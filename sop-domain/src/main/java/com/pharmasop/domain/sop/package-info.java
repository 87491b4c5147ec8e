/**
 * SOP 领域 - SOP 生成作业域
 *
 * <p>职责：作业受理校验、状态机迁移、生成内容快照、合规校验</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>作业：一次 SOP 生成请求及其生命周期</li>
 *   <li>内容快照：生成引擎产出的完整文档正文，重新生成时整体替换</li>
 *   <li>合规校验结果：针对单个快照的得分与问题列表，只作提示，不阻断完成</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.pharmasop.domain.sop.model.entity.SopJobEntity}</li>
 * </ul>
 *
 * <h3>端口</h3>
 * <ul>
 *   <li>ISopJobRepository - 作业存储</li>
 *   <li>ISopContentGenerator - 外部生成引擎</li>
 *   <li>ISopDocumentRenderer - 文档渲染</li>
 * </ul>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
package com.pharmasop.domain.sop;

/**
 * Audit 领域 - 审计追踪域
 *
 * <p>职责：为每一次改变作业状态的动作生成不可变的审计条目</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>只追加：条目一旦写入不再修改或删除，更正以引用原条目的新条目表示</li>
 *   <li>复核：requiresReview 的条目进入人工复核队列，复核信息只能写入一次</li>
 *   <li>校验和：对操作者、动作、资源、时间与描述计算 SHA-256，用于完整性核验</li>
 * </ul>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
package com.pharmasop.domain.audit;

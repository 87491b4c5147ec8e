package com.pharmasop.domain.audit.adapter.repository;

import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import com.pharmasop.domain.audit.model.valobj.AuditEntryQuery;

import java.util.List;

/**
 * 审计条目仓储接口（Audit Recorder 存储）。不提供删除与业务内容更新。
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public interface IAuditEntryRepository {

    /**
     * 追加条目，回填 ID
     */
    AuditEntryEntity append(AuditEntryEntity entity);

    AuditEntryEntity findById(Long id);

    /**
     * 查询资源的全部条目，按 ID 升序
     */
    List<AuditEntryEntity> findByResource(String resourceType, String resourceId);

    List<AuditEntryEntity> query(AuditEntryQuery query);

    long count(AuditEntryQuery query);

    /**
     * 写入复核信息；仅当条目尚未复核时成功
     */
    boolean markReviewed(AuditEntryEntity entity);
}

package com.pharmasop.infrastructure.dao;

import com.pharmasop.infrastructure.dao.po.AuditEntryPO;
import com.pharmasop.infrastructure.dao.po.AuditEntryQueryPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 审计条目 DAO（只追加）
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Mapper
public interface AuditEntryDao {

    /**
     * 插入条目，回填自增 ID
     */
    int insert(AuditEntryPO po);

    AuditEntryPO selectById(@Param("id") Long id);

    List<AuditEntryPO> selectByResource(@Param("resourceType") String resourceType,
                                        @Param("resourceId") String resourceId);

    List<AuditEntryPO> selectByQuery(@Param("query") AuditEntryQueryPO query);

    long countByQuery(@Param("query") AuditEntryQueryPO query);

    /**
     * 写入复核信息，仅更新尚未复核的条目
     */
    int updateReviewIfAbsent(AuditEntryPO po);
}

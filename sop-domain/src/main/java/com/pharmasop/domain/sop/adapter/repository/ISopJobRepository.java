package com.pharmasop.domain.sop.adapter.repository;

import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.SopJobSearchCriteria;
import com.pharmasop.types.enums.SopJobStatusEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * SOP 作业仓储接口（Job Store）
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public interface ISopJobRepository {

    /**
     * 保存作业
     */
    SopJobEntity save(SopJobEntity entity);

    /**
     * 更新作业 (带乐观锁)，版本冲突时抛出异常
     */
    SopJobEntity update(SopJobEntity entity);

    /**
     * 根据作业 ID 查询，不存在返回 null
     */
    SopJobEntity findByJobId(String jobId);

    /**
     * 按状态查询，按创建时间升序
     */
    List<SopJobEntity> findByStatus(SopJobStatusEnum status, int limit);

    /**
     * 查询租约已过期的 PROCESSING 作业
     */
    List<SopJobEntity> findExpiredProcessing(LocalDateTime now, int limit);

    /**
     * 条件检索，按创建时间倒序
     */
    List<SopJobEntity> search(SopJobSearchCriteria criteria);

    /**
     * 条件计数
     */
    long count(SopJobSearchCriteria criteria);
}

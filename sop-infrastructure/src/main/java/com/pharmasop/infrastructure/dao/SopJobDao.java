package com.pharmasop.infrastructure.dao;

import com.pharmasop.infrastructure.dao.po.SopJobPO;
import com.pharmasop.infrastructure.dao.po.SopJobQueryPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * SOP 生成作业 DAO
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Mapper
public interface SopJobDao {

    /**
     * 插入作业
     */
    int insert(SopJobPO po);

    /**
     * 根据作业 ID 更新 (带乐观锁)
     */
    int updateWithVersion(SopJobPO po);

    /**
     * 根据作业 ID 查询
     */
    SopJobPO selectByJobId(@Param("jobId") String jobId);

    /**
     * 按状态查询，创建时间升序
     */
    List<SopJobPO> selectByStatus(@Param("status") String status, @Param("limit") Integer limit);

    /**
     * 查询租约过期的 PROCESSING 作业
     */
    List<SopJobPO> selectExpiredProcessing(@Param("now") LocalDateTime now, @Param("limit") Integer limit);

    /**
     * 条件分页查询
     */
    List<SopJobPO> selectByQuery(@Param("query") SopJobQueryPO query);

    /**
     * 条件计数
     */
    long countByQuery(@Param("query") SopJobQueryPO query);
}

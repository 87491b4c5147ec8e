package com.pharmasop.infrastructure.repository.sop;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pharmasop.domain.sop.adapter.repository.ISopJobRepository;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.ContentSnapshot;
import com.pharmasop.domain.sop.model.valobj.SopJobSearchCriteria;
import com.pharmasop.domain.sop.model.valobj.SopSectionSpec;
import com.pharmasop.domain.sop.model.valobj.ValidationResult;
import com.pharmasop.infrastructure.dao.SopJobDao;
import com.pharmasop.infrastructure.dao.po.SopJobPO;
import com.pharmasop.infrastructure.dao.po.SopJobQueryPO;
import com.pharmasop.infrastructure.util.JsonCodec;
import com.pharmasop.types.enums.PharmaDepartmentEnum;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import com.pharmasop.types.enums.SopJobErrorKindEnum;
import com.pharmasop.types.enums.SopJobStatusEnum;
import com.pharmasop.types.enums.SopPriorityEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SOP 作业仓储实现类。
 * <p>
 * 负责作业的持久化操作，包括：
 * <ul>
 *   <li>插入与带乐观锁的更新</li>
 *   <li>按状态、租约、组合条件检索</li>
 *   <li>JSONB 字段（章节、清单、内容快照、校验结果）的序列化/反序列化</li>
 * </ul>
 * 每次读取都返回新的实体实例，调用方拿到的是时间点快照。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Slf4j
@Repository
public class SopJobRepositoryImpl implements ISopJobRepository {

    private static final TypeReference<List<SopSectionSpec>> SECTION_LIST_REF = new TypeReference<List<SopSectionSpec>>() {};

    private final SopJobDao sopJobDao;
    private final JsonCodec jsonCodec;

    public SopJobRepositoryImpl(SopJobDao sopJobDao, JsonCodec jsonCodec) {
        this.sopJobDao = sopJobDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public SopJobEntity save(SopJobEntity entity) {
        entity.validate();
        if (entity.getVersion() == null) {
            entity.setVersion(0);
        }
        SopJobPO po = toPO(entity);
        sopJobDao.insert(po);
        return toEntity(po);
    }

    @Override
    public SopJobEntity update(SopJobEntity entity) {
        entity.validate();
        Integer oldVersion = entity.getVersion();
        if (oldVersion == null) {
            throw new IllegalStateException("Version cannot be null for SopJob update: " + entity.getJobId());
        }
        SopJobPO po = toPO(entity);
        int affected = sopJobDao.updateWithVersion(po);
        if (affected == 0) {
            throw new IllegalStateException("Optimistic lock failed for SopJob: " + entity.getJobId());
        }
        Integer newVersion = oldVersion + 1;
        entity.setVersion(newVersion);
        po.setVersion(newVersion);
        return toEntity(po);
    }

    @Override
    public SopJobEntity findByJobId(String jobId) {
        SopJobPO po = sopJobDao.selectByJobId(jobId);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<SopJobEntity> findByStatus(SopJobStatusEnum status, int limit) {
        if (status == null || limit <= 0) {
            return Collections.emptyList();
        }
        return sopJobDao.selectByStatus(status.getCode(), limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<SopJobEntity> findExpiredProcessing(LocalDateTime now, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return sopJobDao.selectExpiredProcessing(now == null ? LocalDateTime.now() : now, limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<SopJobEntity> search(SopJobSearchCriteria criteria) {
        return sopJobDao.selectByQuery(toQueryPO(criteria)).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public long count(SopJobSearchCriteria criteria) {
        return sopJobDao.countByQuery(toQueryPO(criteria));
    }

    private SopJobQueryPO toQueryPO(SopJobSearchCriteria criteria) {
        SopJobSearchCriteria source = criteria == null ? new SopJobSearchCriteria() : criteria;
        List<String> frameworkFilter = source.getFramework() == null ? null
                : Collections.singletonList(source.getFramework().getCode());
        return SopJobQueryPO.builder()
                .status(source.getStatus() == null ? null : source.getStatus().getCode())
                .department(source.getDepartment() == null ? null : source.getDepartment().getCode())
                .priority(source.getPriority() == null ? null : source.getPriority().getCode())
                .frameworkJson(frameworkFilter == null ? null : jsonCodec.writeValue(frameworkFilter))
                .requestedBy(source.getRequestedBy())
                .createdFrom(source.getCreatedFrom())
                .createdTo(source.getCreatedTo())
                .minScore(source.getMinScore())
                .includeArchived(Boolean.TRUE.equals(source.getIncludeArchived()))
                .offset(source.offset())
                .limit(source.getSize())
                .build();
    }

    /**
     * PO 转换为 Entity
     */
    private SopJobEntity toEntity(SopJobPO po) {
        if (po == null) {
            return null;
        }
        SopJobEntity entity = new SopJobEntity();
        entity.setJobId(po.getJobId());
        entity.setTitle(po.getTitle());
        entity.setDescription(po.getDescription());
        entity.setDepartment(PharmaDepartmentEnum.fromCode(po.getDepartment()));
        entity.setPriority(SopPriorityEnum.fromCode(po.getPriority()));

        // JSONB 字段转换
        List<String> frameworkCodes = jsonCodec.readStringList(po.getRegulatoryFrameworks());
        List<RegulatoryFrameworkEnum> frameworks = new ArrayList<>();
        if (frameworkCodes != null) {
            for (String code : frameworkCodes) {
                frameworks.add(RegulatoryFrameworkEnum.fromCode(code));
            }
        }
        entity.setRegulatoryFrameworks(frameworks);
        entity.setSections(defaultList(jsonCodec.readValue(po.getSections(), SECTION_LIST_REF)));
        entity.setEquipment(defaultList(jsonCodec.readStringList(po.getEquipment())));
        entity.setMaterials(defaultList(jsonCodec.readStringList(po.getMaterials())));
        entity.setQualityCheckpoints(defaultList(jsonCodec.readStringList(po.getQualityCheckpoints())));
        entity.setContent(jsonCodec.readValue(po.getContentSnapshot(), ContentSnapshot.class));
        entity.setValidation(jsonCodec.readValue(po.getValidationResult(), ValidationResult.class));

        entity.setSafetyNotes(po.getSafetyNotes());
        entity.setCustomRequirements(po.getCustomRequirements());
        entity.setRequestedBy(po.getRequestedBy());
        entity.setStatus(SopJobStatusEnum.fromCode(po.getStatus()));
        entity.setErrorKind(SopJobErrorKindEnum.fromCode(po.getErrorKind()));
        entity.setErrorDetail(po.getErrorDetail());
        entity.setGenerationAttempts(po.getGenerationAttempts());
        entity.setLeaseUntil(po.getLeaseUntil());
        entity.setReviewedBy(po.getReviewedBy());
        entity.setReviewedAt(po.getReviewedAt());
        entity.setReviewComment(po.getReviewComment());
        entity.setArchived(po.getArchived());
        entity.setArchivedAt(po.getArchivedAt());
        entity.setSourceJobId(po.getSourceJobId());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        entity.setCompletedAt(po.getCompletedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private SopJobPO toPO(SopJobEntity entity) {
        if (entity == null) {
            return null;
        }
        List<String> frameworkCodes = entity.getRegulatoryFrameworks() == null ? new ArrayList<>()
                : entity.getRegulatoryFrameworks().stream()
                .map(RegulatoryFrameworkEnum::getCode)
                .collect(Collectors.toList());
        return SopJobPO.builder()
                .jobId(entity.getJobId())
                .title(entity.getTitle())
                .description(entity.getDescription())
                .department(entity.getDepartment() == null ? null : entity.getDepartment().getCode())
                .priority(entity.getPriority() == null ? null : entity.getPriority().getCode())
                .regulatoryFrameworks(jsonCodec.writeValue(frameworkCodes))
                .sections(jsonCodec.writeValue(defaultList(entity.getSections())))
                .equipment(jsonCodec.writeValue(defaultList(entity.getEquipment())))
                .materials(jsonCodec.writeValue(defaultList(entity.getMaterials())))
                .safetyNotes(entity.getSafetyNotes())
                .qualityCheckpoints(jsonCodec.writeValue(defaultList(entity.getQualityCheckpoints())))
                .customRequirements(entity.getCustomRequirements())
                .requestedBy(entity.getRequestedBy())
                .status(entity.getStatus() == null ? null : entity.getStatus().getCode())
                .contentSnapshot(jsonCodec.writeValue(entity.getContent()))
                .validationResult(jsonCodec.writeValue(entity.getValidation()))
                .complianceScore(entity.getValidation() == null ? null : entity.getValidation().getScore())
                .errorKind(entity.getErrorKind() == null ? null : entity.getErrorKind().getCode())
                .errorDetail(entity.getErrorDetail())
                .generationAttempts(entity.getGenerationAttempts())
                .leaseUntil(entity.getLeaseUntil())
                .reviewedBy(entity.getReviewedBy())
                .reviewedAt(entity.getReviewedAt())
                .reviewComment(entity.getReviewComment())
                .archived(entity.isArchived())
                .archivedAt(entity.getArchivedAt())
                .sourceJobId(entity.getSourceJobId())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .completedAt(entity.getCompletedAt())
                .build();
    }

    private <T> List<T> defaultList(List<T> values) {
        return values == null ? new ArrayList<>() : values;
    }
}

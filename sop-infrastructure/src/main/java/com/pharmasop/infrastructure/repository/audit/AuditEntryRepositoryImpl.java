package com.pharmasop.infrastructure.repository.audit;

import com.pharmasop.domain.audit.adapter.repository.IAuditEntryRepository;
import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import com.pharmasop.domain.audit.model.valobj.AuditEntryQuery;
import com.pharmasop.infrastructure.dao.AuditEntryDao;
import com.pharmasop.infrastructure.dao.po.AuditEntryPO;
import com.pharmasop.infrastructure.dao.po.AuditEntryQueryPO;
import com.pharmasop.infrastructure.util.JsonCodec;
import com.pharmasop.types.enums.AuditActionEnum;
import com.pharmasop.types.enums.AuditReviewStatusEnum;
import com.pharmasop.types.enums.AuditSeverityEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 审计条目仓储实现类，只追加。
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Slf4j
@Repository
public class AuditEntryRepositoryImpl implements IAuditEntryRepository {

    private static final int MAX_QUERY_LIMIT = 1000;

    private final AuditEntryDao auditEntryDao;
    private final JsonCodec jsonCodec;

    public AuditEntryRepositoryImpl(AuditEntryDao auditEntryDao, JsonCodec jsonCodec) {
        this.auditEntryDao = auditEntryDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public AuditEntryEntity append(AuditEntryEntity entity) {
        if (entity.getId() != null) {
            throw new IllegalStateException("Audit entry already persisted: " + entity.getId());
        }
        AuditEntryPO po = toPO(entity);
        auditEntryDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public AuditEntryEntity findById(Long id) {
        AuditEntryPO po = auditEntryDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<AuditEntryEntity> findByResource(String resourceType, String resourceId) {
        return auditEntryDao.selectByResource(resourceType, resourceId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntryEntity> query(AuditEntryQuery query) {
        return auditEntryDao.selectByQuery(toQueryPO(query)).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public long count(AuditEntryQuery query) {
        return auditEntryDao.countByQuery(toQueryPO(query));
    }

    @Override
    public boolean markReviewed(AuditEntryEntity entity) {
        AuditEntryPO po = AuditEntryPO.builder()
                .id(entity.getId())
                .reviewedBy(entity.getReviewedBy())
                .reviewedAt(entity.getReviewedAt())
                .reviewStatus(entity.getReviewStatus() == null ? null : entity.getReviewStatus().getCode())
                .reviewComment(entity.getReviewComment())
                .build();
        return auditEntryDao.updateReviewIfAbsent(po) > 0;
    }

    private AuditEntryQueryPO toQueryPO(AuditEntryQuery query) {
        AuditEntryQuery source = query == null ? new AuditEntryQuery() : query;
        int limit = source.getLimit() <= 0 ? 200 : Math.min(source.getLimit(), MAX_QUERY_LIMIT);
        return AuditEntryQueryPO.builder()
                .resourceType(source.getResourceType())
                .resourceId(source.getResourceId())
                .actor(source.getActor())
                .action(source.getAction() == null ? null : source.getAction().getCode())
                .severity(source.getSeverity() == null ? null : source.getSeverity().getCode())
                .from(source.getFrom())
                .to(source.getTo())
                .requiresReview(source.getRequiresReview())
                .pendingReview(source.getPendingReview())
                .offset(Math.max(0, source.getOffset()))
                .limit(limit)
                .build();
    }

    private AuditEntryEntity toEntity(AuditEntryPO po) {
        AuditEntryEntity entity = new AuditEntryEntity();
        entity.setId(po.getId());
        entity.setResourceType(po.getResourceType());
        entity.setResourceId(po.getResourceId());
        entity.setActor(po.getActor());
        entity.setAction(AuditActionEnum.fromCode(po.getAction()));
        entity.setSeverity(AuditSeverityEnum.fromCode(po.getSeverity()));
        entity.setDescription(po.getDescription());
        entity.setOldValues(defaultMap(jsonCodec.readMap(po.getOldValues())));
        entity.setNewValues(defaultMap(jsonCodec.readMap(po.getNewValues())));
        entity.setAdditionalData(defaultMap(jsonCodec.readMap(po.getAdditionalData())));
        entity.setRequiresReview(po.getRequiresReview());
        entity.setReferenceEntryId(po.getReferenceEntryId());
        entity.setChecksum(po.getChecksum());
        entity.setReviewedBy(po.getReviewedBy());
        entity.setReviewedAt(po.getReviewedAt());
        entity.setReviewStatus(AuditReviewStatusEnum.fromCode(po.getReviewStatus()));
        entity.setReviewComment(po.getReviewComment());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private AuditEntryPO toPO(AuditEntryEntity entity) {
        return AuditEntryPO.builder()
                .id(entity.getId())
                .resourceType(entity.getResourceType())
                .resourceId(entity.getResourceId())
                .actor(entity.getActor())
                .action(entity.getAction() == null ? null : entity.getAction().getCode())
                .severity(entity.getSeverity() == null ? null : entity.getSeverity().getCode())
                .description(entity.getDescription())
                .oldValues(jsonCodec.writeValue(defaultMap(entity.getOldValues())))
                .newValues(jsonCodec.writeValue(defaultMap(entity.getNewValues())))
                .additionalData(jsonCodec.writeValue(defaultMap(entity.getAdditionalData())))
                .requiresReview(Boolean.TRUE.equals(entity.getRequiresReview()))
                .referenceEntryId(entity.getReferenceEntryId())
                .checksum(entity.getChecksum())
                .reviewedBy(entity.getReviewedBy())
                .reviewedAt(entity.getReviewedAt())
                .reviewStatus(entity.getReviewStatus() == null ? null : entity.getReviewStatus().getCode())
                .reviewComment(entity.getReviewComment())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    private Map<String, Object> defaultMap(Map<String, Object> values) {
        return values == null ? new LinkedHashMap<>() : values;
    }
}

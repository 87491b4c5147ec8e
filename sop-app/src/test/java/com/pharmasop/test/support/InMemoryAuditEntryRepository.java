package com.pharmasop.test.support;

import com.pharmasop.domain.audit.adapter.repository.IAuditEntryRepository;
import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import com.pharmasop.domain.audit.model.valobj.AuditEntryQuery;
import com.pharmasop.types.enums.AuditActionEnum;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 内存审计仓储，只追加；复核信息写一次。
 */
public class InMemoryAuditEntryRepository implements IAuditEntryRepository {

    private final Map<Long, AuditEntryEntity> store = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized AuditEntryEntity append(AuditEntryEntity entity) {
        if (entity.getId() != null) {
            throw new IllegalStateException("Audit entry is already persisted: " + entity.getId());
        }
        entity.setId(nextId++);
        store.put(entity.getId(), copy(entity));
        return entity;
    }

    @Override
    public synchronized AuditEntryEntity findById(Long id) {
        AuditEntryEntity entity = store.get(id);
        return entity == null ? null : copy(entity);
    }

    @Override
    public synchronized List<AuditEntryEntity> findByResource(String resourceType, String resourceId) {
        return store.values().stream()
                .filter(entry -> resourceType.equals(entry.getResourceType()) && resourceId.equals(entry.getResourceId()))
                .map(InMemoryAuditEntryRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<AuditEntryEntity> query(AuditEntryQuery query) {
        return store.values().stream()
                .filter(matches(query))
                .skip(query.getOffset())
                .limit(query.getLimit())
                .map(InMemoryAuditEntryRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized long count(AuditEntryQuery query) {
        return store.values().stream().filter(matches(query)).count();
    }

    @Override
    public synchronized boolean markReviewed(AuditEntryEntity entity) {
        AuditEntryEntity current = store.get(entity.getId());
        if (current == null || current.isReviewed()) {
            return false;
        }
        current.setReviewedBy(entity.getReviewedBy());
        current.setReviewedAt(entity.getReviewedAt());
        current.setReviewStatus(entity.getReviewStatus());
        current.setReviewComment(entity.getReviewComment());
        return true;
    }

    public synchronized List<AuditEntryEntity> all() {
        return store.values().stream().map(InMemoryAuditEntryRepository::copy).collect(Collectors.toList());
    }

    public synchronized List<AuditActionEnum> actionsFor(String jobId) {
        return store.values().stream()
                .filter(entry -> jobId.equals(entry.getResourceId()))
                .map(AuditEntryEntity::getAction)
                .collect(Collectors.toList());
    }

    private Predicate<AuditEntryEntity> matches(AuditEntryQuery query) {
        return entry -> (query.getResourceType() == null || query.getResourceType().equals(entry.getResourceType()))
                && (query.getResourceId() == null || query.getResourceId().equals(entry.getResourceId()))
                && (query.getActor() == null || query.getActor().equals(entry.getActor()))
                && (query.getAction() == null || query.getAction() == entry.getAction())
                && (query.getSeverity() == null || query.getSeverity() == entry.getSeverity())
                && (query.getFrom() == null || !entry.getCreatedAt().isBefore(query.getFrom()))
                && (query.getTo() == null || !entry.getCreatedAt().isAfter(query.getTo()))
                && (query.getRequiresReview() == null || query.getRequiresReview().equals(entry.getRequiresReview()))
                && (!Boolean.TRUE.equals(query.getPendingReview()) || (entry.isReviewRequired() && !entry.isReviewed()));
    }

    private static AuditEntryEntity copy(AuditEntryEntity source) {
        AuditEntryEntity target = new AuditEntryEntity();
        target.setId(source.getId());
        target.setResourceType(source.getResourceType());
        target.setResourceId(source.getResourceId());
        target.setActor(source.getActor());
        target.setAction(source.getAction());
        target.setSeverity(source.getSeverity());
        target.setDescription(source.getDescription());
        target.setOldValues(new LinkedHashMap<>(source.getOldValues()));
        target.setNewValues(new LinkedHashMap<>(source.getNewValues()));
        target.setAdditionalData(new LinkedHashMap<>(source.getAdditionalData()));
        target.setRequiresReview(source.getRequiresReview());
        target.setReferenceEntryId(source.getReferenceEntryId());
        target.setChecksum(source.getChecksum());
        target.setReviewedBy(source.getReviewedBy());
        target.setReviewedAt(source.getReviewedAt());
        target.setReviewStatus(source.getReviewStatus());
        target.setReviewComment(source.getReviewComment());
        target.setCreatedAt(source.getCreatedAt());
        return target;
    }
}

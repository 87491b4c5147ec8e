package com.pharmasop.trigger.application.command;

import com.pharmasop.domain.audit.adapter.repository.IAuditEntryRepository;
import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import com.pharmasop.domain.sop.adapter.repository.ISopJobRepository;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.trigger.event.ReviewQueueEventPublisher;
import com.pharmasop.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 作业持久化写用例：作业写入与其审计条目处于同一事务，要么全部提交，要么全部回滚。
 * <p>
 * 存储层异常统一转换为 STORAGE_ERROR；失败后调用方持有的实体视为作废，需要重新读取。
 * 需要复核的条目在事务提交后才进入复核队列。
 * </p>
 */
@Slf4j
@Service
public class SopJobPersistenceApplicationService {

    private final ISopJobRepository sopJobRepository;
    private final IAuditEntryRepository auditEntryRepository;
    private final ReviewQueueEventPublisher reviewQueueEventPublisher;

    public SopJobPersistenceApplicationService(ISopJobRepository sopJobRepository,
                                               IAuditEntryRepository auditEntryRepository,
                                               ReviewQueueEventPublisher reviewQueueEventPublisher) {
        this.sopJobRepository = sopJobRepository;
        this.auditEntryRepository = auditEntryRepository;
        this.reviewQueueEventPublisher = reviewQueueEventPublisher;
    }

    @Transactional(rollbackFor = Exception.class)
    public SopJobEntity createJob(SopJobEntity job, List<AuditEntryEntity> entries) {
        try {
            SopJobEntity saved = sopJobRepository.save(job);
            List<AuditEntryEntity> appended = appendAll(entries);
            publishAfterCommit(appended);
            return saved;
        } catch (AppException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw storageError("create", job == null ? null : job.getJobId(), ex);
        }
    }

    @Transactional(rollbackFor = Exception.class)
    public SopJobEntity updateJob(SopJobEntity job, List<AuditEntryEntity> entries) {
        try {
            SopJobEntity updated = sopJobRepository.update(job);
            List<AuditEntryEntity> appended = appendAll(entries);
            publishAfterCommit(appended);
            return updated;
        } catch (AppException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw storageError("update", job == null ? null : job.getJobId(), ex);
        }
    }

    @Transactional(rollbackFor = Exception.class)
    public List<AuditEntryEntity> appendAudit(List<AuditEntryEntity> entries) {
        try {
            List<AuditEntryEntity> appended = appendAll(entries);
            publishAfterCommit(appended);
            return appended;
        } catch (AppException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            String resourceId = entries == null || entries.isEmpty() ? null : entries.get(0).getResourceId();
            throw storageError("append audit", resourceId, ex);
        }
    }

    /**
     * 写入复核信息并追加一条确认条目；原条目已被复核时返回 INVALID_TRANSITION。
     */
    @Transactional(rollbackFor = Exception.class)
    public AuditEntryEntity acknowledgeAudit(AuditEntryEntity reviewed, AuditEntryEntity acknowledgement) {
        boolean marked;
        try {
            marked = auditEntryRepository.markReviewed(reviewed);
        } catch (RuntimeException ex) {
            throw storageError("acknowledge audit", reviewed == null ? null : String.valueOf(reviewed.getId()), ex);
        }
        if (!marked) {
            throw AppException.invalidTransition("Audit entry " + reviewed.getId() + " has already been reviewed");
        }
        try {
            return auditEntryRepository.append(acknowledgement);
        } catch (RuntimeException ex) {
            throw storageError("acknowledge audit", String.valueOf(reviewed.getId()), ex);
        }
    }

    private List<AuditEntryEntity> appendAll(List<AuditEntryEntity> entries) {
        if (entries == null || entries.isEmpty()) {
            return Collections.emptyList();
        }
        List<AuditEntryEntity> appended = new ArrayList<>(entries.size());
        for (AuditEntryEntity entry : entries) {
            if (entry != null) {
                appended.add(auditEntryRepository.append(entry));
            }
        }
        return appended;
    }

    private void publishAfterCommit(List<AuditEntryEntity> entries) {
        List<AuditEntryEntity> reviewEntries = new ArrayList<>();
        for (AuditEntryEntity entry : entries) {
            if (Boolean.TRUE.equals(entry.getRequiresReview())) {
                reviewEntries.add(entry);
            }
        }
        if (reviewEntries.isEmpty()) {
            return;
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            reviewEntries.forEach(reviewQueueEventPublisher::publish);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                reviewEntries.forEach(reviewQueueEventPublisher::publish);
            }
        });
    }

    private AppException storageError(String operation, String resourceId, RuntimeException ex) {
        log.error("Persistence failed. operation={}, resourceId={}, error={}", operation, resourceId, ex.getMessage(), ex);
        return AppException.storageError("Failed to " + operation + " for " + resourceId + ": " + ex.getMessage(), ex);
    }
}

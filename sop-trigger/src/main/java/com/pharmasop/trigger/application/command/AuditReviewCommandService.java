package com.pharmasop.trigger.application.command;

import com.pharmasop.api.dto.AuditEntryDTO;
import com.pharmasop.domain.audit.adapter.repository.IAuditEntryRepository;
import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import com.pharmasop.domain.audit.service.AuditTrailDomainService;
import com.pharmasop.trigger.application.common.SopJobDetailViewAssembler;
import com.pharmasop.types.enums.AuditReviewStatusEnum;
import com.pharmasop.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 审计复核用例：为条目写入一次性的复核信息，并追加引用该条目的确认条目。
 */
@Slf4j
@Service
public class AuditReviewCommandService {

    private final IAuditEntryRepository auditEntryRepository;
    private final AuditTrailDomainService auditTrailDomainService;
    private final SopJobPersistenceApplicationService sopJobPersistenceApplicationService;
    private final SopJobDetailViewAssembler sopJobDetailViewAssembler;

    public AuditReviewCommandService(IAuditEntryRepository auditEntryRepository,
                                     AuditTrailDomainService auditTrailDomainService,
                                     SopJobPersistenceApplicationService sopJobPersistenceApplicationService,
                                     SopJobDetailViewAssembler sopJobDetailViewAssembler) {
        this.auditEntryRepository = auditEntryRepository;
        this.auditTrailDomainService = auditTrailDomainService;
        this.sopJobPersistenceApplicationService = sopJobPersistenceApplicationService;
        this.sopJobDetailViewAssembler = sopJobDetailViewAssembler;
    }

    public AuditEntryDTO acknowledge(Long entryId, String reviewer, String statusCode, String comment) {
        if (entryId == null) {
            throw AppException.invalidRequest("audit entry id is required");
        }
        if (StringUtils.isBlank(reviewer)) {
            throw AppException.invalidRequest("reviewer is required");
        }
        AuditReviewStatusEnum status = parseStatus(statusCode);
        AuditEntryEntity entry = auditEntryRepository.findById(entryId);
        if (entry == null) {
            throw AppException.notFound("Audit entry not found: " + entryId);
        }
        try {
            entry.acknowledge(reviewer, status, StringUtils.trimToNull(comment));
        } catch (IllegalStateException ex) {
            throw AppException.invalidTransition(ex.getMessage());
        }
        AuditEntryEntity acknowledgement = auditTrailDomainService.acknowledged(entry);
        sopJobPersistenceApplicationService.acknowledgeAudit(entry, acknowledgement);
        log.info("Audit entry reviewed. entryId={}, reviewer={}, status={}", entryId, entry.getReviewedBy(),
                entry.getReviewStatus().getCode());
        return sopJobDetailViewAssembler.toAuditEntryDTO(entry);
    }

    private AuditReviewStatusEnum parseStatus(String statusCode) {
        if (StringUtils.isBlank(statusCode)) {
            return AuditReviewStatusEnum.ACKNOWLEDGED;
        }
        try {
            return AuditReviewStatusEnum.fromCode(statusCode.trim());
        } catch (IllegalArgumentException ex) {
            throw AppException.invalidRequest("Unknown audit review status: " + statusCode);
        }
    }
}

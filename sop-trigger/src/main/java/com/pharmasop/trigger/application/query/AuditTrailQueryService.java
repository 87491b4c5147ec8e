package com.pharmasop.trigger.application.query;

import com.pharmasop.api.dto.AuditEntryDTO;
import com.pharmasop.domain.audit.adapter.repository.IAuditEntryRepository;
import com.pharmasop.domain.audit.model.valobj.AuditEntryQuery;
import com.pharmasop.domain.sop.adapter.repository.ISopJobRepository;
import com.pharmasop.trigger.application.common.SopJobDetailViewAssembler;
import com.pharmasop.types.common.Constants;
import com.pharmasop.types.enums.AuditActionEnum;
import com.pharmasop.types.enums.AuditSeverityEnum;
import com.pharmasop.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 审计追踪查询：单作业审计轨迹与条件导出。
 */
@Service
public class AuditTrailQueryService {

    private static final int MAX_LIMIT = 1000;

    private final IAuditEntryRepository auditEntryRepository;
    private final ISopJobRepository sopJobRepository;
    private final SopJobDetailViewAssembler sopJobDetailViewAssembler;

    public AuditTrailQueryService(IAuditEntryRepository auditEntryRepository,
                                  ISopJobRepository sopJobRepository,
                                  SopJobDetailViewAssembler sopJobDetailViewAssembler) {
        this.auditEntryRepository = auditEntryRepository;
        this.sopJobRepository = sopJobRepository;
        this.sopJobDetailViewAssembler = sopJobDetailViewAssembler;
    }

    public List<AuditEntryDTO> listJobTrail(String jobId) {
        if (StringUtils.isBlank(jobId) || sopJobRepository.findByJobId(jobId) == null) {
            throw AppException.notFound("SOP job not found: " + jobId);
        }
        return sopJobDetailViewAssembler.toAuditEntryDTOs(
                auditEntryRepository.findByResource(Constants.RESOURCE_TYPE_SOP_JOB, jobId));
    }

    public List<AuditEntryDTO> export(ExportQuery query) {
        ExportQuery source = query == null ? ExportQuery.empty() : query;
        AuditEntryQuery criteria = new AuditEntryQuery();
        criteria.setResourceType(StringUtils.isBlank(source.resourceId()) && StringUtils.isBlank(source.resourceType())
                ? null
                : StringUtils.defaultIfBlank(source.resourceType(), Constants.RESOURCE_TYPE_SOP_JOB));
        criteria.setResourceId(StringUtils.trimToNull(source.resourceId()));
        criteria.setActor(StringUtils.trimToNull(source.actor()));
        criteria.setAction(parseAction(source.action()));
        criteria.setSeverity(parseSeverity(source.severity()));
        criteria.setFrom(source.from());
        criteria.setTo(source.to());
        criteria.setRequiresReview(source.requiresReview());
        criteria.setPendingReview(source.pendingReview());
        criteria.setLimit(source.limit() == null || source.limit() < 1 ? 200 : Math.min(source.limit(), MAX_LIMIT));
        criteria.setOffset(source.offset() == null || source.offset() < 0 ? 0 : source.offset());
        return sopJobDetailViewAssembler.toAuditEntryDTOs(auditEntryRepository.query(criteria));
    }

    private AuditActionEnum parseAction(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        try {
            return AuditActionEnum.fromCode(code.trim());
        } catch (IllegalArgumentException ex) {
            throw AppException.invalidRequest("Unknown audit action: " + code);
        }
    }

    private AuditSeverityEnum parseSeverity(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        try {
            return AuditSeverityEnum.fromCode(code.trim());
        } catch (IllegalArgumentException ex) {
            throw AppException.invalidRequest("Unknown audit severity: " + code);
        }
    }

    public record ExportQuery(String resourceType,
                              String resourceId,
                              String actor,
                              String action,
                              String severity,
                              LocalDateTime from,
                              LocalDateTime to,
                              Boolean requiresReview,
                              Boolean pendingReview,
                              Integer limit,
                              Integer offset) {
        public static ExportQuery empty() {
            return new ExportQuery(null, null, null, null, null, null, null, null, null, null, null);
        }
    }
}

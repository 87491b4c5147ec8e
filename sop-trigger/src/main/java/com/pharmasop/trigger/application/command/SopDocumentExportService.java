package com.pharmasop.trigger.application.command;

import com.pharmasop.api.dto.SopDocumentExportDTO;
import com.pharmasop.domain.audit.service.AuditTrailDomainService;
import com.pharmasop.domain.sop.adapter.gateway.ISopDocumentRenderer;
import com.pharmasop.domain.sop.adapter.repository.ISopJobRepository;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.RenderedDocument;
import com.pharmasop.types.common.Constants;
import com.pharmasop.types.enums.SopJobStatusEnum;
import com.pharmasop.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 文档导出用例：仅对已有定稿内容的作业渲染文档，每次导出追加一条 EXPORT 审计条目。
 */
@Slf4j
@Service
public class SopDocumentExportService {

    private static final Set<SopJobStatusEnum> EXPORTABLE_STATUSES = EnumSet.of(
            SopJobStatusEnum.COMPLETED, SopJobStatusEnum.UNDER_REVIEW, SopJobStatusEnum.APPROVED);

    private final ISopJobRepository sopJobRepository;
    private final ISopDocumentRenderer sopDocumentRenderer;
    private final AuditTrailDomainService auditTrailDomainService;
    private final SopJobPersistenceApplicationService sopJobPersistenceApplicationService;

    public SopDocumentExportService(ISopJobRepository sopJobRepository,
                                    ISopDocumentRenderer sopDocumentRenderer,
                                    AuditTrailDomainService auditTrailDomainService,
                                    SopJobPersistenceApplicationService sopJobPersistenceApplicationService) {
        this.sopJobRepository = sopJobRepository;
        this.sopDocumentRenderer = sopDocumentRenderer;
        this.auditTrailDomainService = auditTrailDomainService;
        this.sopJobPersistenceApplicationService = sopJobPersistenceApplicationService;
    }

    public SopDocumentExportDTO export(String jobId, String actor) {
        SopJobEntity job = StringUtils.isBlank(jobId) ? null : sopJobRepository.findByJobId(jobId);
        if (job == null) {
            throw AppException.notFound("SOP job not found: " + jobId);
        }
        if (!EXPORTABLE_STATUSES.contains(job.getStatus()) || job.getContent() == null) {
            throw AppException.invalidTransition("Job " + jobId + " is " + job.getStatus()
                    + " and has no exportable content");
        }
        RenderedDocument document = sopDocumentRenderer.render(job);
        String normalizedActor = StringUtils.isBlank(actor) ? Constants.SYSTEM_ACTOR : actor.trim();
        sopJobPersistenceApplicationService.appendAudit(
                List.of(auditTrailDomainService.exported(job, normalizedActor, document.getFileName())));
        log.info("SOP document exported. jobId={}, fileName={}, actor={}", jobId, document.getFileName(), normalizedActor);

        SopDocumentExportDTO dto = new SopDocumentExportDTO();
        dto.setJobId(jobId);
        dto.setFileName(document.getFileName());
        dto.setMediaType(document.getMediaType());
        dto.setContent(document.getContent());
        dto.setRenderedAt(LocalDateTime.now());
        return dto;
    }
}

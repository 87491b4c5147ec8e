package com.pharmasop.trigger.application.command;

import com.pharmasop.api.dto.SopJobSubmitRequestDTO;
import com.pharmasop.api.dto.SopJobSubmitResultDTO;
import com.pharmasop.api.dto.SopSectionDTO;
import com.pharmasop.domain.audit.service.AuditTrailDomainService;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.SopJobSubmitCommand;
import com.pharmasop.domain.sop.model.valobj.SopSectionSpec;
import com.pharmasop.domain.sop.service.SopRequestValidationDomainService;
import com.pharmasop.trigger.job.SopJobDispatcher;
import com.pharmasop.types.enums.PharmaDepartmentEnum;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import com.pharmasop.types.enums.SopJobStatusEnum;
import com.pharmasop.types.enums.SopPriorityEnum;
import com.pharmasop.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * 作业提交用例：校验请求、落库 PENDING 作业与 CREATE 审计条目，并尝试即时投递。
 * <p>
 * 提交同步返回，不等待生成；投递失败时作业保持 PENDING，由调度守护补偿。
 * </p>
 */
@Slf4j
@Service
public class SopJobSubmitCommandService {

    private final SopRequestValidationDomainService sopRequestValidationDomainService;
    private final AuditTrailDomainService auditTrailDomainService;
    private final SopJobPersistenceApplicationService sopJobPersistenceApplicationService;
    private final SopJobDispatcher sopJobDispatcher;
    private final boolean immediateDispatch;
    private final int estimatedCompletionMinutes;

    public SopJobSubmitCommandService(SopRequestValidationDomainService sopRequestValidationDomainService,
                                      AuditTrailDomainService auditTrailDomainService,
                                      SopJobPersistenceApplicationService sopJobPersistenceApplicationService,
                                      SopJobDispatcher sopJobDispatcher,
                                      @Value("${sop.pipeline.dispatch.immediate:true}") boolean immediateDispatch,
                                      @Value("${sop.pipeline.estimated-completion-minutes:2}") int estimatedCompletionMinutes) {
        this.sopRequestValidationDomainService = sopRequestValidationDomainService;
        this.auditTrailDomainService = auditTrailDomainService;
        this.sopJobPersistenceApplicationService = sopJobPersistenceApplicationService;
        this.sopJobDispatcher = sopJobDispatcher;
        this.immediateDispatch = immediateDispatch;
        this.estimatedCompletionMinutes = estimatedCompletionMinutes > 0 ? estimatedCompletionMinutes : 2;
    }

    public SopJobSubmitResultDTO submit(SopJobSubmitRequestDTO request) {
        if (request == null) {
            throw AppException.invalidRequest("Invalid SOP request: request body is required");
        }
        SopJobSubmitCommand command = toCommand(request);
        sopRequestValidationDomainService.requireValid(command);

        SopJobEntity job = newPendingJob(command);
        SopJobEntity saved = sopJobPersistenceApplicationService.createJob(job,
                List.of(auditTrailDomainService.jobCreated(job, command.getRequestedBy())));
        log.info("SOP job submitted. jobId={}, title={}, frameworks={}, sections={}, requestedBy={}",
                saved.getJobId(), saved.getTitle(), saved.getRegulatoryFrameworks(),
                saved.getSections().size(), saved.getRequestedBy());

        if (immediateDispatch) {
            sopJobDispatcher.dispatch(saved.getJobId());
        }

        SopJobSubmitResultDTO result = new SopJobSubmitResultDTO();
        result.setJobId(saved.getJobId());
        result.setStatus(SopJobStatusEnum.PENDING.getCode());
        result.setEstimatedCompletionMinutes(estimatedCompletionMinutes);
        result.setEstimatedCompletion(saved.getCreatedAt().plusMinutes(estimatedCompletionMinutes));
        return result;
    }

    /**
     * 由已校验的命令构造新的 PENDING 作业（未持久化）。
     */
    public SopJobEntity newPendingJob(SopJobSubmitCommand command) {
        LocalDateTime now = LocalDateTime.now();
        SopJobEntity job = new SopJobEntity();
        job.setJobId(UUID.randomUUID().toString());
        job.setTitle(StringUtils.trim(command.getTitle()));
        job.setDescription(StringUtils.trim(command.getDescription()));
        job.setDepartment(command.getDepartment());
        job.setPriority(command.getPriority());
        job.setRegulatoryFrameworks(new ArrayList<>(command.getRegulatoryFrameworks()));
        List<SopSectionSpec> sections = new ArrayList<>();
        for (SopSectionSpec section : command.getSections()) {
            sections.add(new SopSectionSpec(section.getTitle().trim(), StringUtils.trimToNull(section.getDescription())));
        }
        job.setSections(sections);
        job.setEquipment(cleanList(command.getEquipment()));
        job.setMaterials(cleanList(command.getMaterials()));
        job.setSafetyNotes(StringUtils.trimToNull(command.getSafetyNotes()));
        job.setQualityCheckpoints(cleanList(command.getQualityCheckpoints()));
        job.setCustomRequirements(StringUtils.trimToNull(command.getCustomRequirements()));
        job.setRequestedBy(StringUtils.trim(command.getRequestedBy()));
        job.setStatus(SopJobStatusEnum.PENDING);
        job.setGenerationAttempts(0);
        job.setArchived(false);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        return job;
    }

    private SopJobSubmitCommand toCommand(SopJobSubmitRequestDTO request) {
        SopJobSubmitCommand command = new SopJobSubmitCommand();
        command.setTitle(request.getTitle());
        command.setDescription(request.getDescription());
        command.setDepartment(parseCode(request.getDepartment(), PharmaDepartmentEnum::fromCode, "department"));
        command.setPriority(parseCode(request.getPriority(), SopPriorityEnum::fromCode, "priority"));
        List<RegulatoryFrameworkEnum> frameworks = new ArrayList<>();
        if (request.getRegulatoryFrameworks() != null) {
            for (String code : request.getRegulatoryFrameworks()) {
                frameworks.add(parseCode(code, RegulatoryFrameworkEnum::fromCode, "regulatory framework"));
            }
        }
        command.setRegulatoryFrameworks(frameworks);
        List<SopSectionSpec> sections = new ArrayList<>();
        if (request.getSections() != null) {
            for (SopSectionDTO section : request.getSections()) {
                sections.add(section == null ? null : new SopSectionSpec(section.getTitle(), section.getDescription()));
            }
        }
        command.setSections(sections);
        command.setEquipment(request.getEquipment());
        command.setMaterials(request.getMaterials());
        command.setSafetyNotes(request.getSafetyNotes());
        command.setQualityCheckpoints(request.getQualityCheckpoints());
        command.setCustomRequirements(request.getCustomRequirements());
        command.setRequestedBy(request.getRequestedBy());
        return command;
    }

    private <E> E parseCode(String code, Function<String, E> parser, String fieldName) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        try {
            return parser.apply(code.trim());
        } catch (IllegalArgumentException ex) {
            throw AppException.invalidRequest("Invalid SOP request: unknown " + fieldName + " '" + code.trim() + "'");
        }
    }

    private static List<String> cleanList(List<String> values) {
        List<String> result = new ArrayList<>();
        if (values == null) {
            return result;
        }
        for (String value : values) {
            if (StringUtils.isNotBlank(value)) {
                result.add(value.trim());
            }
        }
        return result;
    }
}

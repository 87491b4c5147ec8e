package com.pharmasop.trigger.application.command;

import com.pharmasop.api.dto.SopJobDetailDTO;
import com.pharmasop.api.dto.SopJobSubmitResultDTO;
import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import com.pharmasop.domain.audit.service.AuditTrailDomainService;
import com.pharmasop.domain.sop.adapter.repository.ISopJobRepository;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.SopJobSubmitCommand;
import com.pharmasop.domain.sop.model.valobj.SopSectionSpec;
import com.pharmasop.trigger.application.common.SopJobDetailViewAssembler;
import com.pharmasop.trigger.concurrency.SopJobExecutionRegistry;
import com.pharmasop.trigger.concurrency.SopJobLockRegistry;
import com.pharmasop.trigger.job.SopJobDispatcher;
import com.pharmasop.types.common.Constants;
import com.pharmasop.types.enums.SopJobErrorKindEnum;
import com.pharmasop.types.enums.SopJobStatusEnum;
import com.pharmasop.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 作业生命周期用例：取消、重新提交、归档。
 */
@Slf4j
@Service
public class SopJobLifecycleCommandService {

    private final ISopJobRepository sopJobRepository;
    private final AuditTrailDomainService auditTrailDomainService;
    private final SopJobPersistenceApplicationService sopJobPersistenceApplicationService;
    private final SopJobSubmitCommandService sopJobSubmitCommandService;
    private final SopJobLockRegistry sopJobLockRegistry;
    private final SopJobExecutionRegistry sopJobExecutionRegistry;
    private final SopJobDispatcher sopJobDispatcher;
    private final SopJobDetailViewAssembler sopJobDetailViewAssembler;

    public SopJobLifecycleCommandService(ISopJobRepository sopJobRepository,
                                         AuditTrailDomainService auditTrailDomainService,
                                         SopJobPersistenceApplicationService sopJobPersistenceApplicationService,
                                         SopJobSubmitCommandService sopJobSubmitCommandService,
                                         SopJobLockRegistry sopJobLockRegistry,
                                         SopJobExecutionRegistry sopJobExecutionRegistry,
                                         SopJobDispatcher sopJobDispatcher,
                                         SopJobDetailViewAssembler sopJobDetailViewAssembler) {
        this.sopJobRepository = sopJobRepository;
        this.auditTrailDomainService = auditTrailDomainService;
        this.sopJobPersistenceApplicationService = sopJobPersistenceApplicationService;
        this.sopJobSubmitCommandService = sopJobSubmitCommandService;
        this.sopJobLockRegistry = sopJobLockRegistry;
        this.sopJobExecutionRegistry = sopJobExecutionRegistry;
        this.sopJobDispatcher = sopJobDispatcher;
        this.sopJobDetailViewAssembler = sopJobDetailViewAssembler;
    }

    /**
     * 取消作业。
     * <p>
     * PENDING：原子地经 PROCESSING 落为 FAILED(Cancelled)，不发起生成；
     * PROCESSING 且由本进程推进：登记取消请求，推进者在当前尝试返回后落定；
     * PROCESSING 但无推进者：直接落为 FAILED(Cancelled)。
     * </p>
     */
    public SopJobDetailDTO cancel(String jobId, String actor, String reason) {
        String normalizedActor = StringUtils.isBlank(actor) ? Constants.SYSTEM_ACTOR : actor.trim();
        String normalizedReason = StringUtils.trimToNull(reason);
        SopJobEntity result = sopJobLockRegistry.tryWithLock(jobId, () -> {
            SopJobEntity job = loadJob(jobId);
            SopJobStatusEnum previousStatus = job.getStatus();
            if (previousStatus != SopJobStatusEnum.PENDING && previousStatus != SopJobStatusEnum.PROCESSING) {
                throw AppException.invalidTransition("Job " + jobId + " is " + previousStatus + " and cannot be cancelled");
            }
            AuditEntryEntity cancelEntry = auditTrailDomainService.cancelled(job, previousStatus, normalizedActor,
                    normalizedReason);
            if (previousStatus == SopJobStatusEnum.PROCESSING
                    && sopJobExecutionRegistry.requestCancel(jobId, normalizedActor, normalizedReason)) {
                sopJobPersistenceApplicationService.appendAudit(List.of(cancelEntry));
                log.info("SOP job cancellation requested. jobId={}, actor={}", jobId, normalizedActor);
                return job;
            }
            List<AuditEntryEntity> entries = new ArrayList<>();
            entries.add(cancelEntry);
            if (previousStatus == SopJobStatusEnum.PENDING) {
                job.startProcessing(1L);
                entries.add(auditTrailDomainService.processingStarted(job, SopJobStatusEnum.PENDING));
            }
            SopJobStatusEnum beforeFail = job.getStatus();
            job.fail(SopJobErrorKindEnum.CANCELLED, "Cancelled by " + normalizedActor
                    + (normalizedReason == null ? "" : ": " + normalizedReason));
            entries.add(auditTrailDomainService.jobFailed(job, beforeFail, normalizedActor));
            SopJobEntity saved = sopJobPersistenceApplicationService.updateJob(job, entries);
            log.info("SOP job cancelled. jobId={}, previousStatus={}, actor={}", jobId, previousStatus, normalizedActor);
            return saved;
        });
        return sopJobDetailViewAssembler.toDetailDTO(result);
    }

    /**
     * 以同一描述新建作业；原作业（FAILED/REJECTED）保持不变。
     */
    public SopJobSubmitResultDTO resubmit(String jobId, String actor) {
        SopJobEntity source = loadJob(jobId);
        if (source.getStatus() != SopJobStatusEnum.FAILED && source.getStatus() != SopJobStatusEnum.REJECTED) {
            throw AppException.invalidTransition("Only FAILED or REJECTED jobs can be resubmitted, job " + jobId
                    + " is " + source.getStatus());
        }
        String normalizedActor = StringUtils.isBlank(actor) ? source.getRequestedBy() : actor.trim();
        SopJobEntity newJob = sopJobSubmitCommandService.newPendingJob(toCommand(source, normalizedActor));
        newJob.setSourceJobId(source.getJobId());
        SopJobEntity saved = sopJobPersistenceApplicationService.createJob(newJob, List.of(
                auditTrailDomainService.jobCreated(newJob, normalizedActor),
                auditTrailDomainService.resubmitted(source, newJob, normalizedActor)));
        log.info("SOP job resubmitted. sourceJobId={}, jobId={}, actor={}", jobId, saved.getJobId(), normalizedActor);
        sopJobDispatcher.dispatch(saved.getJobId());

        SopJobSubmitResultDTO result = new SopJobSubmitResultDTO();
        result.setJobId(saved.getJobId());
        result.setStatus(saved.getStatus().getCode());
        return result;
    }

    public SopJobDetailDTO archive(String jobId, String actor) {
        String normalizedActor = StringUtils.isBlank(actor) ? Constants.SYSTEM_ACTOR : actor.trim();
        SopJobEntity saved = sopJobLockRegistry.tryWithLock(jobId, () -> {
            SopJobEntity job = loadJob(jobId);
            try {
                job.archive();
            } catch (IllegalStateException ex) {
                throw AppException.invalidTransition("Job " + jobId + " cannot be archived: " + ex.getMessage());
            }
            return sopJobPersistenceApplicationService.updateJob(job,
                    List.of(auditTrailDomainService.archived(job, normalizedActor)));
        });
        log.info("SOP job archived. jobId={}, actor={}", jobId, normalizedActor);
        return sopJobDetailViewAssembler.toDetailDTO(saved);
    }

    private SopJobSubmitCommand toCommand(SopJobEntity source, String requestedBy) {
        SopJobSubmitCommand command = new SopJobSubmitCommand();
        command.setTitle(source.getTitle());
        command.setDescription(source.getDescription());
        command.setDepartment(source.getDepartment());
        command.setPriority(source.getPriority());
        command.setRegulatoryFrameworks(new ArrayList<>(source.getRegulatoryFrameworks()));
        List<SopSectionSpec> sections = new ArrayList<>();
        for (SopSectionSpec section : source.getSections()) {
            sections.add(new SopSectionSpec(section.getTitle(), section.getDescription()));
        }
        command.setSections(sections);
        command.setEquipment(source.getEquipment());
        command.setMaterials(source.getMaterials());
        command.setSafetyNotes(source.getSafetyNotes());
        command.setQualityCheckpoints(source.getQualityCheckpoints());
        command.setCustomRequirements(source.getCustomRequirements());
        command.setRequestedBy(requestedBy);
        return command;
    }

    private SopJobEntity loadJob(String jobId) {
        SopJobEntity job = StringUtils.isBlank(jobId) ? null : sopJobRepository.findByJobId(jobId);
        if (job == null) {
            throw AppException.notFound("SOP job not found: " + jobId);
        }
        return job;
    }
}

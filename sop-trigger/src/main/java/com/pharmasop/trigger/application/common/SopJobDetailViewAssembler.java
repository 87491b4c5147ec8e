package com.pharmasop.trigger.application.common;

import com.pharmasop.api.dto.AuditEntryDTO;
import com.pharmasop.api.dto.ComplianceCheckDTO;
import com.pharmasop.api.dto.ContentSectionDTO;
import com.pharmasop.api.dto.ContentSnapshotDTO;
import com.pharmasop.api.dto.SopJobDetailDTO;
import com.pharmasop.api.dto.SopJobSummaryDTO;
import com.pharmasop.api.dto.SopSectionDTO;
import com.pharmasop.api.dto.ValidationResultDTO;
import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.ComplianceCheck;
import com.pharmasop.domain.sop.model.valobj.ContentSection;
import com.pharmasop.domain.sop.model.valobj.ContentSnapshot;
import com.pharmasop.domain.sop.model.valobj.SopSectionSpec;
import com.pharmasop.domain.sop.model.valobj.ValidationResult;
import com.pharmasop.types.enums.CheckOutcomeEnum;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 作业视图组装器：实体到 DTO 的统一映射，枚举一律输出编码。
 * <p>
 * 返回的 DTO 与实体不共享可变集合，调用方修改 DTO 不影响已持久化状态。
 * </p>
 */
@Component
public class SopJobDetailViewAssembler {

    public SopJobDetailDTO toDetailDTO(SopJobEntity job) {
        if (job == null) {
            return null;
        }
        SopJobDetailDTO dto = new SopJobDetailDTO();
        dto.setJobId(job.getJobId());
        dto.setTitle(job.getTitle());
        dto.setDescription(job.getDescription());
        dto.setDepartment(job.getDepartment() == null ? null : job.getDepartment().getCode());
        dto.setPriority(job.getPriority() == null ? null : job.getPriority().getCode());
        dto.setRegulatoryFrameworks(frameworkCodes(job.getRegulatoryFrameworks()));
        dto.setSections(toSectionDTOs(job.getSections()));
        dto.setEquipment(copy(job.getEquipment()));
        dto.setMaterials(copy(job.getMaterials()));
        dto.setSafetyNotes(job.getSafetyNotes());
        dto.setQualityCheckpoints(copy(job.getQualityCheckpoints()));
        dto.setCustomRequirements(job.getCustomRequirements());
        dto.setRequestedBy(job.getRequestedBy());
        dto.setStatus(job.getStatus() == null ? null : job.getStatus().getCode());
        dto.setContent(toContentDTO(job.getContent()));
        dto.setValidation(toValidationDTO(job.getValidation()));
        dto.setComplianceScore(job.getValidation() == null ? null : job.getValidation().getScore());
        dto.setErrorKind(job.getErrorKind() == null ? null : job.getErrorKind().getCode());
        dto.setErrorDetail(job.getErrorDetail());
        dto.setGenerationAttempts(job.getGenerationAttempts());
        dto.setReviewedBy(job.getReviewedBy());
        dto.setReviewedAt(job.getReviewedAt());
        dto.setReviewComment(job.getReviewComment());
        dto.setArchived(job.isArchived());
        dto.setArchivedAt(job.getArchivedAt());
        dto.setSourceJobId(job.getSourceJobId());
        dto.setCreatedAt(job.getCreatedAt());
        dto.setUpdatedAt(job.getUpdatedAt());
        dto.setCompletedAt(job.getCompletedAt());
        return dto;
    }

    public SopJobSummaryDTO toSummaryDTO(SopJobEntity job) {
        if (job == null) {
            return null;
        }
        SopJobSummaryDTO dto = new SopJobSummaryDTO();
        dto.setJobId(job.getJobId());
        dto.setTitle(job.getTitle());
        dto.setDepartment(job.getDepartment() == null ? null : job.getDepartment().getCode());
        dto.setPriority(job.getPriority() == null ? null : job.getPriority().getCode());
        dto.setRegulatoryFrameworks(frameworkCodes(job.getRegulatoryFrameworks()));
        dto.setStatus(job.getStatus() == null ? null : job.getStatus().getCode());
        dto.setComplianceScore(job.getValidation() == null ? null : job.getValidation().getScore());
        dto.setErrorKind(job.getErrorKind() == null ? null : job.getErrorKind().getCode());
        dto.setRequestedBy(job.getRequestedBy());
        dto.setArchived(job.isArchived());
        dto.setCreatedAt(job.getCreatedAt());
        dto.setCompletedAt(job.getCompletedAt());
        return dto;
    }

    public List<SopJobSummaryDTO> toSummaryDTOs(List<SopJobEntity> jobs) {
        if (jobs == null || jobs.isEmpty()) {
            return Collections.emptyList();
        }
        return jobs.stream()
                .filter(Objects::nonNull)
                .map(this::toSummaryDTO)
                .collect(Collectors.toList());
    }

    public AuditEntryDTO toAuditEntryDTO(AuditEntryEntity entry) {
        if (entry == null) {
            return null;
        }
        AuditEntryDTO dto = new AuditEntryDTO();
        dto.setId(entry.getId());
        dto.setResourceType(entry.getResourceType());
        dto.setResourceId(entry.getResourceId());
        dto.setActor(entry.getActor());
        dto.setAction(entry.getAction() == null ? null : entry.getAction().getCode());
        dto.setSeverity(entry.getSeverity() == null ? null : entry.getSeverity().getCode());
        dto.setDescription(entry.getDescription());
        dto.setOldValues(copy(entry.getOldValues()));
        dto.setNewValues(copy(entry.getNewValues()));
        dto.setAdditionalData(copy(entry.getAdditionalData()));
        dto.setRequiresReview(entry.getRequiresReview());
        dto.setReferenceEntryId(entry.getReferenceEntryId());
        dto.setChecksum(entry.getChecksum());
        dto.setReviewedBy(entry.getReviewedBy());
        dto.setReviewedAt(entry.getReviewedAt());
        dto.setReviewStatus(entry.getReviewStatus() == null ? null : entry.getReviewStatus().getCode());
        dto.setReviewComment(entry.getReviewComment());
        dto.setCreatedAt(entry.getCreatedAt());
        return dto;
    }

    public List<AuditEntryDTO> toAuditEntryDTOs(List<AuditEntryEntity> entries) {
        if (entries == null || entries.isEmpty()) {
            return Collections.emptyList();
        }
        return entries.stream()
                .filter(Objects::nonNull)
                .map(this::toAuditEntryDTO)
                .collect(Collectors.toList());
    }

    private ContentSnapshotDTO toContentDTO(ContentSnapshot snapshot) {
        if (snapshot == null) {
            return null;
        }
        ContentSnapshotDTO dto = new ContentSnapshotDTO();
        List<ContentSectionDTO> sections = new ArrayList<>();
        if (snapshot.getSections() != null) {
            for (ContentSection section : snapshot.getSections()) {
                ContentSectionDTO sectionDTO = new ContentSectionDTO();
                sectionDTO.setTitle(section.getTitle());
                sectionDTO.setBody(section.getBody());
                sectionDTO.setPlaceholder(section.isPlaceholder());
                sections.add(sectionDTO);
            }
        }
        dto.setSections(sections);
        dto.setWordCount(snapshot.getWordCount());
        dto.setSectionCount(snapshot.getSectionCount());
        dto.setGeneratedAt(snapshot.getGeneratedAt());
        dto.setEngineId(snapshot.getEngineId());
        dto.setContentHash(snapshot.getContentHash());
        return dto;
    }

    private ValidationResultDTO toValidationDTO(ValidationResult validation) {
        if (validation == null) {
            return null;
        }
        ValidationResultDTO dto = new ValidationResultDTO();
        dto.setScore(validation.getScore());
        List<ComplianceCheckDTO> checks = new ArrayList<>();
        if (validation.getChecks() != null) {
            for (ComplianceCheck check : validation.getChecks()) {
                ComplianceCheckDTO checkDTO = new ComplianceCheckDTO();
                checkDTO.setDimension(check.getDimension() == null ? null : check.getDimension().getCode());
                checkDTO.setName(check.getName());
                checkDTO.setOutcome(check.getOutcome() == null ? null : check.getOutcome().getCode());
                checkDTO.setMessage(check.getMessage());
                checks.add(checkDTO);
            }
        }
        dto.setChecks(checks);
        Map<String, String> indicators = new LinkedHashMap<>();
        if (validation.getIndicators() != null) {
            for (Map.Entry<String, CheckOutcomeEnum> indicator : validation.getIndicators().entrySet()) {
                indicators.put(indicator.getKey(), indicator.getValue() == null ? null : indicator.getValue().getCode());
            }
        }
        dto.setIndicators(indicators);
        dto.setIssues(copy(validation.getIssues()));
        dto.setValidatedAt(validation.getValidatedAt());
        return dto;
    }

    private List<SopSectionDTO> toSectionDTOs(List<SopSectionSpec> sections) {
        if (sections == null) {
            return new ArrayList<>();
        }
        List<SopSectionDTO> result = new ArrayList<>(sections.size());
        for (SopSectionSpec section : sections) {
            SopSectionDTO dto = new SopSectionDTO();
            dto.setTitle(section.getTitle());
            dto.setDescription(section.getDescription());
            result.add(dto);
        }
        return result;
    }

    private List<String> frameworkCodes(List<RegulatoryFrameworkEnum> frameworks) {
        if (frameworks == null) {
            return new ArrayList<>();
        }
        return frameworks.stream()
                .filter(Objects::nonNull)
                .map(RegulatoryFrameworkEnum::getCode)
                .collect(Collectors.toList());
    }

    private static List<String> copy(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }

    private static Map<String, Object> copy(Map<String, Object> values) {
        return values == null ? new LinkedHashMap<>() : new LinkedHashMap<>(values);
    }
}

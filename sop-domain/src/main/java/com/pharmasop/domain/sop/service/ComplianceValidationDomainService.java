package com.pharmasop.domain.sop.service;

import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.ComplianceCheck;
import com.pharmasop.domain.sop.model.valobj.ContentSnapshot;
import com.pharmasop.domain.sop.model.valobj.ValidationResult;
import com.pharmasop.types.enums.CheckOutcomeEnum;
import com.pharmasop.types.enums.ComplianceDimensionEnum;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 合规校验领域服务
 * <p>
 * 对内容快照和作业元数据做确定性打分：初始 100 分，每个 fail 扣 25，每个 warning 扣 5，结果截断到 [0, 100]。
 * 七项检查按固定顺序执行。该服务不抛出异常，输入不完整时返回低分与说明性问题，保证总有可审计的结果。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Service
public class ComplianceValidationDomainService {

    public static final int MAX_SCORE = 100;
    public static final int MIN_SECTION_COUNT = 3;

    public ValidationResult validate(SopJobEntity job, ContentSnapshot snapshot) {
        return validate(job, snapshot, RegulatoryFrameworkEnum.FDA_21_CFR_211);
    }

    public ValidationResult validate(SopJobEntity job, ContentSnapshot snapshot, RegulatoryFrameworkEnum baselineFramework) {
        try {
            return doValidate(job, snapshot, baselineFramework);
        } catch (RuntimeException ex) {
            return unvalidatable("Validation could not be completed: " + ex.getClass().getSimpleName()
                    + (ex.getMessage() == null ? "" : " - " + ex.getMessage()));
        }
    }

    /**
     * 按扣分规则计算得分。
     */
    public int score(List<ComplianceCheck> checks) {
        int score = MAX_SCORE;
        if (checks != null) {
            for (ComplianceCheck check : checks) {
                if (check != null && check.getOutcome() != null) {
                    score -= check.getOutcome().getPenalty();
                }
            }
        }
        return Math.max(0, Math.min(MAX_SCORE, score));
    }

    private ValidationResult doValidate(SopJobEntity job, ContentSnapshot snapshot, RegulatoryFrameworkEnum baselineFramework) {
        if (job == null) {
            return unvalidatable("Job metadata is missing");
        }
        List<ComplianceCheck> checks = new ArrayList<>();
        checks.add(checkRequiredFields(job));
        checks.add(checkFrameworkSelected(job));
        checks.add(checkSectionCompleteness(snapshot));
        checks.add(checkSafety(job));
        checks.add(checkQualityCheckpoints(job));
        checks.add(checkEquipment(job));
        checks.add(checkBaselineFramework(job, baselineFramework == null ? RegulatoryFrameworkEnum.FDA_21_CFR_211 : baselineFramework));

        List<String> issues = new ArrayList<>();
        for (ComplianceCheck check : checks) {
            if (check.getOutcome() != CheckOutcomeEnum.PASS) {
                issues.add(check.getName() + ": " + check.getMessage());
            }
        }
        if (snapshot != null) {
            for (String title : snapshot.placeholderTitles()) {
                issues.add("Section '" + title + "' was not produced by the generation engine and contains placeholder content");
            }
        }
        return buildResult(checks, issues);
    }

    private ComplianceCheck checkRequiredFields(SopJobEntity job) {
        List<String> missing = new ArrayList<>();
        if (!hasText(job.getTitle())) {
            missing.add("title");
        }
        if (!hasText(job.getDescription())) {
            missing.add("description");
        }
        if (job.getDepartment() == null) {
            missing.add("department");
        }
        if (job.getPriority() == null) {
            missing.add("priority");
        }
        if (!missing.isEmpty()) {
            return ComplianceCheck.of(ComplianceDimensionEnum.REQUIRED_FIELDS_PRESENT, CheckOutcomeEnum.FAIL,
                    "Missing required basic information fields: " + String.join(", ", missing));
        }
        return ComplianceCheck.of(ComplianceDimensionEnum.REQUIRED_FIELDS_PRESENT, CheckOutcomeEnum.PASS,
                "All required basic information provided");
    }

    private ComplianceCheck checkFrameworkSelected(SopJobEntity job) {
        int count = sizeOf(job.getRegulatoryFrameworks());
        if (count == 0) {
            return ComplianceCheck.of(ComplianceDimensionEnum.FRAMEWORK_SELECTED, CheckOutcomeEnum.FAIL,
                    "At least one regulatory framework must be selected");
        }
        return ComplianceCheck.of(ComplianceDimensionEnum.FRAMEWORK_SELECTED, CheckOutcomeEnum.PASS,
                count + " regulatory framework(s) selected");
    }

    private ComplianceCheck checkSectionCompleteness(ContentSnapshot snapshot) {
        if (snapshot == null || snapshot.getSections() == null || snapshot.getSections().isEmpty()) {
            return ComplianceCheck.of(ComplianceDimensionEnum.SECTION_COMPLETENESS, CheckOutcomeEnum.FAIL,
                    "No generated content sections available");
        }
        // 占位章节计入总数，由 issues 单独列出
        int count = snapshot.getSections().size();
        if (count < MIN_SECTION_COUNT) {
            return ComplianceCheck.of(ComplianceDimensionEnum.SECTION_COMPLETENESS, CheckOutcomeEnum.WARNING,
                    count + " section(s) defined. Consider adding more sections for comprehensive coverage");
        }
        return ComplianceCheck.of(ComplianceDimensionEnum.SECTION_COMPLETENESS, CheckOutcomeEnum.PASS,
                count + " sections defined");
    }

    private ComplianceCheck checkSafety(SopJobEntity job) {
        if (!hasText(job.getSafetyNotes())) {
            return ComplianceCheck.of(ComplianceDimensionEnum.SAFETY_DOCUMENTED, CheckOutcomeEnum.WARNING,
                    "Safety considerations not specified - consider adding for pharmaceutical compliance");
        }
        return ComplianceCheck.of(ComplianceDimensionEnum.SAFETY_DOCUMENTED, CheckOutcomeEnum.PASS,
                "Safety considerations documented");
    }

    private ComplianceCheck checkQualityCheckpoints(SopJobEntity job) {
        int count = countText(job.getQualityCheckpoints());
        if (count == 0) {
            return ComplianceCheck.of(ComplianceDimensionEnum.QUALITY_CHECKPOINTS_DEFINED, CheckOutcomeEnum.WARNING,
                    "Consider adding quality control checkpoints");
        }
        return ComplianceCheck.of(ComplianceDimensionEnum.QUALITY_CHECKPOINTS_DEFINED, CheckOutcomeEnum.PASS,
                count + " quality checkpoint(s) defined");
    }

    private ComplianceCheck checkEquipment(SopJobEntity job) {
        int count = countText(job.getEquipment());
        if (count == 0) {
            return ComplianceCheck.of(ComplianceDimensionEnum.EQUIPMENT_DEFINED, CheckOutcomeEnum.WARNING,
                    "No equipment requirements specified");
        }
        return ComplianceCheck.of(ComplianceDimensionEnum.EQUIPMENT_DEFINED, CheckOutcomeEnum.PASS,
                count + " equipment item(s) specified");
    }

    private ComplianceCheck checkBaselineFramework(SopJobEntity job, RegulatoryFrameworkEnum baselineFramework) {
        if (!job.includesFramework(baselineFramework)) {
            return ComplianceCheck.of(ComplianceDimensionEnum.MANDATORY_FRAMEWORK_PRESENT, CheckOutcomeEnum.WARNING,
                    "Consider including " + baselineFramework.getLabel() + " for baseline pharmaceutical compliance");
        }
        return ComplianceCheck.of(ComplianceDimensionEnum.MANDATORY_FRAMEWORK_PRESENT, CheckOutcomeEnum.PASS,
                baselineFramework.getLabel() + " compliance included");
    }

    private ValidationResult unvalidatable(String reason) {
        List<ComplianceCheck> checks = new ArrayList<>();
        for (ComplianceDimensionEnum dimension : ComplianceDimensionEnum.values()) {
            checks.add(ComplianceCheck.of(dimension, CheckOutcomeEnum.FAIL, reason));
        }
        List<String> issues = new ArrayList<>();
        issues.add(reason);
        return buildResult(checks, issues);
    }

    private ValidationResult buildResult(List<ComplianceCheck> checks, List<String> issues) {
        Map<String, CheckOutcomeEnum> indicators = new LinkedHashMap<>();
        for (ComplianceCheck check : checks) {
            indicators.put(check.getDimension().getCode(), check.getOutcome());
        }
        ValidationResult result = new ValidationResult();
        result.setScore(score(checks));
        result.setChecks(checks);
        result.setIndicators(indicators);
        result.setIssues(issues);
        result.setValidatedAt(LocalDateTime.now());
        return result;
    }

    private int sizeOf(List<?> values) {
        return values == null ? 0 : (int) values.stream().filter(value -> value != null).count();
    }

    private int countText(List<String> values) {
        if (values == null) {
            return 0;
        }
        return (int) values.stream().filter(this::hasText).count();
    }

    private boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}

package com.pharmasop.domain.sop.service;

import com.pharmasop.domain.sop.model.valobj.SopJobSubmitCommand;
import com.pharmasop.domain.sop.model.valobj.SopSectionSpec;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import com.pharmasop.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 作业受理校验领域服务：提交时一次性校验请求形状，下游组件信任作业结构。
 * <p>
 * 部门和优先级不在受理阶段强制，缺失时由合规校验第一项判定为 fail。
 * </p>
 */
@Service
public class SopRequestValidationDomainService {

    public static final int TITLE_MAX_LENGTH = 200;
    public static final int DESCRIPTION_MAX_LENGTH = 4000;
    public static final int SECTION_MAX_COUNT = 50;

    public List<String> collectViolations(SopJobSubmitCommand command) {
        List<String> violations = new ArrayList<>();
        if (command == null) {
            violations.add("request body is required");
            return violations;
        }
        if (!hasText(command.getTitle())) {
            violations.add("title is required");
        } else if (command.getTitle().trim().length() > TITLE_MAX_LENGTH) {
            violations.add("title must not exceed " + TITLE_MAX_LENGTH + " characters");
        }
        if (!hasText(command.getDescription())) {
            violations.add("description is required");
        } else if (command.getDescription().trim().length() > DESCRIPTION_MAX_LENGTH) {
            violations.add("description must not exceed " + DESCRIPTION_MAX_LENGTH + " characters");
        }
        if (!hasText(command.getRequestedBy())) {
            violations.add("requestedBy is required");
        }
        checkFrameworks(command.getRegulatoryFrameworks(), violations);
        checkSections(command.getSections(), violations);
        return violations;
    }

    /**
     * 校验失败时抛出 ILLEGAL_PARAMETER。
     */
    public void requireValid(SopJobSubmitCommand command) {
        List<String> violations = collectViolations(command);
        if (!violations.isEmpty()) {
            throw AppException.invalidRequest("Invalid SOP request: " + String.join("; ", violations));
        }
    }

    private void checkFrameworks(List<RegulatoryFrameworkEnum> frameworks, List<String> violations) {
        if (frameworks == null || frameworks.isEmpty()) {
            violations.add("at least one regulatory framework is required");
            return;
        }
        if (frameworks.contains(null)) {
            violations.add("regulatory frameworks must not contain empty values");
        }
    }

    private void checkSections(List<SopSectionSpec> sections, List<String> violations) {
        if (sections == null || sections.isEmpty()) {
            violations.add("at least one section is required");
            return;
        }
        if (sections.size() > SECTION_MAX_COUNT) {
            violations.add("no more than " + SECTION_MAX_COUNT + " sections are allowed");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < sections.size(); i++) {
            SopSectionSpec section = sections.get(i);
            if (section == null || !hasText(section.getTitle())) {
                violations.add("section #" + (i + 1) + " title is required");
                continue;
            }
            if (!seen.add(section.getTitle().trim().toLowerCase(Locale.ROOT))) {
                violations.add("duplicate section title: " + section.getTitle().trim());
            }
        }
    }

    private boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}

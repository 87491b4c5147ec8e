package com.pharmasop.infrastructure.ai;

import com.pharmasop.domain.sop.model.valobj.GenerationRequest;
import com.pharmasop.domain.sop.model.valobj.SopSectionSpec;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * SOP 生成提示词构建器。
 * <p>
 * 要求模型以 "## 章节标题" 形式逐节输出，便于 {@link SopContentParser} 按标题回填。
 * </p>
 */
@Component
public class SopPromptBuilder {

    static final String SYSTEM_PROMPT = "You are a pharmaceutical documentation specialist who writes Standard Operating "
            + "Procedures for GMP-regulated manufacturing sites. Write precise, auditable, imperative instructions. "
            + "Do not invent regulatory citations that were not requested.";

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String buildUserPrompt(GenerationRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Write a Standard Operating Procedure.\n\n");
        prompt.append("Title: ").append(StringUtils.trimToEmpty(request.getTitle())).append('\n');
        prompt.append("Description: ").append(StringUtils.trimToEmpty(request.getDescription())).append('\n');
        if (request.getDepartment() != null) {
            prompt.append("Department: ").append(request.getDepartment().getLabel()).append('\n');
        }
        if (request.getPriority() != null) {
            prompt.append("Priority: ").append(request.getPriority().getCode()).append('\n');
        }

        prompt.append("\nRegulatory frameworks that the SOP must comply with:\n");
        for (RegulatoryFrameworkEnum framework : request.getFrameworks()) {
            prompt.append("- ").append(framework.getLabel()).append(" (").append(framework.getCode()).append(")\n");
        }

        appendList(prompt, "Equipment", request.getEquipment());
        appendList(prompt, "Materials", request.getMaterials());
        appendList(prompt, "Quality checkpoints", request.getQualityCheckpoints());
        if (StringUtils.isNotBlank(request.getSafetyNotes())) {
            prompt.append("\nSafety considerations:\n").append(request.getSafetyNotes().trim()).append('\n');
        }
        if (StringUtils.isNotBlank(request.getCustomRequirements())) {
            prompt.append("\nAdditional requirements:\n").append(request.getCustomRequirements().trim()).append('\n');
        }

        prompt.append("\nProduce exactly the following sections, in this order. ");
        prompt.append("Start each section with a line of the form \"## <section title>\" using the title verbatim, ");
        prompt.append("and do not add any other sections:\n");
        int index = 1;
        for (SopSectionSpec section : request.getSections()) {
            prompt.append(index++).append(". ").append(section.getTitle());
            if (StringUtils.isNotBlank(section.getDescription())) {
                prompt.append(" - ").append(section.getDescription().trim());
            }
            prompt.append('\n');
        }
        return prompt.toString();
    }

    private void appendList(StringBuilder prompt, String label, List<String> values) {
        if (values == null || values.isEmpty()) {
            return;
        }
        prompt.append('\n').append(label).append(":\n");
        for (String value : values) {
            if (StringUtils.isNotBlank(value)) {
                prompt.append("- ").append(value.trim()).append('\n');
            }
        }
    }
}

package com.pharmasop.infrastructure.render;

import com.pharmasop.domain.sop.adapter.gateway.ISopDocumentRenderer;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.ComplianceCheck;
import com.pharmasop.domain.sop.model.valobj.ContentSection;
import com.pharmasop.domain.sop.model.valobj.RenderedDocument;
import com.pharmasop.domain.sop.model.valobj.ValidationResult;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Markdown 文档渲染实现：标题区、元数据表、正文章节与合规摘要。
 */
@Component
public class MarkdownSopDocumentRenderer implements ISopDocumentRenderer {

    private static final String MEDIA_TYPE = "text/markdown";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public RenderedDocument render(SopJobEntity job) {
        if (job == null || job.getContent() == null) {
            throw new IllegalStateException("Job has no generated content to render");
        }
        StringBuilder doc = new StringBuilder();
        doc.append("# ").append(job.getTitle()).append("\n\n");
        doc.append("| Field | Value |\n|---|---|\n");
        row(doc, "Document ID", job.getJobId());
        row(doc, "Department", job.getDepartment() == null ? "-" : job.getDepartment().getLabel());
        row(doc, "Priority", job.getPriority() == null ? "-" : job.getPriority().getCode());
        row(doc, "Regulatory frameworks", job.getRegulatoryFrameworks().stream()
                .map(RegulatoryFrameworkEnum::getLabel)
                .collect(Collectors.joining(", ")));
        row(doc, "Status", job.getStatus().getCode());
        row(doc, "Requested by", job.getRequestedBy());
        row(doc, "Generated at", job.getContent().getGeneratedAt() == null ? "-"
                : job.getContent().getGeneratedAt().format(TIME_FORMAT));
        row(doc, "Generation engine", job.getContent().getEngineId());
        if (StringUtils.isNotBlank(job.getReviewedBy()) && job.getReviewedAt() != null) {
            row(doc, "Reviewed by", job.getReviewedBy() + " (" + job.getReviewedAt().format(TIME_FORMAT) + ")");
        }
        doc.append('\n');
        if (StringUtils.isNotBlank(job.getDescription())) {
            doc.append(job.getDescription().trim()).append("\n\n");
        }

        int index = 1;
        for (ContentSection section : job.getContent().getSections()) {
            doc.append("## ").append(index++).append(". ").append(section.getTitle()).append("\n\n");
            doc.append(section.getBody()).append("\n\n");
        }

        ValidationResult validation = job.getValidation();
        if (validation != null) {
            doc.append("## Compliance Summary\n\n");
            doc.append("Compliance score: **").append(validation.getScore()).append("/100**\n\n");
            for (ComplianceCheck check : validation.getChecks()) {
                doc.append("- [").append(check.getOutcome().getCode().toUpperCase(Locale.ROOT)).append("] ")
                        .append(check.getName()).append(": ").append(check.getMessage()).append('\n');
            }
            doc.append('\n');
        }
        doc.append("---\n").append("Content hash: `").append(job.contentHash()).append("`\n");

        String fileName = "SOP_" + slug(job.getTitle()) + "_" + StringUtils.left(job.getJobId(), 8) + ".md";
        return new RenderedDocument(fileName, MEDIA_TYPE, doc.toString());
    }

    private void row(StringBuilder doc, String field, String value) {
        doc.append("| ").append(field).append(" | ")
                .append(StringUtils.defaultIfBlank(value, "-").replace("|", "\\|"))
                .append(" |\n");
    }

    private String slug(String title) {
        String slug = StringUtils.defaultString(title).trim().replaceAll("[^A-Za-z0-9]+", "_");
        slug = StringUtils.strip(slug, "_");
        return StringUtils.defaultIfBlank(StringUtils.left(slug, 60), "document");
    }
}

package com.pharmasop.test;

import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.ComplianceCheck;
import com.pharmasop.domain.sop.model.valobj.ContentSnapshot;
import com.pharmasop.domain.sop.model.valobj.RenderedDocument;
import com.pharmasop.domain.sop.model.valobj.SopSectionSpec;
import com.pharmasop.domain.sop.model.valobj.ValidationResult;
import com.pharmasop.domain.sop.service.SopContentAssemblyDomainService;
import com.pharmasop.infrastructure.render.MarkdownSopDocumentRenderer;
import com.pharmasop.types.enums.CheckOutcomeEnum;
import com.pharmasop.types.enums.ComplianceDimensionEnum;
import com.pharmasop.types.enums.PharmaDepartmentEnum;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import com.pharmasop.types.enums.SopJobStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class MarkdownSopDocumentRendererTest {

    private final MarkdownSopDocumentRenderer renderer = new MarkdownSopDocumentRenderer();

    @Test
    public void shouldRenderSectionsInOrderWithComplianceSummary() {
        SopJobEntity job = completedJob();

        RenderedDocument document = renderer.render(job);

        Assertions.assertEquals("SOP_Equipment_Cleaning_SOP_3f2a9c1e.md", document.getFileName());
        Assertions.assertEquals("text/markdown", document.getMediaType());
        String content = document.getContent();
        Assertions.assertTrue(content.startsWith("# Equipment Cleaning SOP\n"));
        Assertions.assertTrue(content.contains("| Department | Production |"));
        Assertions.assertTrue(content.contains("| Priority | - |"));
        Assertions.assertTrue(content.indexOf("## 1. Purpose") < content.indexOf("## 2. Procedure"));
        Assertions.assertTrue(content.contains("Compliance score: **95/100**"));
        Assertions.assertTrue(content.contains("- [WARNING] Safety Considerations: No safety notes"));
        Assertions.assertTrue(content.contains("Content hash: `" + job.contentHash() + "`"));
    }

    @Test
    public void shouldRefuseJobWithoutContent() {
        SopJobEntity job = completedJob();
        job.setContent(null);

        Assertions.assertThrows(IllegalStateException.class, () -> renderer.render(job));
    }

    private SopJobEntity completedJob() {
        List<SopSectionSpec> sections = List.of(new SopSectionSpec("Purpose", null),
                new SopSectionSpec("Procedure", null));
        ContentSnapshot snapshot = new SopContentAssemblyDomainService().assemble(sections,
                Map.of("Purpose", "Keep equipment clean.", "Procedure", "Wash and dry."), "scripted-engine");

        ValidationResult validation = new ValidationResult();
        validation.setScore(95);
        validation.getChecks().add(ComplianceCheck.of(ComplianceDimensionEnum.SAFETY_DOCUMENTED,
                CheckOutcomeEnum.WARNING, "No safety notes"));

        SopJobEntity job = new SopJobEntity();
        job.setJobId("3f2a9c1e-0000-4000-8000-000000000001");
        job.setTitle("Equipment Cleaning SOP");
        job.setDepartment(PharmaDepartmentEnum.PRODUCTION);
        job.setRegulatoryFrameworks(new ArrayList<>(List.of(RegulatoryFrameworkEnum.FDA_21_CFR_211)));
        job.setSections(new ArrayList<>(sections));
        job.setRequestedBy("qa.lead");
        job.setStatus(SopJobStatusEnum.COMPLETED);
        job.setContent(snapshot);
        job.setValidation(validation);
        return job;
    }
}

package com.pharmasop.test;

import com.pharmasop.api.dto.AuditEntryDTO;
import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import com.pharmasop.test.support.ScriptedContentGenerator;
import com.pharmasop.test.support.SopPipelineFixture;
import com.pharmasop.trigger.application.command.AuditReviewCommandService;
import com.pharmasop.trigger.application.query.AuditTrailQueryService.ExportQuery;
import com.pharmasop.types.enums.AuditActionEnum;
import com.pharmasop.types.enums.ResponseCode;
import com.pharmasop.types.exception.AppException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class AuditReviewCommandServiceTest {

    private SopPipelineFixture fixture;
    private AuditReviewCommandService auditReviewCommandService;

    @BeforeEach
    public void setUp() {
        fixture = new SopPipelineFixture(ScriptedContentGenerator.succeeding(), SopPipelineFixture.fastPolicy(3, 5_000L));
        auditReviewCommandService = new AuditReviewCommandService(fixture.auditRepository, fixture.auditTrail,
                fixture.persistence, fixture.viewAssembler);
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        fixture.close();
    }

    @Test
    public void shouldAcknowledgeApprovalEntryExactlyOnce() {
        String jobId = approvedJob();
        AuditEntryEntity approval = approvalEntry(jobId);

        AuditEntryDTO reviewed = auditReviewCommandService.acknowledge(approval.getId(), "auditor", "acknowledged",
                "Verified signature");

        Assertions.assertEquals("auditor", reviewed.getReviewedBy());
        Assertions.assertEquals("acknowledged", reviewed.getReviewStatus());
        Assertions.assertNotNull(reviewed.getReviewedAt());
        Assertions.assertNotNull(fixture.auditRepository.findById(approval.getId()).getReviewedAt());

        List<AuditEntryEntity> entries = fixture.auditRepository.all();
        AuditEntryEntity acknowledgement = entries.get(entries.size() - 1);
        Assertions.assertEquals(AuditActionEnum.ACKNOWLEDGE, acknowledgement.getAction());
        Assertions.assertEquals(approval.getId(), acknowledgement.getReferenceEntryId());

        AppException again = Assertions.assertThrows(AppException.class,
                () -> auditReviewCommandService.acknowledge(approval.getId(), "auditor2", "escalated", null));
        Assertions.assertEquals(ResponseCode.INVALID_TRANSITION.getCode(), again.getCode());
        Assertions.assertEquals("auditor", fixture.auditRepository.findById(approval.getId()).getReviewedBy());
    }

    @Test
    public void shouldListOnlyEntriesPendingReview() {
        String jobId = approvedJob();
        ExportQuery pending = new ExportQuery(null, null, null, null, null, null, null, null, true, null, null);

        List<AuditEntryDTO> before = fixture.auditQueryService.export(pending);
        Assertions.assertEquals(1, before.size());
        Assertions.assertEquals("APPROVE", before.get(0).getAction());

        auditReviewCommandService.acknowledge(approvalEntry(jobId).getId(), "auditor", null, null);

        Assertions.assertTrue(fixture.auditQueryService.export(pending).isEmpty());
        Assertions.assertEquals(7, fixture.auditQueryService.listJobTrail(jobId).size());
    }

    @Test
    public void shouldValidateAcknowledgeInput() {
        String jobId = approvedJob();
        Long entryId = approvalEntry(jobId).getId();

        AppException missingEntry = Assertions.assertThrows(AppException.class,
                () -> auditReviewCommandService.acknowledge(9_999L, "auditor", null, null));
        AppException noReviewer = Assertions.assertThrows(AppException.class,
                () -> auditReviewCommandService.acknowledge(entryId, " ", null, null));
        AppException badStatus = Assertions.assertThrows(AppException.class,
                () -> auditReviewCommandService.acknowledge(entryId, "auditor", "ignored", null));

        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), missingEntry.getCode());
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), noReviewer.getCode());
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), badStatus.getCode());
    }

    @Test
    public void shouldRejectTrailQueryForUnknownJob() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.auditQueryService.listJobTrail("missing-job"));
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), ex.getCode());
    }

    private String approvedJob() {
        String jobId = fixture.submitService.submit(SopPipelineFixture.equipmentCleaningRequest()).getJobId();
        fixture.runQueuedJobs();
        fixture.reviewService.review(jobId, "approve", "qa.manager", null);
        return jobId;
    }

    private AuditEntryEntity approvalEntry(String jobId) {
        return fixture.auditRepository.all().stream()
                .filter(entry -> jobId.equals(entry.getResourceId()) && entry.getAction() == AuditActionEnum.APPROVE)
                .findFirst()
                .orElseThrow();
    }
}

package com.pharmasop.test.domain;

import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import com.pharmasop.domain.audit.service.AuditTrailDomainService;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.ComplianceCheck;
import com.pharmasop.domain.sop.model.valobj.ValidationResult;
import com.pharmasop.types.common.Constants;
import com.pharmasop.types.enums.AuditActionEnum;
import com.pharmasop.types.enums.AuditReviewStatusEnum;
import com.pharmasop.types.enums.AuditSeverityEnum;
import com.pharmasop.types.enums.CheckOutcomeEnum;
import com.pharmasop.types.enums.ComplianceDimensionEnum;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import com.pharmasop.types.enums.ReviewOutcomeEnum;
import com.pharmasop.types.enums.SopJobStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class AuditTrailDomainServiceTest {

    private final AuditTrailDomainService service = new AuditTrailDomainService();

    @Test
    public void shouldBuildSealedCreateEntry() {
        SopJobEntity job = job(SopJobStatusEnum.PENDING);

        AuditEntryEntity entry = service.jobCreated(job, "qa.lead");

        Assertions.assertEquals(AuditActionEnum.CREATE, entry.getAction());
        Assertions.assertEquals(Constants.RESOURCE_TYPE_SOP_JOB, entry.getResourceType());
        Assertions.assertEquals("job-7", entry.getResourceId());
        Assertions.assertEquals("qa.lead", entry.getActor());
        Assertions.assertEquals("PENDING", entry.getNewValues().get("status"));
        Assertions.assertFalse(entry.isReviewRequired());
        Assertions.assertTrue(service.verifyChecksum(entry));
    }

    @Test
    public void shouldDetectTamperedEntry() {
        AuditEntryEntity entry = service.jobCreated(job(SopJobStatusEnum.PENDING), "qa.lead");

        entry.setDescription("rewritten history");

        Assertions.assertFalse(service.verifyChecksum(entry));
    }

    @Test
    public void shouldFlagApprovalDecisionsForReview() {
        SopJobEntity job = job(SopJobStatusEnum.APPROVED);
        job.setReviewedBy("qa.manager");

        AuditEntryEntity entry = service.reviewed(job, SopJobStatusEnum.UNDER_REVIEW, ReviewOutcomeEnum.APPROVE);

        Assertions.assertEquals(AuditActionEnum.APPROVE, entry.getAction());
        Assertions.assertEquals("qa.manager", entry.getActor());
        Assertions.assertEquals(AuditSeverityEnum.HIGH, entry.getSeverity());
        Assertions.assertTrue(entry.isReviewRequired());
        Assertions.assertEquals("UNDER_REVIEW", entry.getOldValues().get("status"));
    }

    @Test
    public void shouldFlagValidationWithFailuresForReview() {
        ValidationResult failing = new ValidationResult();
        failing.setScore(75);
        failing.setChecks(new ArrayList<>(List.of(ComplianceCheck.of(ComplianceDimensionEnum.REQUIRED_FIELDS_PRESENT,
                CheckOutcomeEnum.FAIL, "missing department"))));
        ValidationResult passing = new ValidationResult();
        passing.setScore(100);

        AuditEntryEntity failed = service.validationCompleted(job(SopJobStatusEnum.COMPLETED), failing);
        AuditEntryEntity passed = service.validationCompleted(job(SopJobStatusEnum.COMPLETED), passing);

        Assertions.assertTrue(failed.isReviewRequired());
        Assertions.assertEquals(AuditSeverityEnum.HIGH, failed.getSeverity());
        Assertions.assertFalse(passed.isReviewRequired());
    }

    @Test
    public void shouldUseSystemActorForBlankActor() {
        AuditEntryEntity entry = service.archived(job(SopJobStatusEnum.APPROVED), "  ");

        Assertions.assertEquals(Constants.SYSTEM_ACTOR, entry.getActor());
    }

    @Test
    public void shouldReferenceOriginalWhenAcknowledging() {
        AuditEntryEntity original = service.reviewed(reviewedJob(), SopJobStatusEnum.UNDER_REVIEW, ReviewOutcomeEnum.REJECT);
        original.setId(42L);
        original.acknowledge("auditor", AuditReviewStatusEnum.ESCALATED, "needs CAPA");

        AuditEntryEntity acknowledgement = service.acknowledged(original);

        Assertions.assertEquals(AuditActionEnum.ACKNOWLEDGE, acknowledgement.getAction());
        Assertions.assertEquals(42L, acknowledgement.getReferenceEntryId());
        Assertions.assertEquals("auditor", acknowledgement.getActor());
        Assertions.assertEquals("needs CAPA", acknowledgement.getAdditionalData().get("comment"));
        Assertions.assertThrows(IllegalStateException.class,
                () -> original.acknowledge("auditor", AuditReviewStatusEnum.ACKNOWLEDGED, null));
    }

    private SopJobEntity reviewedJob() {
        SopJobEntity job = job(SopJobStatusEnum.REJECTED);
        job.setReviewedBy("qa.manager");
        return job;
    }

    private SopJobEntity job(SopJobStatusEnum status) {
        SopJobEntity job = new SopJobEntity();
        job.setJobId("job-7");
        job.setTitle("Environmental Monitoring");
        job.setStatus(status);
        job.setRegulatoryFrameworks(new ArrayList<>(List.of(RegulatoryFrameworkEnum.ISO_14001)));
        return job;
    }
}

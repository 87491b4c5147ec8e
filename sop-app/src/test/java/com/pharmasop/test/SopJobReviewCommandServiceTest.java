package com.pharmasop.test;

import com.pharmasop.api.dto.SopJobDetailDTO;
import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import com.pharmasop.test.support.ScriptedContentGenerator;
import com.pharmasop.test.support.SopPipelineFixture;
import com.pharmasop.types.enums.AuditActionEnum;
import com.pharmasop.types.enums.ResponseCode;
import com.pharmasop.types.enums.SopJobStatusEnum;
import com.pharmasop.types.exception.AppException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class SopJobReviewCommandServiceTest {

    private SopPipelineFixture fixture;

    @BeforeEach
    public void setUp() {
        fixture = new SopPipelineFixture(ScriptedContentGenerator.succeeding(), SopPipelineFixture.fastPolicy(3, 5_000L));
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        fixture.close();
    }

    @Test
    public void shouldApproveCompletedJobAndRefuseLaterRejection() {
        String jobId = completedJob();
        List<AuditEntryEntity> queued = new CopyOnWriteArrayList<>();
        fixture.reviewQueue.subscribe("test", queued::add);

        SopJobDetailDTO approved = fixture.reviewService.review(jobId, "approve", "qa.manager", "Looks good");

        Assertions.assertEquals("APPROVED", approved.getStatus());
        Assertions.assertEquals("qa.manager", approved.getReviewedBy());
        Assertions.assertEquals("Looks good", approved.getReviewComment());
        Assertions.assertEquals(List.of(AuditActionEnum.CREATE, AuditActionEnum.START_PROCESSING,
                AuditActionEnum.VALIDATE, AuditActionEnum.COMPLETE, AuditActionEnum.BEGIN_REVIEW,
                AuditActionEnum.APPROVE), fixture.auditRepository.actionsFor(jobId));
        Assertions.assertTrue(queued.stream().anyMatch(entry -> entry.getAction() == AuditActionEnum.APPROVE));

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.reviewService.review(jobId, "reject", "qa.manager", "changed my mind"));

        Assertions.assertEquals(ResponseCode.INVALID_TRANSITION.getCode(), ex.getCode());
        Assertions.assertEquals(SopJobStatusEnum.APPROVED, fixture.jobRepository.findByJobId(jobId).getStatus());
        Assertions.assertEquals(6, fixture.auditRepository.actionsFor(jobId).size());
    }

    @Test
    public void shouldRejectJobAfterExplicitReviewStart() {
        String jobId = completedJob();

        SopJobDetailDTO underReview = fixture.reviewService.beginReview(jobId, "qa.manager");
        Assertions.assertEquals("UNDER_REVIEW", underReview.getStatus());

        SopJobDetailDTO rejected = fixture.reviewService.review(jobId, "reject", "qa.manager", "Missing cleaning agents");

        Assertions.assertEquals("REJECTED", rejected.getStatus());
        Assertions.assertEquals("Missing cleaning agents", rejected.getReviewComment());
        List<AuditActionEnum> actions = fixture.auditRepository.actionsFor(jobId);
        Assertions.assertEquals(1, actions.stream().filter(action -> action == AuditActionEnum.BEGIN_REVIEW).count());
        Assertions.assertEquals(AuditActionEnum.REJECT, actions.get(actions.size() - 1));
    }

    @Test
    public void shouldRefuseReviewOfPendingJob() {
        String jobId = fixture.submitService.submit(SopPipelineFixture.equipmentCleaningRequest()).getJobId();

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.reviewService.review(jobId, "approve", "qa.manager", null));

        Assertions.assertEquals(ResponseCode.INVALID_TRANSITION.getCode(), ex.getCode());
        Assertions.assertEquals(SopJobStatusEnum.PENDING, fixture.jobRepository.findByJobId(jobId).getStatus());
        Assertions.assertEquals(List.of(AuditActionEnum.CREATE), fixture.auditRepository.actionsFor(jobId));
    }

    @Test
    public void shouldValidateReviewInput() {
        String jobId = completedJob();

        AppException badOutcome = Assertions.assertThrows(AppException.class,
                () -> fixture.reviewService.review(jobId, "maybe", "qa.manager", null));
        AppException noReviewer = Assertions.assertThrows(AppException.class,
                () -> fixture.reviewService.review(jobId, "approve", " ", null));
        AppException unknownJob = Assertions.assertThrows(AppException.class,
                () -> fixture.reviewService.review("missing-job", "approve", "qa.manager", null));

        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), badOutcome.getCode());
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), noReviewer.getCode());
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), unknownJob.getCode());
        Assertions.assertEquals(SopJobStatusEnum.COMPLETED, fixture.jobRepository.findByJobId(jobId).getStatus());
    }

    private String completedJob() {
        String jobId = fixture.submitService.submit(SopPipelineFixture.equipmentCleaningRequest()).getJobId();
        fixture.runQueuedJobs();
        Assertions.assertEquals(SopJobStatusEnum.COMPLETED, fixture.jobRepository.findByJobId(jobId).getStatus());
        return jobId;
    }
}

package com.pharmasop.test;

import com.google.common.util.concurrent.Striped;
import com.pharmasop.api.dto.SopJobDetailDTO;
import com.pharmasop.domain.audit.service.AuditTrailDomainService;
import com.pharmasop.domain.sop.adapter.gateway.ContentGenerationException;
import com.pharmasop.domain.sop.adapter.repository.ISopJobRepository;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.SopSectionSpec;
import com.pharmasop.domain.sop.service.ComplianceValidationDomainService;
import com.pharmasop.domain.sop.service.SopContentAssemblyDomainService;
import com.pharmasop.test.support.InMemoryAuditEntryRepository;
import com.pharmasop.test.support.ScriptedContentGenerator;
import com.pharmasop.test.support.SopPipelineFixture;
import com.pharmasop.trigger.application.command.SopJobAdvanceApplicationService;
import com.pharmasop.trigger.application.command.SopJobAdvanceApplicationService.AdvanceOutcome;
import com.pharmasop.trigger.application.command.SopJobAdvanceApplicationService.AdvanceResult;
import com.pharmasop.trigger.application.command.SopJobPersistenceApplicationService;
import com.pharmasop.trigger.concurrency.SopJobExecutionRegistry;
import com.pharmasop.trigger.concurrency.SopJobLockRegistry;
import com.pharmasop.trigger.event.ReviewQueueEventPublisher;
import com.pharmasop.types.enums.AuditActionEnum;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import com.pharmasop.types.enums.SopJobErrorKindEnum;
import com.pharmasop.types.enums.SopJobStatusEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class SopJobAdvanceApplicationServiceTest {

    private SopPipelineFixture fixture;

    @AfterEach
    public void tearDown() throws InterruptedException {
        if (fixture != null) {
            fixture.close();
        }
    }

    @Test
    public void shouldCompleteEquipmentCleaningScenario() {
        ScriptedContentGenerator generator = ScriptedContentGenerator.succeeding();
        fixture = new SopPipelineFixture(generator, SopPipelineFixture.fastPolicy(3, 5_000L));
        String jobId = fixture.submitService.submit(SopPipelineFixture.equipmentCleaningRequest()).getJobId();

        fixture.runQueuedJobs();

        SopJobDetailDTO detail = fixture.queryService.getJob(jobId);
        Assertions.assertEquals("COMPLETED", detail.getStatus());
        Assertions.assertTrue(detail.getComplianceScore() <= 90);
        Assertions.assertEquals(5, detail.getContent().getSections().size());
        Assertions.assertEquals(1, detail.getGenerationAttempts());
        Assertions.assertNotNull(detail.getCompletedAt());
        Assertions.assertEquals(List.of(AuditActionEnum.CREATE, AuditActionEnum.START_PROCESSING,
                AuditActionEnum.VALIDATE, AuditActionEnum.COMPLETE), fixture.auditRepository.actionsFor(jobId));

        Assertions.assertEquals(1, generator.callCount());
        Assertions.assertEquals(List.of(RegulatoryFrameworkEnum.FDA_21_CFR_211), generator.requests().get(0).getFrameworks());
        Assertions.assertNotNull(generator.requests().get(0).getDeadline());
    }

    @Test
    public void shouldFailWithEngineUnavailableAfterThreeAttempts() {
        ScriptedContentGenerator generator = ScriptedContentGenerator.alwaysFailing(
                ContentGenerationException.unavailable("engine down", null));
        fixture = new SopPipelineFixture(generator, SopPipelineFixture.fastPolicy(3, 5_000L));
        String jobId = fixture.submitService.submit(SopPipelineFixture.equipmentCleaningRequest()).getJobId();

        AdvanceResult result = fixture.advanceService.advance(jobId);

        Assertions.assertEquals(AdvanceOutcome.FAILED, result.outcome());
        Assertions.assertEquals(3, generator.callCount());
        SopJobEntity job = fixture.jobRepository.findByJobId(jobId);
        Assertions.assertEquals(SopJobStatusEnum.FAILED, job.getStatus());
        Assertions.assertEquals(SopJobErrorKindEnum.ENGINE_UNAVAILABLE, job.getErrorKind());
        Assertions.assertEquals("Generation failed after 3 attempt(s): engine down", job.getErrorDetail());
        Assertions.assertEquals(3, job.getGenerationAttempts());
        Assertions.assertNull(job.getContent());
        Assertions.assertEquals(List.of(AuditActionEnum.CREATE, AuditActionEnum.START_PROCESSING,
                AuditActionEnum.GENERATION_ATTEMPT_FAILED, AuditActionEnum.GENERATION_ATTEMPT_FAILED,
                AuditActionEnum.GENERATION_ATTEMPT_FAILED, AuditActionEnum.FAIL), fixture.auditRepository.actionsFor(jobId));
    }

    @Test
    public void shouldNotRetryRejectedRequest() {
        ScriptedContentGenerator generator = ScriptedContentGenerator.alwaysFailing(
                ContentGenerationException.rejected("prompt violates content policy", null));
        fixture = new SopPipelineFixture(generator, SopPipelineFixture.fastPolicy(3, 5_000L));
        String jobId = fixture.submitService.submit(SopPipelineFixture.equipmentCleaningRequest()).getJobId();

        AdvanceResult result = fixture.advanceService.advance(jobId);

        Assertions.assertEquals(AdvanceOutcome.FAILED, result.outcome());
        Assertions.assertEquals(1, generator.callCount());
        SopJobEntity job = fixture.jobRepository.findByJobId(jobId);
        Assertions.assertEquals(SopJobErrorKindEnum.ENGINE_REJECTED, job.getErrorKind());
        Assertions.assertEquals("prompt violates content policy", job.getErrorDetail());
    }

    @Test
    public void shouldTimeOutBlockedEngineCall() {
        ScriptedContentGenerator generator = new ScriptedContentGenerator().thenBlock();
        fixture = new SopPipelineFixture(generator, SopPipelineFixture.fastPolicy(1, 100L));
        String jobId = fixture.submitService.submit(SopPipelineFixture.equipmentCleaningRequest()).getJobId();

        AdvanceResult result = fixture.advanceService.advance(jobId);

        Assertions.assertEquals(AdvanceOutcome.FAILED, result.outcome());
        SopJobEntity job = fixture.jobRepository.findByJobId(jobId);
        Assertions.assertEquals(SopJobErrorKindEnum.ENGINE_TIMEOUT, job.getErrorKind());
        Assertions.assertTrue(job.getErrorDetail().contains("exceeded deadline of 100 ms"));
    }

    @Test
    public void shouldCompleteAfterTransientFailure() {
        ScriptedContentGenerator generator = new ScriptedContentGenerator()
                .thenFail(ContentGenerationException.timeout("slow"))
                .thenSucceed();
        fixture = new SopPipelineFixture(generator, SopPipelineFixture.fastPolicy(3, 5_000L));
        String jobId = fixture.submitService.submit(SopPipelineFixture.equipmentCleaningRequest()).getJobId();

        AdvanceResult result = fixture.advanceService.advance(jobId);

        Assertions.assertEquals(AdvanceOutcome.COMPLETED, result.outcome());
        Assertions.assertEquals(2, generator.callCount());
        Assertions.assertEquals(2, result.job().getGenerationAttempts());
        Assertions.assertNull(result.job().getErrorKind());
        Assertions.assertEquals(List.of(AuditActionEnum.CREATE, AuditActionEnum.START_PROCESSING,
                AuditActionEnum.GENERATION_ATTEMPT_FAILED, AuditActionEnum.VALIDATE, AuditActionEnum.COMPLETE),
                fixture.auditRepository.actionsFor(jobId));
    }

    @Test
    public void shouldCancelJobWhileEngineCallIsRunning() throws Exception {
        ScriptedContentGenerator generator = new ScriptedContentGenerator().thenBlock();
        fixture = new SopPipelineFixture(generator, SopPipelineFixture.fastPolicy(3, 20_000L));
        String jobId = fixture.submitService.submit(SopPipelineFixture.equipmentCleaningRequest()).getJobId();

        CompletableFuture<AdvanceResult> running = CompletableFuture.supplyAsync(() -> fixture.advanceService.advance(jobId));
        Assertions.assertTrue(generator.awaitFirstCall(5_000L));
        fixture.lifecycleService.cancel(jobId, "qa.lead", "wrong template");
        AdvanceResult result = running.get(10, TimeUnit.SECONDS);

        Assertions.assertEquals(AdvanceOutcome.FAILED, result.outcome());
        Assertions.assertEquals(1, generator.callCount());
        SopJobEntity job = fixture.jobRepository.findByJobId(jobId);
        Assertions.assertEquals(SopJobStatusEnum.FAILED, job.getStatus());
        Assertions.assertEquals(SopJobErrorKindEnum.CANCELLED, job.getErrorKind());
        Assertions.assertEquals("Cancelled by qa.lead: wrong template", job.getErrorDetail());
        Assertions.assertTrue(fixture.auditRepository.actionsFor(jobId).contains(AuditActionEnum.CANCEL));
        Assertions.assertFalse(fixture.executionRegistry.isOwned(jobId));
    }

    @Test
    public void shouldSkipJobsThatAreNotPendingOrAlreadyOwned() {
        fixture = new SopPipelineFixture(ScriptedContentGenerator.succeeding(), SopPipelineFixture.fastPolicy(3, 5_000L));
        String jobId = fixture.submitService.submit(SopPipelineFixture.equipmentCleaningRequest()).getJobId();

        Assertions.assertTrue(fixture.executionRegistry.tryAcquire(jobId));
        Assertions.assertEquals(AdvanceOutcome.SKIPPED, fixture.advanceService.advance(jobId).outcome());
        fixture.executionRegistry.release(jobId);

        Assertions.assertEquals(AdvanceOutcome.COMPLETED, fixture.advanceService.advance(jobId).outcome());
        Assertions.assertEquals(AdvanceOutcome.SKIPPED, fixture.advanceService.advance(jobId).outcome());
        Assertions.assertEquals(AdvanceOutcome.NOT_FOUND, fixture.advanceService.advance("missing-job").outcome());
    }

    @Test
    public void shouldAbortWhenStorageFails() {
        ISopJobRepository failingRepository = mock(ISopJobRepository.class);
        when(failingRepository.findByJobId("job-1")).thenAnswer(invocation -> pendingJob());
        when(failingRepository.update(any(SopJobEntity.class))).thenThrow(new RuntimeException("connection reset"));
        InMemoryAuditEntryRepository auditRepository = new InMemoryAuditEntryRepository();
        ScriptedContentGenerator generator = ScriptedContentGenerator.succeeding();
        ExecutorService callExecutor = Executors.newSingleThreadExecutor();
        try {
            SopJobAdvanceApplicationService service = new SopJobAdvanceApplicationService(failingRepository, generator,
                    new SopContentAssemblyDomainService(), new ComplianceValidationDomainService(),
                    new AuditTrailDomainService(),
                    new SopJobPersistenceApplicationService(failingRepository, auditRepository,
                            new ReviewQueueEventPublisher()),
                    new SopJobLockRegistry(Striped.lazyWeakLock(8), 200L), new SopJobExecutionRegistry(),
                    SopPipelineFixture.fastPolicy(3, 5_000L), callExecutor);

            AdvanceResult result = service.advance("job-1");

            Assertions.assertEquals(AdvanceOutcome.ABORTED, result.outcome());
            Assertions.assertTrue(result.message().contains("connection reset"));
            Assertions.assertEquals(0, generator.callCount());
            Assertions.assertTrue(auditRepository.all().isEmpty());
        } finally {
            callExecutor.shutdownNow();
        }
    }

    private SopJobEntity pendingJob() {
        SopJobEntity job = new SopJobEntity();
        job.setJobId("job-1");
        job.setTitle("Gowning SOP");
        job.setDescription("Gowning for grade B cleanrooms");
        job.setStatus(SopJobStatusEnum.PENDING);
        job.setRegulatoryFrameworks(new ArrayList<>(List.of(RegulatoryFrameworkEnum.ICH_Q7)));
        job.setSections(new ArrayList<>(List.of(new SopSectionSpec("Purpose", null))));
        job.setGenerationAttempts(0);
        job.setVersion(0);
        return job;
    }
}

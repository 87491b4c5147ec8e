package com.pharmasop.test;

import com.pharmasop.api.dto.SopJobDetailDTO;
import com.pharmasop.api.dto.SopJobPageDTO;
import com.pharmasop.api.dto.SopJobSubmitRequestDTO;
import com.pharmasop.test.support.ScriptedContentGenerator;
import com.pharmasop.test.support.SopPipelineFixture;
import com.pharmasop.trigger.application.query.SopJobQueryService.SearchQuery;
import com.pharmasop.types.enums.ResponseCode;
import com.pharmasop.types.exception.AppException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

public class SopJobQueryServiceTest {

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
    public void shouldReturnSameViewOnRepeatedQueries() {
        String jobId = fixture.submitService.submit(SopPipelineFixture.equipmentCleaningRequest()).getJobId();
        int updatesBefore = fixture.jobRepository.updateCount();
        int entriesBefore = fixture.auditRepository.all().size();

        SopJobDetailDTO first = fixture.queryService.getJob(jobId);
        SopJobDetailDTO second = fixture.queryService.getJob(" " + jobId + " ");

        Assertions.assertEquals(first, second);
        Assertions.assertEquals("PENDING", first.getStatus());
        Assertions.assertEquals(List.of("FDA_21_CFR_211"), first.getRegulatoryFrameworks());
        Assertions.assertEquals(updatesBefore, fixture.jobRepository.updateCount());
        Assertions.assertEquals(entriesBefore, fixture.auditRepository.all().size());
    }

    @Test
    public void shouldReportMissingJob() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> fixture.queryService.getJob("missing-job"));
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), ex.getCode());
    }

    @Test
    public void shouldFilterByDepartmentFrameworkAndStatus() {
        fixture.submitService.submit(SopPipelineFixture.equipmentCleaningRequest());
        SopJobSubmitRequestDTO qcRequest = SopPipelineFixture.equipmentCleaningRequest();
        qcRequest.setTitle("HPLC Calibration SOP");
        qcRequest.setDepartment("quality_control");
        qcRequest.setRegulatoryFrameworks(List.of("ICH_Q7", "ISO_9001"));
        String qcJobId = fixture.submitService.submit(qcRequest).getJobId();

        SopJobPageDTO byDepartment = fixture.queryService.search(query("PENDING", "quality_control", null));
        SopJobPageDTO byFramework = fixture.queryService.search(query(null, null, "ISO_9001"));
        SopJobPageDTO completed = fixture.queryService.search(query("COMPLETED", null, null));

        Assertions.assertEquals(1L, byDepartment.getTotal());
        Assertions.assertEquals(qcJobId, byDepartment.getItems().get(0).getJobId());
        Assertions.assertEquals(1L, byFramework.getTotal());
        Assertions.assertEquals("HPLC Calibration SOP", byFramework.getItems().get(0).getTitle());
        Assertions.assertEquals(0L, completed.getTotal());
        Assertions.assertEquals(2L, fixture.queryService.search(null).getTotal());
    }

    @Test
    public void shouldRejectInvertedDateRangeAndUnknownCodes() {
        LocalDateTime now = LocalDateTime.now();
        SearchQuery inverted = new SearchQuery(null, null, null, null, null, now, now.minusDays(1),
                null, null, null, null);

        AppException range = Assertions.assertThrows(AppException.class, () -> fixture.queryService.search(inverted));
        AppException status = Assertions.assertThrows(AppException.class,
                () -> fixture.queryService.search(query("DONE", null, null)));

        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), range.getCode());
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), status.getCode());
    }

    @Test
    public void shouldClampPaging() {
        SopJobPageDTO page = fixture.queryService.search(new SearchQuery(null, null, null, null, null, null, null,
                null, null, 0, 500));

        Assertions.assertEquals(1, page.getPage());
        Assertions.assertEquals(100, page.getSize());
        Assertions.assertTrue(page.getItems().isEmpty());
    }

    private SearchQuery query(String status, String department, String framework) {
        return new SearchQuery(status, department, null, framework, null, null, null, null, null, null, null);
    }
}

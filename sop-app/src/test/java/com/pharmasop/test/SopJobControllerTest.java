package com.pharmasop.test;

import com.pharmasop.api.dto.AuditEntryDTO;
import com.pharmasop.api.dto.SopJobDetailDTO;
import com.pharmasop.api.dto.SopJobPageDTO;
import com.pharmasop.api.dto.SopJobSubmitRequestDTO;
import com.pharmasop.api.dto.SopJobSubmitResultDTO;
import com.pharmasop.trigger.application.command.AuditReviewCommandService;
import com.pharmasop.trigger.application.command.SopDocumentExportService;
import com.pharmasop.trigger.application.command.SopJobLifecycleCommandService;
import com.pharmasop.trigger.application.command.SopJobReviewCommandService;
import com.pharmasop.trigger.application.command.SopJobSubmitCommandService;
import com.pharmasop.trigger.application.query.AuditTrailQueryService;
import com.pharmasop.trigger.application.query.SopJobQueryService;
import com.pharmasop.trigger.http.AuditTrailController;
import com.pharmasop.trigger.http.GlobalApiExceptionHandler;
import com.pharmasop.trigger.http.SopJobController;
import com.pharmasop.types.enums.ResponseCode;
import com.pharmasop.types.exception.AppException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class SopJobControllerTest {

    private MockMvc mockMvc;
    private SopJobSubmitCommandService submitService;
    private SopJobQueryService queryService;
    private SopJobReviewCommandService reviewService;
    private SopJobLifecycleCommandService lifecycleService;
    private AuditReviewCommandService auditReviewService;

    @BeforeEach
    public void setUp() {
        this.submitService = mock(SopJobSubmitCommandService.class);
        this.queryService = mock(SopJobQueryService.class);
        this.reviewService = mock(SopJobReviewCommandService.class);
        this.lifecycleService = mock(SopJobLifecycleCommandService.class);
        this.auditReviewService = mock(AuditReviewCommandService.class);
        AuditTrailQueryService auditTrailQueryService = mock(AuditTrailQueryService.class);

        this.mockMvc = MockMvcBuilders.standaloneSetup(
                        new SopJobController(submitService, queryService, reviewService, lifecycleService,
                                mock(SopDocumentExportService.class), auditTrailQueryService),
                        new AuditTrailController(auditTrailQueryService, auditReviewService))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldSubmitJobAndReturnPendingEnvelope() throws Exception {
        SopJobSubmitResultDTO result = new SopJobSubmitResultDTO();
        result.setJobId("job-1");
        result.setStatus("PENDING");
        result.setEstimatedCompletionMinutes(2);
        when(submitService.submit(any(SopJobSubmitRequestDTO.class))).thenReturn(result);

        mockMvc.perform(post("/api/sop-jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Equipment Cleaning SOP\",\"regulatoryFrameworks\":[\"FDA_21_CFR_211\"],"
                                + "\"sections\":[{\"title\":\"Purpose\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.jobId").value("job-1"))
                .andExpect(jsonPath("$.data.status").value("PENDING"));

        ArgumentCaptor<SopJobSubmitRequestDTO> captor = ArgumentCaptor.forClass(SopJobSubmitRequestDTO.class);
        verify(submitService).submit(captor.capture());
        assertEquals("Equipment Cleaning SOP", captor.getValue().getTitle());
        assertEquals("Purpose", captor.getValue().getSections().get(0).getTitle());
    }

    @Test
    public void shouldMapInvalidRequestToIllegalParameter() throws Exception {
        when(submitService.submit(any(SopJobSubmitRequestDTO.class)))
                .thenThrow(AppException.invalidRequest("Invalid SOP request: at least one regulatory framework is required"));

        mockMvc.perform(post("/api/sop-jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"x\",\"regulatoryFrameworks\":[]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    public void shouldMapMissingJobToNotFound() throws Exception {
        when(queryService.getJob("missing")).thenThrow(AppException.notFound("SOP job not found: missing"));

        mockMvc.perform(get("/api/sop-jobs/missing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.NOT_FOUND.getCode()))
                .andExpect(jsonPath("$.info").value("SOP job not found: missing"));
    }

    @Test
    public void shouldMapIllegalReviewToInvalidTransition() throws Exception {
        when(reviewService.review(eq("job-1"), eq("reject"), eq("qa.manager"), isNull()))
                .thenThrow(AppException.invalidTransition("Job job-1 is APPROVED and cannot be reviewed"));

        mockMvc.perform(post("/api/sop-jobs/job-1/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outcome\":\"reject\",\"reviewer\":\"qa.manager\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.INVALID_TRANSITION.getCode()));
    }

    @Test
    public void shouldPassSearchFiltersThrough() throws Exception {
        SopJobPageDTO page = new SopJobPageDTO();
        page.setItems(List.of());
        page.setTotal(0L);
        page.setPage(2);
        page.setSize(10);
        when(queryService.search(any(SopJobQueryService.SearchQuery.class))).thenReturn(page);

        mockMvc.perform(get("/api/sop-jobs")
                        .param("status", "COMPLETED")
                        .param("framework", "ICH_Q7")
                        .param("minScore", "80")
                        .param("page", "2")
                        .param("size", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.page").value(2));

        ArgumentCaptor<SopJobQueryService.SearchQuery> captor = ArgumentCaptor.forClass(SopJobQueryService.SearchQuery.class);
        verify(queryService).search(captor.capture());
        assertEquals("COMPLETED", captor.getValue().status());
        assertEquals("ICH_Q7", captor.getValue().framework());
        assertEquals(Integer.valueOf(80), captor.getValue().minScore());
        assertNull(captor.getValue().department());
    }

    @Test
    public void shouldRejectMalformedSearchParameter() throws Exception {
        mockMvc.perform(get("/api/sop-jobs").param("minScore", "high"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldCancelWithoutRequestBody() throws Exception {
        SopJobDetailDTO detail = new SopJobDetailDTO();
        detail.setJobId("job-1");
        detail.setStatus("FAILED");
        detail.setErrorKind("Cancelled");
        when(lifecycleService.cancel("job-1", null, null)).thenReturn(detail);

        mockMvc.perform(post("/api/sop-jobs/job-1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.errorKind").value("Cancelled"));
    }

    @Test
    public void shouldAcknowledgeAuditEntry() throws Exception {
        AuditEntryDTO entry = new AuditEntryDTO();
        entry.setId(7L);
        entry.setReviewedBy("auditor");
        entry.setReviewStatus("escalated");
        when(auditReviewService.acknowledge(7L, "auditor", "escalated", "needs QA head")).thenReturn(entry);

        mockMvc.perform(post("/api/audit-entries/7/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewer\":\"auditor\",\"status\":\"escalated\",\"comment\":\"needs QA head\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.reviewStatus").value("escalated"));
    }
}

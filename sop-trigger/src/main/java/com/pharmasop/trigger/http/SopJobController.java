package com.pharmasop.trigger.http;

import com.pharmasop.api.dto.AuditEntryDTO;
import com.pharmasop.api.dto.SopDocumentExportDTO;
import com.pharmasop.api.dto.SopJobActionRequestDTO;
import com.pharmasop.api.dto.SopJobDetailDTO;
import com.pharmasop.api.dto.SopJobPageDTO;
import com.pharmasop.api.dto.SopJobReviewRequestDTO;
import com.pharmasop.api.dto.SopJobSubmitRequestDTO;
import com.pharmasop.api.dto.SopJobSubmitResultDTO;
import com.pharmasop.api.response.Response;
import com.pharmasop.trigger.application.command.SopDocumentExportService;
import com.pharmasop.trigger.application.command.SopJobLifecycleCommandService;
import com.pharmasop.trigger.application.command.SopJobReviewCommandService;
import com.pharmasop.trigger.application.command.SopJobSubmitCommandService;
import com.pharmasop.trigger.application.query.AuditTrailQueryService;
import com.pharmasop.trigger.application.query.SopJobQueryService;
import com.pharmasop.types.enums.ResponseCode;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

/**
 * SOP 生成作业 API：提交、查询、审核、生命周期操作与文档导出。
 */
@RestController
@RequestMapping("/api/sop-jobs")
public class SopJobController {

    private final SopJobSubmitCommandService sopJobSubmitCommandService;
    private final SopJobQueryService sopJobQueryService;
    private final SopJobReviewCommandService sopJobReviewCommandService;
    private final SopJobLifecycleCommandService sopJobLifecycleCommandService;
    private final SopDocumentExportService sopDocumentExportService;
    private final AuditTrailQueryService auditTrailQueryService;

    public SopJobController(SopJobSubmitCommandService sopJobSubmitCommandService,
                            SopJobQueryService sopJobQueryService,
                            SopJobReviewCommandService sopJobReviewCommandService,
                            SopJobLifecycleCommandService sopJobLifecycleCommandService,
                            SopDocumentExportService sopDocumentExportService,
                            AuditTrailQueryService auditTrailQueryService) {
        this.sopJobSubmitCommandService = sopJobSubmitCommandService;
        this.sopJobQueryService = sopJobQueryService;
        this.sopJobReviewCommandService = sopJobReviewCommandService;
        this.sopJobLifecycleCommandService = sopJobLifecycleCommandService;
        this.sopDocumentExportService = sopDocumentExportService;
        this.auditTrailQueryService = auditTrailQueryService;
    }

    @PostMapping
    public Response<SopJobSubmitResultDTO> submit(@RequestBody SopJobSubmitRequestDTO request) {
        return success(sopJobSubmitCommandService.submit(request));
    }

    @GetMapping("/{jobId}")
    public Response<SopJobDetailDTO> query(@PathVariable("jobId") String jobId) {
        return success(sopJobQueryService.getJob(jobId));
    }

    @GetMapping
    public Response<SopJobPageDTO> search(@RequestParam(value = "status", required = false) String status,
                                          @RequestParam(value = "department", required = false) String department,
                                          @RequestParam(value = "priority", required = false) String priority,
                                          @RequestParam(value = "framework", required = false) String framework,
                                          @RequestParam(value = "requestedBy", required = false) String requestedBy,
                                          @RequestParam(value = "createdFrom", required = false)
                                          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime createdFrom,
                                          @RequestParam(value = "createdTo", required = false)
                                          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime createdTo,
                                          @RequestParam(value = "minScore", required = false) Integer minScore,
                                          @RequestParam(value = "includeArchived", required = false) Boolean includeArchived,
                                          @RequestParam(value = "page", required = false) Integer page,
                                          @RequestParam(value = "size", required = false) Integer size) {
        SopJobQueryService.SearchQuery query = new SopJobQueryService.SearchQuery(status, department, priority,
                framework, requestedBy, createdFrom, createdTo, minScore, includeArchived, page, size);
        return success(sopJobQueryService.search(query));
    }

    @PostMapping("/{jobId}/begin-review")
    public Response<SopJobDetailDTO> beginReview(@PathVariable("jobId") String jobId,
                                                 @RequestBody SopJobReviewRequestDTO request) {
        return success(sopJobReviewCommandService.beginReview(jobId, request == null ? null : request.getReviewer()));
    }

    @PostMapping("/{jobId}/review")
    public Response<SopJobDetailDTO> review(@PathVariable("jobId") String jobId,
                                            @RequestBody SopJobReviewRequestDTO request) {
        if (request == null) {
            return illegal("review request body is required");
        }
        return success(sopJobReviewCommandService.review(jobId, request.getOutcome(), request.getReviewer(),
                request.getComment()));
    }

    @PostMapping("/{jobId}/cancel")
    public Response<SopJobDetailDTO> cancel(@PathVariable("jobId") String jobId,
                                            @RequestBody(required = false) SopJobActionRequestDTO request) {
        return success(sopJobLifecycleCommandService.cancel(jobId, actor(request), request == null ? null : request.getReason()));
    }

    @PostMapping("/{jobId}/resubmit")
    public Response<SopJobSubmitResultDTO> resubmit(@PathVariable("jobId") String jobId,
                                                    @RequestBody(required = false) SopJobActionRequestDTO request) {
        return success(sopJobLifecycleCommandService.resubmit(jobId, actor(request)));
    }

    @PostMapping("/{jobId}/archive")
    public Response<SopJobDetailDTO> archive(@PathVariable("jobId") String jobId,
                                             @RequestBody(required = false) SopJobActionRequestDTO request) {
        return success(sopJobLifecycleCommandService.archive(jobId, actor(request)));
    }

    @GetMapping("/{jobId}/document")
    public Response<SopDocumentExportDTO> exportDocument(@PathVariable("jobId") String jobId,
                                                         @RequestParam(value = "actor", required = false) String actor) {
        return success(sopDocumentExportService.export(jobId, actor));
    }

    @GetMapping("/{jobId}/audit-entries")
    public Response<List<AuditEntryDTO>> auditTrail(@PathVariable("jobId") String jobId) {
        return success(auditTrailQueryService.listJobTrail(jobId));
    }

    private String actor(SopJobActionRequestDTO request) {
        return request == null ? null : request.getActor();
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

    private <T> Response<T> illegal(String info) {
        return Response.<T>builder()
                .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                .info(info)
                .build();
    }
}

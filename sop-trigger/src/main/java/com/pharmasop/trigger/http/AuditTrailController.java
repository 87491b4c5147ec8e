package com.pharmasop.trigger.http;

import com.pharmasop.api.dto.AuditEntryAcknowledgeRequestDTO;
import com.pharmasop.api.dto.AuditEntryDTO;
import com.pharmasop.api.response.Response;
import com.pharmasop.trigger.application.command.AuditReviewCommandService;
import com.pharmasop.trigger.application.query.AuditTrailQueryService;
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
 * 审计追踪 API：条件导出与复核确认。
 */
@RestController
@RequestMapping("/api/audit-entries")
public class AuditTrailController {

    private final AuditTrailQueryService auditTrailQueryService;
    private final AuditReviewCommandService auditReviewCommandService;

    public AuditTrailController(AuditTrailQueryService auditTrailQueryService,
                                AuditReviewCommandService auditReviewCommandService) {
        this.auditTrailQueryService = auditTrailQueryService;
        this.auditReviewCommandService = auditReviewCommandService;
    }

    @GetMapping
    public Response<List<AuditEntryDTO>> export(@RequestParam(value = "resourceType", required = false) String resourceType,
                                                @RequestParam(value = "resourceId", required = false) String resourceId,
                                                @RequestParam(value = "actor", required = false) String actor,
                                                @RequestParam(value = "action", required = false) String action,
                                                @RequestParam(value = "severity", required = false) String severity,
                                                @RequestParam(value = "from", required = false)
                                                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
                                                @RequestParam(value = "to", required = false)
                                                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
                                                @RequestParam(value = "requiresReview", required = false) Boolean requiresReview,
                                                @RequestParam(value = "pendingReview", required = false) Boolean pendingReview,
                                                @RequestParam(value = "limit", required = false) Integer limit,
                                                @RequestParam(value = "offset", required = false) Integer offset) {
        AuditTrailQueryService.ExportQuery query = new AuditTrailQueryService.ExportQuery(resourceType, resourceId,
                actor, action, severity, from, to, requiresReview, pendingReview, limit, offset);
        return Response.<List<AuditEntryDTO>>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(auditTrailQueryService.export(query))
                .build();
    }

    @PostMapping("/{id}/acknowledge")
    public Response<AuditEntryDTO> acknowledge(@PathVariable("id") Long entryId,
                                               @RequestBody AuditEntryAcknowledgeRequestDTO request) {
        if (request == null) {
            return Response.<AuditEntryDTO>builder()
                    .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                    .info("acknowledge request body is required")
                    .build();
        }
        AuditEntryDTO entry = auditReviewCommandService.acknowledge(entryId, request.getReviewer(),
                request.getStatus(), request.getComment());
        return Response.<AuditEntryDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(entry)
                .build();
    }
}

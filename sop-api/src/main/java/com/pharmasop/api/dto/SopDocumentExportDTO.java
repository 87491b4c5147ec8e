package com.pharmasop.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * SOP 文档导出结果 DTO。
 */
@Data
public class SopDocumentExportDTO {

    private String jobId;
    private String fileName;
    private String mediaType;
    private String content;
    private LocalDateTime renderedAt;
}

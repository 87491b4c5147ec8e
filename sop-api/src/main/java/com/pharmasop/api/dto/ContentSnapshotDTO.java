package com.pharmasop.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 生成内容快照 DTO。
 */
@Data
public class ContentSnapshotDTO {

    private List<ContentSectionDTO> sections;
    private Integer wordCount;
    private Integer sectionCount;
    private LocalDateTime generatedAt;
    private String engineId;
    private String contentHash;
}

package com.pharmasop.domain.sop.model.valobj;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 生成内容快照值对象
 * <p>
 * 归属于单个作业，重新生成时整体替换，不做局部修改。
 * contentHash 用于在审计记录中引用上一版快照。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Data
public class ContentSnapshot {

    /**
     * 按请求顺序排列的章节
     */
    private List<ContentSection> sections = new ArrayList<>();

    private int wordCount;

    private int sectionCount;

    private LocalDateTime generatedAt;

    /**
     * 生成引擎标识
     */
    private String engineId;

    /**
     * 正文 SHA-256 摘要（十六进制）
     */
    private String contentHash;

    public int countGeneratedSections() {
        if (sections == null) {
            return 0;
        }
        int count = 0;
        for (ContentSection section : sections) {
            if (section != null && !section.isPlaceholder()) {
                count++;
            }
        }
        return count;
    }

    public List<String> placeholderTitles() {
        List<String> titles = new ArrayList<>();
        if (sections == null) {
            return titles;
        }
        for (ContentSection section : sections) {
            if (section != null && section.isPlaceholder()) {
                titles.add(section.getTitle());
            }
        }
        return titles;
    }
}

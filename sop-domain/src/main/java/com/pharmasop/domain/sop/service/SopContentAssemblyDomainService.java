package com.pharmasop.domain.sop.service;

import com.pharmasop.domain.sop.model.valobj.ContentSection;
import com.pharmasop.domain.sop.model.valobj.ContentSnapshot;
import com.pharmasop.domain.sop.model.valobj.SopSectionSpec;
import com.pharmasop.types.common.Constants;
import com.pharmasop.types.common.HashUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 内容快照组装领域服务：按请求章节顺序对齐正文，缺失章节以占位正文补齐，并计算字数、章节数与摘要。
 */
@Service
public class SopContentAssemblyDomainService {

    /**
     * 按请求章节组装快照，bodiesByTitle 的键不区分大小写。
     */
    public ContentSnapshot assemble(List<SopSectionSpec> requestedSections,
                                    Map<String, String> bodiesByTitle,
                                    String engineId) {
        Map<String, String> normalizedBodies = new LinkedHashMap<>();
        if (bodiesByTitle != null) {
            for (Map.Entry<String, String> entry : bodiesByTitle.entrySet()) {
                if (entry.getKey() == null) {
                    continue;
                }
                normalizedBodies.putIfAbsent(normalizeTitle(entry.getKey()), entry.getValue());
            }
        }
        List<ContentSection> sections = new ArrayList<>();
        if (requestedSections != null) {
            for (SopSectionSpec spec : requestedSections) {
                if (spec == null || spec.getTitle() == null) {
                    continue;
                }
                String title = spec.getTitle().trim();
                String body = normalizedBodies.get(normalizeTitle(title));
                if (hasText(body)) {
                    sections.add(new ContentSection(title, body.trim(), false));
                } else {
                    sections.add(new ContentSection(title, placeholderBody(title), true));
                }
            }
        }
        ContentSnapshot snapshot = new ContentSnapshot();
        snapshot.setSections(sections);
        snapshot.setEngineId(engineId);
        snapshot.setGeneratedAt(LocalDateTime.now());
        refreshStatistics(snapshot);
        return snapshot;
    }

    /**
     * 将任意来源的快照对齐到请求章节：保留已有正文，补齐缺失章节，丢弃未请求的章节。
     */
    public ContentSnapshot alignToRequest(List<SopSectionSpec> requestedSections, ContentSnapshot source, String engineId) {
        Map<String, String> bodies = new LinkedHashMap<>();
        if (source != null && source.getSections() != null) {
            for (ContentSection section : source.getSections()) {
                if (section == null || section.getTitle() == null || section.isPlaceholder()) {
                    continue;
                }
                bodies.putIfAbsent(section.getTitle(), section.getBody());
            }
        }
        String resolvedEngineId = source != null && hasText(source.getEngineId()) ? source.getEngineId() : engineId;
        ContentSnapshot aligned = assemble(requestedSections, bodies, resolvedEngineId);
        if (source != null && source.getGeneratedAt() != null) {
            aligned.setGeneratedAt(source.getGeneratedAt());
        }
        return aligned;
    }

    public String placeholderBody(String sectionTitle) {
        return String.format(Constants.PLACEHOLDER_BODY_TEMPLATE, sectionTitle);
    }

    private void refreshStatistics(ContentSnapshot snapshot) {
        int words = 0;
        StringBuilder digestSource = new StringBuilder();
        for (ContentSection section : snapshot.getSections()) {
            if (!section.isPlaceholder()) {
                words += countWords(section.getBody());
            }
            digestSource.append(section.getTitle()).append('\n').append(section.getBody()).append('\n');
        }
        snapshot.setWordCount(words);
        snapshot.setSectionCount(snapshot.getSections().size());
        snapshot.setContentHash(HashUtils.sha256Hex(digestSource.toString()));
    }

    private int countWords(String text) {
        if (!hasText(text)) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    private String normalizeTitle(String title) {
        return title.trim().toLowerCase(Locale.ROOT);
    }

    private boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}

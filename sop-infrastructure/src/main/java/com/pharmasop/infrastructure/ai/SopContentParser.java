package com.pharmasop.infrastructure.ai;

import com.pharmasop.domain.sop.model.valobj.SopSectionSpec;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 引擎输出解析器：按标题行把正文切分到请求章节。
 * <p>
 * 识别 Markdown 标题（#..######）、编号标题（"1. Purpose"、"1) Purpose"）与独占一行的 "PURPOSE:" 形式。
 * 未请求的标题（如章节内的子标题）连同其正文归入当前章节；只有第一个识别到的章节标题之前的文字被丢弃。
 * </p>
 */
@Component
public class SopContentParser {

    private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#{1,6}\\s+(.+?)\\s*#*$");
    private static final Pattern NUMBERED_HEADING = Pattern.compile("^(?:\\d+(?:\\.\\d+)*[.)]?)\\s+(.+)$");
    private static final Pattern BOLD = Pattern.compile("^\\*\\*(.+?)\\*\\*:?$");

    /**
     * @return 以请求章节标题为键的正文，只包含识别到的章节
     */
    public Map<String, String> parse(String content, List<SopSectionSpec> requestedSections) {
        Map<String, String> titleIndex = new HashMap<>();
        if (requestedSections != null) {
            for (SopSectionSpec section : requestedSections) {
                if (section != null && StringUtils.isNotBlank(section.getTitle())) {
                    titleIndex.put(normalize(section.getTitle()), section.getTitle().trim());
                }
            }
        }
        Map<String, String> bodies = new LinkedHashMap<>();
        if (StringUtils.isBlank(content) || titleIndex.isEmpty()) {
            return bodies;
        }

        String currentTitle = null;
        List<String> buffer = new ArrayList<>();
        for (String rawLine : content.split("\\r?\\n")) {
            String line = rawLine.trim();
            String headingText = extractHeading(line);
            String matchedTitle = headingText == null ? null : titleIndex.get(normalize(headingText));
            if (matchedTitle != null) {
                flush(bodies, currentTitle, buffer);
                currentTitle = matchedTitle;
                buffer = new ArrayList<>();
                continue;
            }
            if (currentTitle != null) {
                buffer.add(rawLine);
            }
        }
        flush(bodies, currentTitle, buffer);
        return bodies;
    }

    private void flush(Map<String, String> bodies, String title, List<String> buffer) {
        if (title == null) {
            return;
        }
        String body = String.join("\n", buffer).trim();
        if (body.isEmpty()) {
            return;
        }
        bodies.merge(title, body, (left, right) -> left + "\n\n" + right);
    }

    private String extractHeading(String line) {
        if (line.isEmpty()) {
            return null;
        }
        Matcher markdown = MARKDOWN_HEADING.matcher(line);
        if (markdown.matches()) {
            return stripNumbering(markdown.group(1));
        }
        Matcher bold = BOLD.matcher(line);
        if (bold.matches()) {
            return stripNumbering(bold.group(1));
        }
        Matcher numbered = NUMBERED_HEADING.matcher(line);
        if (numbered.matches()) {
            return numbered.group(1);
        }
        if (line.endsWith(":") && line.length() <= 80) {
            return line.substring(0, line.length() - 1);
        }
        // 无标记的裸行只有全大写时才视为标题，避免正文中恰好等于章节名的句子被切断
        return isUpperCaseHeading(line) ? line : null;
    }

    private boolean isUpperCaseHeading(String line) {
        return line.length() <= 80
                && line.chars().anyMatch(Character::isLetter)
                && line.equals(line.toUpperCase(Locale.ROOT));
    }

    private String stripNumbering(String text) {
        Matcher numbered = NUMBERED_HEADING.matcher(text.trim());
        return numbered.matches() ? numbered.group(1) : text.trim();
    }

    private String normalize(String title) {
        String normalized = title.trim().toLowerCase(Locale.ROOT)
                .replace("*", "")
                .replaceAll("[:：]+$", "")
                .replaceAll("\\s+", " ");
        return normalized.trim();
    }
}

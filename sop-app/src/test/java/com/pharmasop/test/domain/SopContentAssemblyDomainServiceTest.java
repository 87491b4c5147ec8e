package com.pharmasop.test.domain;

import com.pharmasop.domain.sop.model.valobj.ContentSection;
import com.pharmasop.domain.sop.model.valobj.ContentSnapshot;
import com.pharmasop.domain.sop.model.valobj.SopSectionSpec;
import com.pharmasop.domain.sop.service.SopContentAssemblyDomainService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SopContentAssemblyDomainServiceTest {

    private final SopContentAssemblyDomainService service = new SopContentAssemblyDomainService();

    private final List<SopSectionSpec> sections = List.of(
            new SopSectionSpec("Purpose", null),
            new SopSectionSpec("Procedure", "step by step"));

    @Test
    public void shouldFollowRequestedOrderAndFillPlaceholders() {
        Map<String, String> bodies = new LinkedHashMap<>();
        bodies.put("PURPOSE", "Describe the cleaning process in detail");
        bodies.put("Appendix", "not requested");

        ContentSnapshot snapshot = service.assemble(sections, bodies, "engine-a");

        Assertions.assertEquals(2, snapshot.getSectionCount());
        ContentSection purpose = snapshot.getSections().get(0);
        ContentSection procedure = snapshot.getSections().get(1);
        Assertions.assertEquals("Purpose", purpose.getTitle());
        Assertions.assertFalse(purpose.isPlaceholder());
        Assertions.assertTrue(procedure.isPlaceholder());
        Assertions.assertEquals("[Generated content for Procedure section - please review and complete]",
                procedure.getBody());
        Assertions.assertEquals(6, snapshot.getWordCount());
        Assertions.assertEquals(List.of("Procedure"), snapshot.placeholderTitles());
        Assertions.assertEquals(64, snapshot.getContentHash().length());
    }

    @Test
    public void shouldProduceStableHashForSameContent() {
        Map<String, String> bodies = Map.of("Purpose", "A", "Procedure", "B");

        String first = service.assemble(sections, bodies, "engine").getContentHash();
        String second = service.assemble(sections, bodies, "engine").getContentHash();
        String changed = service.assemble(sections, Map.of("Purpose", "A", "Procedure", "C"), "engine").getContentHash();

        Assertions.assertEquals(first, second);
        Assertions.assertNotEquals(first, changed);
    }

    @Test
    public void shouldAlignForeignSnapshotToRequest() {
        ContentSnapshot source = new ContentSnapshot();
        source.setEngineId("upstream");
        source.setSections(new ArrayList<>(List.of(
                new ContentSection("Scope", "extra section", false),
                new ContentSection("Procedure", "1. Disassemble", false))));

        ContentSnapshot aligned = service.alignToRequest(sections, source, "fallback");

        Assertions.assertEquals("upstream", aligned.getEngineId());
        Assertions.assertEquals(2, aligned.getSections().size());
        Assertions.assertTrue(aligned.getSections().get(0).isPlaceholder());
        Assertions.assertEquals("1. Disassemble", aligned.getSections().get(1).getBody());
        Assertions.assertEquals(1, aligned.countGeneratedSections());
    }
}

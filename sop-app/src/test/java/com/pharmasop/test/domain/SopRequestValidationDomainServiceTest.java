package com.pharmasop.test.domain;

import com.pharmasop.domain.sop.model.valobj.SopJobSubmitCommand;
import com.pharmasop.domain.sop.model.valobj.SopSectionSpec;
import com.pharmasop.domain.sop.service.SopRequestValidationDomainService;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import com.pharmasop.types.enums.ResponseCode;
import com.pharmasop.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class SopRequestValidationDomainServiceTest {

    private final SopRequestValidationDomainService service = new SopRequestValidationDomainService();

    @Test
    public void shouldAcceptMinimalValidCommand() {
        Assertions.assertTrue(service.collectViolations(validCommand()).isEmpty());
        Assertions.assertDoesNotThrow(() -> service.requireValid(validCommand()));
    }

    @Test
    public void shouldRejectZeroFrameworks() {
        SopJobSubmitCommand command = validCommand();
        command.setRegulatoryFrameworks(new ArrayList<>());

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.requireValid(command));

        Assertions.assertTrue(ex.hasCode(ResponseCode.ILLEGAL_PARAMETER));
        Assertions.assertTrue(ex.getInfo().contains("regulatory framework"));
    }

    @Test
    public void shouldCollectEveryViolation() {
        SopJobSubmitCommand command = new SopJobSubmitCommand();
        command.setTitle(" ");

        List<String> violations = service.collectViolations(command);

        Assertions.assertEquals(5, violations.size());
        Assertions.assertTrue(violations.contains("title is required"));
        Assertions.assertTrue(violations.contains("at least one section is required"));
    }

    @Test
    public void shouldRejectDuplicateSectionTitlesIgnoringCase() {
        SopJobSubmitCommand command = validCommand();
        command.getSections().add(new SopSectionSpec("  purpose ", null));

        List<String> violations = service.collectViolations(command);

        Assertions.assertEquals(List.of("duplicate section title: purpose"), violations);
    }

    @Test
    public void shouldRejectOverlongTitle() {
        SopJobSubmitCommand command = validCommand();
        command.setTitle("x".repeat(SopRequestValidationDomainService.TITLE_MAX_LENGTH + 1));

        Assertions.assertEquals(1, service.collectViolations(command).size());
    }

    private SopJobSubmitCommand validCommand() {
        SopJobSubmitCommand command = new SopJobSubmitCommand();
        command.setTitle("Line Clearance");
        command.setDescription("Clearance of packaging lines");
        command.setRegulatoryFrameworks(new ArrayList<>(List.of(RegulatoryFrameworkEnum.EMA_GMP)));
        command.setSections(new ArrayList<>(List.of(new SopSectionSpec("Purpose", null))));
        command.setRequestedBy("packaging.lead");
        return command;
    }
}

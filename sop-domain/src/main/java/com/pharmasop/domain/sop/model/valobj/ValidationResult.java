package com.pharmasop.domain.sop.model.valobj;

import com.pharmasop.types.enums.CheckOutcomeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 合规校验结果值对象
 * <p>
 * score 取值 [0, 100]；indicators 以合规维度编码为键。
 * 重新生成时被新结果取代，不原地修改。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Data
public class ValidationResult {

    private int score;

    private List<ComplianceCheck> checks = new ArrayList<>();

    private Map<String, CheckOutcomeEnum> indicators = new LinkedHashMap<>();

    private List<String> issues = new ArrayList<>();

    private LocalDateTime validatedAt;

    public boolean hasFailures() {
        return countOutcome(CheckOutcomeEnum.FAIL) > 0;
    }

    public long countOutcome(CheckOutcomeEnum outcome) {
        if (checks == null) {
            return 0;
        }
        return checks.stream()
                .filter(check -> check != null && check.getOutcome() == outcome)
                .count();
    }
}

package com.pharmasop.domain.sop.model.valobj;

import com.pharmasop.types.enums.CheckOutcomeEnum;
import com.pharmasop.types.enums.ComplianceDimensionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单项合规检查结果值对象。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceCheck {

    private ComplianceDimensionEnum dimension;
    private String name;
    private CheckOutcomeEnum outcome;
    private String message;

    public static ComplianceCheck of(ComplianceDimensionEnum dimension, CheckOutcomeEnum outcome, String message) {
        return new ComplianceCheck(dimension, dimension.getCheckName(), outcome, message);
    }
}

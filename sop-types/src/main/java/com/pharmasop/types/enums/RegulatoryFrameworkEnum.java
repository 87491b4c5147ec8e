package com.pharmasop.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 法规框架枚举
 * <p>
 * 作为封闭集合被请求校验、合规校验、提示词构建共享。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public enum RegulatoryFrameworkEnum {

    /**
     * 美国 FDA 药品 cGMP
     */
    FDA_21_CFR_211("FDA_21_CFR_211", "FDA 21 CFR Part 211"),

    /**
     * 原料药 GMP
     */
    ICH_Q7("ICH_Q7", "ICH Q7"),

    /**
     * 药品质量体系
     */
    ICH_Q10("ICH_Q10", "ICH Q10"),

    WHO_GMP("WHO_GMP", "WHO GMP"),

    EMA_GMP("EMA_GMP", "EMA GMP"),

    ISO_9001("ISO_9001", "ISO 9001"),

    ISO_14001("ISO_14001", "ISO 14001"),

    /**
     * 医疗器械质量管理
     */
    ISO_13485("ISO_13485", "ISO 13485");

    private final String code;
    private final String label;

    RegulatoryFrameworkEnum(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public static RegulatoryFrameworkEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (RegulatoryFrameworkEnum framework : RegulatoryFrameworkEnum.values()) {
            if (framework.code.equalsIgnoreCase(code)) {
                return framework;
            }
        }
        throw new IllegalArgumentException("Unknown regulatory framework code: " + code);
    }
}

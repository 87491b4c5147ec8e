package com.pharmasop.config;

import com.pharmasop.domain.sop.model.valobj.SopGenerationPolicy;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 生成流水线策略装配：重试次数、退避、单次调用超时、处理租约与合规基线框架。
 */
@Slf4j
@Configuration
public class SopPipelineConfig {

    @Bean
    public SopGenerationPolicy sopGenerationPolicy(
            @Value("${sop.pipeline.max-attempts:3}") int maxAttempts,
            @Value("${sop.pipeline.initial-backoff-ms:1000}") long initialBackoffMs,
            @Value("${sop.pipeline.backoff-multiplier:2.0}") double backoffMultiplier,
            @Value("${sop.pipeline.max-backoff-ms:30000}") long maxBackoffMs,
            @Value("${sop.pipeline.attempt-timeout-seconds:90}") long attemptTimeoutSeconds,
            @Value("${sop.pipeline.processing-lease-seconds:900}") long processingLeaseSeconds,
            @Value("${sop.pipeline.baseline-framework:FDA_21_CFR_211}") String baselineFramework) {
        SopGenerationPolicy policy = new SopGenerationPolicy(
                maxAttempts,
                initialBackoffMs,
                backoffMultiplier,
                maxBackoffMs,
                attemptTimeoutSeconds > 0 ? attemptTimeoutSeconds * 1000L : 0L,
                processingLeaseSeconds,
                parseFramework(baselineFramework));
        log.info("SOP generation policy loaded. maxAttempts={}, initialBackoffMs={}, multiplier={}, attemptTimeoutMs={}, leaseSeconds={}, baseline={}",
                policy.getMaxAttempts(), policy.getInitialBackoffMs(), policy.getBackoffMultiplier(),
                policy.getAttemptTimeoutMs(), policy.getProcessingLeaseSeconds(), policy.getBaselineFramework());
        return policy;
    }

    private RegulatoryFrameworkEnum parseFramework(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        try {
            return RegulatoryFrameworkEnum.fromCode(code.trim());
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown baseline framework '{}', fallback to default", code);
            return null;
        }
    }
}

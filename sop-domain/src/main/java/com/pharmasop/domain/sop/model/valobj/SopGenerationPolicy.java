package com.pharmasop.domain.sop.model.valobj;

import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import lombok.Getter;

/**
 * 生成重试与合规基线策略。
 * <p>
 * 第 n 次失败后的退避时长为 initialBackoffMs * multiplier^(n-1)，上限 maxBackoffMs。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Getter
public class SopGenerationPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final double backoffMultiplier;
    private final long maxBackoffMs;
    private final long attemptTimeoutMs;
    private final long processingLeaseSeconds;
    private final RegulatoryFrameworkEnum baselineFramework;

    public SopGenerationPolicy(int maxAttempts,
                               long initialBackoffMs,
                               double backoffMultiplier,
                               long maxBackoffMs,
                               long attemptTimeoutMs,
                               long processingLeaseSeconds,
                               RegulatoryFrameworkEnum baselineFramework) {
        this.maxAttempts = maxAttempts > 0 ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
        this.initialBackoffMs = Math.max(initialBackoffMs, 0L);
        this.backoffMultiplier = backoffMultiplier >= 1.0D ? backoffMultiplier : 2.0D;
        this.maxBackoffMs = maxBackoffMs > 0 ? maxBackoffMs : 30000L;
        this.attemptTimeoutMs = attemptTimeoutMs > 0 ? attemptTimeoutMs : 90000L;
        this.processingLeaseSeconds = processingLeaseSeconds > 0 ? processingLeaseSeconds : 900L;
        this.baselineFramework = baselineFramework == null ? RegulatoryFrameworkEnum.FDA_21_CFR_211 : baselineFramework;
    }

    public static SopGenerationPolicy defaults() {
        return new SopGenerationPolicy(DEFAULT_MAX_ATTEMPTS, 1000L, 2.0D, 30000L, 90000L, 900L,
                RegulatoryFrameworkEnum.FDA_21_CFR_211);
    }

    /**
     * 第 failedAttempt 次失败后、下一次尝试前的等待时长。
     */
    public long backoffMillis(int failedAttempt) {
        if (failedAttempt <= 0 || initialBackoffMs <= 0) {
            return 0L;
        }
        double delay = initialBackoffMs * Math.pow(backoffMultiplier, failedAttempt - 1);
        return (long) Math.min(delay, (double) maxBackoffMs);
    }
}

package com.pharmasop.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 作业线程池配置属性，前缀 sop。
 * <p>
 * worker 承载作业推进（每个作业占用一个线程直至终态），
 * generation-call 承载单次引擎调用，便于按截止时间中断。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "sop", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    private Pool worker = new Pool(4, 8, 60L, 100, "AbortPolicy", "sop-job-worker-");

    private Pool generationCall = new Pool(4, 8, 60L, 0, "AbortPolicy", "sop-generation-call-");

    @Data
    public static class Pool {

        /** 核心线程数 */
        private Integer coreSize;

        /** 最大线程数 */
        private Integer maxSize;

        /** 空闲线程存活时间（秒） */
        private Long keepAliveSeconds;

        /** 队列容量，0 表示直接交接 */
        private Integer queueCapacity;

        /**
         * 拒绝策略：AbortPolicy、DiscardPolicy、DiscardOldestPolicy、CallerRunsPolicy
         */
        private String rejectionPolicy;

        private String threadNamePrefix;

        public Pool() {
        }

        public Pool(Integer coreSize, Integer maxSize, Long keepAliveSeconds, Integer queueCapacity,
                    String rejectionPolicy, String threadNamePrefix) {
            this.coreSize = coreSize;
            this.maxSize = maxSize;
            this.keepAliveSeconds = keepAliveSeconds;
            this.queueCapacity = queueCapacity;
            this.rejectionPolicy = rejectionPolicy;
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}

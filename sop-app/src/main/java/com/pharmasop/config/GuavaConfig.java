package com.pharmasop.config;

import com.google.common.util.concurrent.Striped;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.locks.Lock;

/**
 * Guava 配置类。
 * <p>
 * 作业级互斥锁按作业 ID 分段（lazy weak stripes），内存占用与活跃作业数成正比。
 * </p>
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "sopJobLockStripes")
    public Striped<Lock> sopJobLockStripes(@Value("${sop.pipeline.lock.stripes:1024}") int stripes) {
        return Striped.lazyWeakLock(stripes > 0 ? stripes : 1024);
    }

}

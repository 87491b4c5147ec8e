package com.pharmasop.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * HTTP 链路日志配置，前缀 sop.http-log。
 */
@Data
@Component
@ConfigurationProperties(prefix = "sop.http-log")
public class HttpTraceLogProperties {

    private boolean enabled = true;

    /** 成功请求的采样率，异常与慢请求总是记录 */
    private double sampleRate = 1.0D;

    private long slowRequestThresholdMs = 1500L;

    private List<String> includePathPatterns = new ArrayList<>(List.of("/api/**"));

    private List<String> excludePathPatterns = new ArrayList<>(List.of("/actuator/**"));

    /** 查询参数中需要打码的字段 */
    private List<String> maskFields = new ArrayList<>(List.of("token", "apiKey", "authorization"));

}

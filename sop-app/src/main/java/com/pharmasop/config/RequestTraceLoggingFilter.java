package com.pharmasop.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * HTTP 链路日志过滤器。
 * <p>
 * 为每个请求建立 traceId/requestId（优先沿用请求头），写入 MDC 并回写响应头；
 * 请求结束时输出 HTTP_OUT，附带响应信封中的业务码，便于与 HTTP_ERROR 日志关联。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final String MDC_HTTP_PATH = "httpPath";
    private static final String MDC_HTTP_METHOD = "httpMethod";

    private final ObjectMapper objectMapper;
    private final HttpTraceLogProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(ObjectMapper objectMapper, HttpTraceLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/");
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includes = properties.getIncludePathPatterns();
        return includes != null && !includes.isEmpty() && !matchesAny(path, includes);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = headerOrNewId(request.getHeader(HEADER_TRACE_ID));
        String requestId = headerOrNewId(request.getHeader(HEADER_REQUEST_ID));
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/");
        String method = request.getMethod();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_HTTP_PATH, path);
        MDC.put(MDC_HTTP_METHOD, method);

        ContentCachingResponseWrapper responseWrapper = response instanceof ContentCachingResponseWrapper wrapper
                ? wrapper
                : new ContentCachingResponseWrapper(response);
        boolean sampled = sampled();
        if (sampled) {
            log.info("HTTP_IN method={}, path={}, query={}", method, path, maskQuery(request.getQueryString()));
        }

        long startNs = System.nanoTime();
        Throwable error = null;
        try {
            filterChain.doFilter(request, responseWrapper);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            boolean slow = costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L);
            String responseCode = StringUtils.defaultIfBlank(envelopeCode(responseWrapper), "-");
            if (error != null) {
                log.warn("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, errorType={}, errorMessage={}",
                        method, path, responseWrapper.getStatus(), responseCode, costMs,
                        error.getClass().getSimpleName(), StringUtils.abbreviate(error.getMessage(), 200));
            } else if (sampled || slow) {
                log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, slow={}",
                        method, path, responseWrapper.getStatus(), responseCode, costMs, slow);
            }
            responseWrapper.copyBodyToResponse();
            MDC.remove(MDC_HTTP_METHOD);
            MDC.remove(MDC_HTTP_PATH);
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String headerOrNewId(String value) {
        return StringUtils.isNotBlank(value) ? value.trim() : UUID.randomUUID().toString().replace("-", "");
    }

    private boolean sampled() {
        double rate = properties.getSampleRate();
        if (rate <= 0D) {
            return false;
        }
        return rate >= 1D || ThreadLocalRandom.current().nextDouble() <= rate;
    }

    /**
     * 读取响应信封中的 code 字段；非 JSON 或无法解析时返回 null。
     */
    private String envelopeCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        String contentType = responseWrapper.getContentType();
        if (body.length == 0 || StringUtils.isBlank(contentType)
                || !contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE)) {
            return null;
        }
        try {
            JsonNode code = objectMapper.readTree(body).get("code");
            return code == null || code.isNull() ? null : code.asText();
        } catch (IOException ex) {
            log.debug("Response body is not a JSON envelope. error={}", ex.getMessage());
            return null;
        }
    }

    private String maskQuery(String queryString) {
        if (StringUtils.isBlank(queryString)) {
            return "-";
        }
        List<String> parts = new ArrayList<>();
        for (String part : queryString.split("&")) {
            if (StringUtils.isBlank(part)) {
                continue;
            }
            String[] kv = part.split("=", 2);
            if (isMaskField(kv[0])) {
                parts.add(kv[0] + "=***");
            } else {
                parts.add(kv[0] + "=" + StringUtils.abbreviate(kv.length > 1 ? kv[1] : "", 80));
            }
        }
        return parts.isEmpty() ? "-" : String.join("&", parts);
    }

    private boolean isMaskField(String key) {
        List<String> maskFields = properties.getMaskFields();
        if (StringUtils.isBlank(key) || maskFields == null) {
            return false;
        }
        for (String field : maskFields) {
            if (StringUtils.equalsIgnoreCase(StringUtils.trim(field), key.trim())) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }
}

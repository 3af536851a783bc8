package com.convoagent.config;

import com.convoagent.types.common.Constants;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 统一 HTTP 链路日志过滤器：分配或透传 X-Trace-Id / X-Request-Id，写入 MDC，请求结束时清理。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    private static final String HEADER_TRACE_ID = "X-Trace-Id";
    private static final String HEADER_REQUEST_ID = "X-Request-Id";

    private final ObservabilityHttpLogProperties properties;
    private final AntPathMatcher pathMatcher;

    public RequestTraceLoggingFilter(ObservabilityHttpLogProperties properties) {
        this.properties = properties;
        this.pathMatcher = new AntPathMatcher();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null || !properties.isEnabled()) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includePatterns = properties.getIncludePathPatterns();
        if (includePatterns == null || includePatterns.isEmpty()) {
            return false;
        }
        return !matchesAny(path, includePatterns);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreateHeader(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreateHeader(request.getHeader(HEADER_REQUEST_ID));
        String path = normalizePath(request.getRequestURI());
        String method = request.getMethod();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(Constants.MDC_TRACE_ID, traceId);
        MDC.put(Constants.MDC_REQUEST_ID, requestId);

        long startNs = System.nanoTime();
        boolean sampled = shouldSample();
        if (sampled) {
            log.info("HTTP_IN method={}, path={}, query={}, clientIp={}",
                    method,
                    path,
                    sanitizeQuery(request.getQueryString()),
                    resolveClientIp(request));
        }

        Throwable error = null;
        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            boolean slowRequest = costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L);
            if (error != null) {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                        method,
                        path,
                        response.getStatus(),
                        costMs,
                        error.getClass().getSimpleName(),
                        truncate(error.getMessage(), 200));
            } else if (sampled || slowRequest) {
                log.info("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=success, slow={}",
                        method,
                        path,
                        response.getStatus(),
                        costMs,
                        slowRequest);
            }
            MDC.remove(Constants.MDC_REQUEST_ID);
            MDC.remove(Constants.MDC_TRACE_ID);
        }
    }

    private String resolveOrCreateHeader(String value) {
        if (StringUtils.isNotBlank(value)) {
            return truncate(value.trim(), 128);
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private boolean shouldSample() {
        double rate = properties.getSampleRate();
        if (rate <= 0D) {
            return false;
        }
        if (rate >= 1D) {
            return true;
        }
        return ThreadLocalRandom.current().nextDouble() <= rate;
    }

    private String sanitizeQuery(String queryString) {
        if (StringUtils.isBlank(queryString)) {
            return "-";
        }
        List<String> sanitized = new ArrayList<>();
        for (String part : queryString.split("&")) {
            if (StringUtils.isBlank(part)) {
                continue;
            }
            String[] kv = part.split("=", 2);
            if (isMaskField(kv[0])) {
                sanitized.add(kv[0] + "=***");
            } else {
                sanitized.add(kv[0] + "=" + truncate(kv.length > 1 ? kv[1] : "", 80));
            }
        }
        return sanitized.isEmpty() ? "-" : String.join("&", sanitized);
    }

    private boolean isMaskField(String key) {
        List<String> maskFields = properties.getMaskFields();
        if (StringUtils.isBlank(key) || maskFields == null) {
            return false;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (String maskField : maskFields) {
            if (StringUtils.isNotBlank(maskField) && normalized.equals(maskField.trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.isNotBlank(forwarded)) {
            String first = forwarded.split(",")[0];
            if (StringUtils.isNotBlank(first)) {
                return first.trim();
            }
        }
        return StringUtils.defaultIfBlank(request.getRemoteAddr(), "unknown");
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (StringUtils.isBlank(path) || patterns == null || patterns.isEmpty()) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }

    private String normalizePath(String path) {
        return StringUtils.defaultIfBlank(path, "/").trim();
    }

    private String truncate(String text, int maxLength) {
        if (StringUtils.isBlank(text) || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}

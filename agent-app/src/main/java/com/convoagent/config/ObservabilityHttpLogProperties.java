package com.convoagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * HTTP 入口日志配置。
 */
@Data
@Component
@ConfigurationProperties(prefix = "observability.http-log", ignoreInvalidFields = true)
public class ObservabilityHttpLogProperties {

    /** 是否启用 HTTP 入口日志。 */
    private boolean enabled = true;

    /** 需要记录日志的路径模式。 */
    private List<String> includePathPatterns = Arrays.asList("/api/**");

    /** 需要排除日志的路径模式。 */
    private List<String> excludePathPatterns = Arrays.asList("/actuator/**", "/api/v1/agent/health");

    /** 需要脱敏的查询参数名。 */
    private List<String> maskFields = Arrays.asList("apiKey", "authorization", "password", "token", "secret");

    /** 慢请求阈值。 */
    private long slowRequestThresholdMs = 5000L;

    /** 采样比例（0~1）。 */
    private double sampleRate = 1.0D;
}

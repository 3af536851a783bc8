package com.convoagent.infrastructure.tool.http;

import com.convoagent.domain.tool.model.valobj.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP 工具共用的请求执行。
 * <p>
 * 只允许 http/https；超时按单次请求设置；4xx/5xx 转为带 status_code 的失败结果，网络错误转为 "Request error"。
 * </p>
 */
@Slf4j
public class HttpToolClient {

    private final HttpClient httpClient;
    private final int defaultTimeoutSeconds;
    private final int maxTimeoutSeconds;
    private final int maxBodyChars;

    public HttpToolClient(int defaultTimeoutSeconds, int maxTimeoutSeconds, int maxBodyChars) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(Math.max(defaultTimeoutSeconds, 1)))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                defaultTimeoutSeconds, maxTimeoutSeconds, maxBodyChars);
    }

    HttpToolClient(HttpClient httpClient, int defaultTimeoutSeconds, int maxTimeoutSeconds, int maxBodyChars) {
        this.httpClient = httpClient;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
        this.maxTimeoutSeconds = maxTimeoutSeconds;
        this.maxBodyChars = maxBodyChars;
    }

    public ToolResult execute(String method, String url, Map<String, String> headers, Integer timeoutSeconds, String jsonBody) {
        int timeout = timeoutSeconds == null ? defaultTimeoutSeconds : timeoutSeconds;
        if (timeout < 1 || timeout > maxTimeoutSeconds) {
            return ToolResult.failure("timeout must be between 1 and " + maxTimeoutSeconds + " seconds");
        }
        URI uri;
        try {
            uri = parseUrl(url);
        } catch (IllegalArgumentException ex) {
            return ToolResult.failure("Request error: " + ex.getMessage());
        }
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(Duration.ofSeconds(timeout));
            if (headers != null) {
                headers.forEach((name, value) -> {
                    if (StringUtils.isNotBlank(name) && value != null) {
                        builder.header(name, value);
                    }
                });
            }
            if ("POST".equals(method)) {
                if (jsonBody != null) {
                    builder.header("Content-Type", "application/json");
                    builder.POST(HttpRequest.BodyPublishers.ofString(jsonBody, StandardCharsets.UTF_8));
                } else {
                    builder.POST(HttpRequest.BodyPublishers.noBody());
                }
            } else {
                builder.GET();
            }
            HttpResponse<String> response = httpClient.send(builder.build(),
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return toResult(response);
        } catch (HttpTimeoutException ex) {
            return ToolResult.failure("Request error: request timed out after " + timeout + "s");
        } catch (IOException ex) {
            return ToolResult.failure("Request error: " + ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Request error: interrupted");
        } catch (IllegalArgumentException ex) {
            return ToolResult.failure("Request error: " + ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("HTTP_TOOL_UNEXPECTED_ERROR method={}, url={}, errorType={}, error={}",
                    method, url, ex.getClass().getSimpleName(), ex.getMessage());
            return ToolResult.failure("Unexpected error: " + ex.getMessage());
        }
    }

    private URI parseUrl(String url) {
        if (StringUtils.isBlank(url)) {
            throw new IllegalArgumentException("url is required");
        }
        URI uri = URI.create(url.trim());
        String scheme = uri.getScheme();
        if (scheme == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new IllegalArgumentException("unsupported URL scheme: " + scheme);
        }
        if (StringUtils.isBlank(uri.getHost())) {
            throw new IllegalArgumentException("URL has no host: " + url);
        }
        return uri;
    }

    private ToolResult toResult(HttpResponse<String> response) {
        String body = truncate(response.body());
        if (response.statusCode() >= 400) {
            return ToolResult.failure("HTTP error " + response.statusCode() + ": " + body, response.statusCode());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status_code", response.statusCode());
        payload.put("headers", flattenHeaders(response.headers().map()));
        payload.put("body", body);
        payload.put("url", response.uri().toString());
        return ToolResult.success(payload);
    }

    private Map<String, String> flattenHeaders(Map<String, List<String>> headers) {
        Map<String, String> flattened = new LinkedHashMap<>();
        headers.forEach((name, values) -> flattened.put(name, String.join(", ", values)));
        return flattened;
    }

    private String truncate(String body) {
        if (body == null) {
            return "";
        }
        if (maxBodyChars > 0 && body.length() > maxBodyChars) {
            return body.substring(0, maxBodyChars) + "...[truncated]";
        }
        return body;
    }
}

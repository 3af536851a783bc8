package com.convoagent.infrastructure.tool.http;

import com.convoagent.domain.tool.model.valobj.ToolResult;
import com.convoagent.infrastructure.tool.AbstractAgentTool;

import java.util.Map;

/**
 * HTTP GET 工具。
 */
public class HttpGetTool extends AbstractAgentTool<HttpGetTool.Input> {

    public static final String NAME = "http_get";

    private static final String SCHEMA = "{\"type\":\"object\","
            + "\"properties\":{"
            + "\"url\":{\"type\":\"string\",\"description\":\"URL to send GET request to\"},"
            + "\"headers\":{\"type\":\"object\",\"additionalProperties\":{\"type\":\"string\"},"
            + "\"description\":\"Optional headers to include in the request\"},"
            + "\"timeout\":{\"type\":\"integer\",\"default\":30,\"description\":\"Request timeout in seconds (default: 30)\"}},"
            + "\"required\":[\"url\"]}";

    private final HttpToolClient client;

    public HttpGetTool(HttpToolClient client) {
        super(NAME, "Make an HTTP GET request to a URL.", SCHEMA, Input.class);
        this.client = client;
    }

    @Override
    protected ToolResult execute(Input input) {
        if (input == null) {
            return ToolResult.failure("url is required");
        }
        return client.execute("GET", input.url(), input.headers(), input.timeout(), null);
    }

    public record Input(String url, Map<String, String> headers, Integer timeout) {
    }
}

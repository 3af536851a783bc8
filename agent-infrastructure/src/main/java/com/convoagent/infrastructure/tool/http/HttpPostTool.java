package com.convoagent.infrastructure.tool.http;

import com.convoagent.domain.tool.model.valobj.ToolResult;
import com.convoagent.infrastructure.tool.AbstractAgentTool;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.Map;

/**
 * HTTP POST 工具，json_data 作为 JSON 请求体发送。NaN / Infinity 不是合法 JSON，直接拒绝。
 */
public class HttpPostTool extends AbstractAgentTool<HttpPostTool.Input> {

    public static final String NAME = "http_post";

    private static final String SCHEMA = "{\"type\":\"object\","
            + "\"properties\":{"
            + "\"url\":{\"type\":\"string\",\"description\":\"URL to send POST request to\"},"
            + "\"json_data\":{\"description\":\"JSON data to send in request body (dict, list, string, etc.)\"},"
            + "\"headers\":{\"type\":\"object\",\"additionalProperties\":{\"type\":\"string\"},"
            + "\"description\":\"Optional headers to include in the request\"},"
            + "\"timeout\":{\"type\":\"integer\",\"default\":30,\"description\":\"Request timeout in seconds (default: 30)\"}},"
            + "\"required\":[\"url\"]}";

    private final HttpToolClient client;
    private final ObjectMapper objectMapper;

    public HttpPostTool(HttpToolClient client, ObjectMapper objectMapper) {
        super(NAME, "Make an HTTP POST request to a URL with JSON data.", SCHEMA, Input.class);
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    protected ToolResult execute(Input input) {
        if (input == null) {
            return ToolResult.failure("url is required");
        }
        JsonNode data = input.jsonData();
        String body = null;
        if (data != null && !data.isNull()) {
            if (containsNonFinite(data)) {
                return ToolResult.failure("json_data must be valid JSON (no NaN/Infinity, must be serializable)");
            }
            try {
                body = objectMapper.writeValueAsString(data);
            } catch (JsonProcessingException ex) {
                return ToolResult.failure("json_data must be valid JSON (no NaN/Infinity, must be serializable): "
                        + ex.getOriginalMessage());
            }
        }
        return client.execute("POST", input.url(), input.headers(), input.timeout(), body);
    }

    static boolean containsNonFinite(JsonNode node) {
        if (node == null) {
            return false;
        }
        if (node.isFloatingPointNumber()) {
            double value = node.doubleValue();
            return Double.isNaN(value) || Double.isInfinite(value);
        }
        if (node.isContainerNode()) {
            Iterator<JsonNode> elements = node.elements();
            while (elements.hasNext()) {
                if (containsNonFinite(elements.next())) {
                    return true;
                }
            }
        }
        return false;
    }

    public record Input(String url,
                        @JsonProperty("json_data") JsonNode jsonData,
                        Map<String, String> headers,
                        Integer timeout) {
    }
}

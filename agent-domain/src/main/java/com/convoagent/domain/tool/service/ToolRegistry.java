package com.convoagent.domain.tool.service;

import com.convoagent.domain.conversation.model.valobj.ToolCallRequest;
import com.convoagent.domain.tool.adapter.provider.AgentTool;
import com.convoagent.domain.tool.model.valobj.ToolInvocationResult;
import com.convoagent.domain.tool.model.valobj.ToolResult;
import com.convoagent.domain.tool.model.valobj.ToolSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次调用内的工具注册表，组装后不可变。
 * <p>
 * {@link #invoke(ToolCallRequest)} 不抛异常：未知工具、参数错误与工具内部异常都转换为结构化错误。
 * </p>
 */
@Slf4j
public class ToolRegistry {

    private static final ToolRegistry EMPTY = new ToolRegistry(Collections.emptyMap(), new ObjectMapper());

    private final Map<String, AgentTool<?>> tools;
    private final ObjectMapper objectMapper;

    ToolRegistry(Map<String, AgentTool<?>> tools, ObjectMapper objectMapper) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
        this.objectMapper = objectMapper;
    }

    public static ToolRegistry empty() {
        return EMPTY;
    }

    public List<String> names() {
        return new ArrayList<>(tools.keySet());
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    public List<ToolSpec> specs() {
        List<ToolSpec> specs = new ArrayList<>(tools.size());
        for (AgentTool<?> tool : tools.values()) {
            specs.add(new ToolSpec(tool.name(), tool.description(), tool.inputSchema()));
        }
        return specs;
    }

    public ToolInvocationResult invoke(ToolCallRequest call) {
        String toolName = call == null ? null : call.name();
        String callId = call == null ? null : call.id();
        ToolResult result;
        AgentTool<?> tool = toolName == null ? null : tools.get(toolName);
        if (tool == null) {
            result = ToolResult.failure("Unknown tool: " + toolName);
        } else {
            result = invokeSafely(tool, call.arguments());
        }
        if (result == null) {
            result = ToolResult.failure("Tool " + toolName + " returned no result");
        }
        return new ToolInvocationResult(callId, toolName, result, render(result));
    }

    private <I> ToolResult invokeSafely(AgentTool<I> tool, String arguments) {
        I input;
        try {
            String json = arguments == null || arguments.trim().isEmpty() ? "{}" : arguments;
            input = objectMapper.readValue(json, tool.inputType());
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("TOOL_ARGUMENT_INVALID tool={}, error={}", tool.name(), originalMessage(ex));
            return ToolResult.failure("Invalid arguments for tool " + tool.name() + ": " + originalMessage(ex));
        }
        try {
            return tool.invoke(input);
        } catch (RuntimeException ex) {
            log.warn("TOOL_INVOKE_FAILED tool={}, errorType={}, error={}",
                    tool.name(), ex.getClass().getSimpleName(), ex.getMessage());
            return ToolResult.failure("Tool " + tool.name() + " failed: " + ex.getMessage());
        }
    }

    /**
     * 渲染回填给模型的内容：成功为 payload（字符串原样，其他序列化为 JSON），失败为 {"error":...}。
     */
    public String render(ToolResult result) {
        try {
            if (result.isSuccess()) {
                Object payload = result.getPayload();
                if (payload instanceof String text) {
                    return text;
                }
                return objectMapper.writeValueAsString(payload);
            }
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", result.getError());
            if (result.getStatusCode() != null) {
                error.put("status_code", result.getStatusCode());
            }
            return objectMapper.writeValueAsString(error);
        } catch (JsonProcessingException ex) {
            return "{\"error\":\"Tool result could not be serialized\"}";
        }
    }

    private String originalMessage(Exception ex) {
        if (ex instanceof JsonProcessingException jsonEx) {
            return jsonEx.getOriginalMessage();
        }
        return ex.getMessage();
    }
}

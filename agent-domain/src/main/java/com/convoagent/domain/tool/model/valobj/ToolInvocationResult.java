package com.convoagent.domain.tool.model.valobj;

/**
 * 一次工具调用的结果与回填给模型的 JSON 内容。
 */
public record ToolInvocationResult(String callId, String toolName, ToolResult result, String content) {

    public boolean failed() {
        return result == null || !result.isSuccess();
    }
}

package com.convoagent.domain.conversation.model.valobj;

/**
 * 模型发起的一次工具调用请求，arguments 为原始 JSON 字符串。
 */
public record ToolCallRequest(String id, String name, String arguments) {
}

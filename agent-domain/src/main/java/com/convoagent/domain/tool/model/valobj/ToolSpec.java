package com.convoagent.domain.tool.model.valobj;

/**
 * 暴露给模型的工具描述，inputSchema 为 JSON Schema 字符串。
 */
public record ToolSpec(String name, String description, String inputSchema) {
}

package com.convoagent.domain.tool.adapter.provider;

import com.convoagent.domain.tool.model.valobj.ToolResult;

/**
 * Agent 可调用的工具。
 * <p>
 * 参数先按 {@link #inputType()} 从模型给出的 JSON 转换为强类型输入再交给 {@link #invoke(Object)}。
 * 实现必须把可预期的失败（未找到、远端错误）表达为 {@link ToolResult#failure(String)}。
 * </p>
 *
 * @param <I> 输入类型
 */
public interface AgentTool<I> {

    String name();

    String description();

    /**
     * JSON Schema 形式的输入描述。
     */
    String inputSchema();

    Class<I> inputType();

    ToolResult invoke(I input);
}

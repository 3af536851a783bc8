package com.convoagent.infrastructure.ai;

import com.convoagent.domain.tool.model.valobj.ToolSpec;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * 只向模型声明工具定义的回调。
 * <p>
 * 网关关闭了 Spring AI 的内部工具执行，工具由执行引擎通过 ToolRegistry 调用，因此 {@link #call(String)} 不会被触发。
 * </p>
 */
public class ToolSpecCallback implements ToolCallback {

    private final ToolDefinition toolDefinition;

    public ToolSpecCallback(ToolSpec spec) {
        this.toolDefinition = ToolDefinition.builder()
                .name(spec.name())
                .description(spec.description())
                .inputSchema(spec.inputSchema())
                .build();
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return toolDefinition;
    }

    @Override
    public String call(String toolInput) {
        throw new UnsupportedOperationException("工具由执行引擎调用: " + toolDefinition.name());
    }
}

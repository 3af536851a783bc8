package com.convoagent.infrastructure.tool;

import com.convoagent.domain.tool.adapter.provider.AgentTool;
import com.convoagent.domain.tool.model.valobj.ToolResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;

/**
 * 工具基类：统一名称/描述/Schema 的持有与调用计数（agent.tool.call.total{tool,outcome}）。
 *
 * @param <I> 输入类型
 */
public abstract class AbstractAgentTool<I> implements AgentTool<I> {

    private final String name;
    private final String description;
    private final String inputSchema;
    private final Class<I> inputType;

    protected AbstractAgentTool(String name, String description, String inputSchema, Class<I> inputType) {
        this.name = name;
        this.description = description;
        this.inputSchema = inputSchema;
        this.inputType = inputType;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public String inputSchema() {
        return inputSchema;
    }

    @Override
    public Class<I> inputType() {
        return inputType;
    }

    @Override
    public final ToolResult invoke(I input) {
        ToolResult result;
        try {
            result = execute(input);
        } catch (RuntimeException ex) {
            count("exception");
            throw ex;
        }
        count(result != null && result.isSuccess() ? "success" : "failure");
        return result;
    }

    protected abstract ToolResult execute(I input);

    private void count(String outcome) {
        Counter.builder("agent.tool.call.total")
                .tag("tool", name)
                .tag("outcome", outcome)
                .register(Metrics.globalRegistry)
                .increment();
    }
}

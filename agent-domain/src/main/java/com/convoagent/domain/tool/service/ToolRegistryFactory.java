package com.convoagent.domain.tool.service;

import com.convoagent.domain.tool.adapter.provider.AgentTool;
import com.convoagent.domain.tool.adapter.provider.IToolProvider;
import com.convoagent.domain.tool.model.valobj.ToolSessionContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按调用组装工具注册表：会话级提供者（绑定调用方）在前，无状态提供者在后。
 */
@Service
public class ToolRegistryFactory {

    private final List<IToolProvider> providers;
    private final ObjectMapper objectMapper;

    public ToolRegistryFactory(List<IToolProvider> providers, ObjectMapper objectMapper) {
        this.providers = providers == null ? List.of() : new ArrayList<>(providers);
        this.objectMapper = objectMapper;
    }

    public ToolRegistry compose(ToolSessionContext context) {
        ToolSessionContext safeContext = context == null ? new ToolSessionContext(null, null) : context;
        Map<String, AgentTool<?>> tools = new LinkedHashMap<>();
        for (IToolProvider provider : providers) {
            if (provider.sessionScoped()) {
                register(tools, provider, safeContext);
            }
        }
        for (IToolProvider provider : providers) {
            if (!provider.sessionScoped()) {
                register(tools, provider, safeContext);
            }
        }
        return new ToolRegistry(tools, objectMapper);
    }

    /**
     * 不绑定会话时可用的工具名，用于健康检查展示。
     */
    public List<String> statelessToolNames() {
        return compose(new ToolSessionContext(null, null)).names();
    }

    private void register(Map<String, AgentTool<?>> tools, IToolProvider provider, ToolSessionContext context) {
        if (provider.sessionScoped() && !context.hasSession()) {
            return;
        }
        List<AgentTool<?>> provided = provider.provide(context);
        if (provided == null) {
            return;
        }
        for (AgentTool<?> tool : provided) {
            if (tool == null) {
                continue;
            }
            if (tools.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.name());
            }
        }
    }
}

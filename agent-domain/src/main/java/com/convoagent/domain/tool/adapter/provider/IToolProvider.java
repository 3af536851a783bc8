package com.convoagent.domain.tool.adapter.provider;

import com.convoagent.domain.tool.model.valobj.ToolSessionContext;

import java.util.List;

/**
 * 工具提供者。会话级提供者绑定调用方上下文，只有在上下文带用户时才参与组装。
 */
public interface IToolProvider {

    List<AgentTool<?>> provide(ToolSessionContext context);

    default boolean sessionScoped() {
        return false;
    }
}

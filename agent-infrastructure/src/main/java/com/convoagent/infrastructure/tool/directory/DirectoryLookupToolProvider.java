package com.convoagent.infrastructure.tool.directory;

import com.convoagent.domain.tool.adapter.provider.AgentTool;
import com.convoagent.domain.tool.adapter.provider.IToolProvider;
import com.convoagent.domain.tool.model.valobj.ToolSessionContext;
import com.convoagent.infrastructure.dao.DirectoryLookupDao;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * 目录查询工具提供者（用户、条目）。会话级：只在调用方带用户上下文时组装。
 */
@Component
public class DirectoryLookupToolProvider implements IToolProvider {

    private final DirectoryLookupDao directoryLookupDao;
    private final boolean enabled;

    public DirectoryLookupToolProvider(DirectoryLookupDao directoryLookupDao,
                                       @Value("${agent.tools.directory.enabled:true}") boolean enabled) {
        this.directoryLookupDao = directoryLookupDao;
        this.enabled = enabled;
    }

    @Override
    public List<AgentTool<?>> provide(ToolSessionContext context) {
        if (!enabled) {
            return Collections.emptyList();
        }
        return List.of(
                new LookupUserByEmailTool(directoryLookupDao),
                new LookupItemByIdTool(directoryLookupDao),
                new LookupUserItemsTool(directoryLookupDao));
    }

    @Override
    public boolean sessionScoped() {
        return true;
    }
}

package com.convoagent.infrastructure.tool.http;

import com.convoagent.domain.tool.adapter.provider.AgentTool;
import com.convoagent.domain.tool.adapter.provider.IToolProvider;
import com.convoagent.domain.tool.model.valobj.ToolSessionContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * 无状态 HTTP 工具提供者（http_get / http_post）。
 */
@Component
public class HttpToolProvider implements IToolProvider {

    private final List<AgentTool<?>> tools;

    public HttpToolProvider(ObjectMapper objectMapper,
                            @Value("${agent.tools.http.enabled:true}") boolean enabled,
                            @Value("${agent.tools.http.default-timeout-seconds:30}") int defaultTimeoutSeconds,
                            @Value("${agent.tools.http.max-timeout-seconds:60}") int maxTimeoutSeconds,
                            @Value("${agent.tools.http.max-body-chars:20000}") int maxBodyChars) {
        if (!enabled) {
            this.tools = Collections.emptyList();
            return;
        }
        HttpToolClient client = new HttpToolClient(defaultTimeoutSeconds, maxTimeoutSeconds, maxBodyChars);
        this.tools = List.of(new HttpGetTool(client), new HttpPostTool(client, objectMapper));
    }

    @Override
    public List<AgentTool<?>> provide(ToolSessionContext context) {
        return tools;
    }
}

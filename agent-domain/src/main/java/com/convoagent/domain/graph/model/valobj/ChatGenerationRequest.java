package com.convoagent.domain.graph.model.valobj;

import com.convoagent.domain.conversation.model.valobj.ConversationMessage;
import com.convoagent.domain.tool.model.valobj.ToolSpec;

import java.util.List;

/**
 * 模型生成请求。tools 为空时模型不得发起工具调用。
 */
public record ChatGenerationRequest(String node,
                                    String systemPrompt,
                                    List<ConversationMessage> messages,
                                    List<ToolSpec> tools) {

    public boolean toolsEnabled() {
        return tools != null && !tools.isEmpty();
    }
}

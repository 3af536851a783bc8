package com.convoagent.domain.graph.model.valobj;

import com.convoagent.domain.conversation.model.valobj.ToolCallRequest;

import java.util.List;

/**
 * 一次模型生成的结果。
 */
public record ChatGeneration(String text,
                             List<ToolCallRequest> toolCalls,
                             Integer promptTokens,
                             Integer completionTokens) {

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasText() {
        return text != null && !text.trim().isEmpty();
    }

    public static ChatGeneration text(String text) {
        return new ChatGeneration(text, List.of(), null, null);
    }
}

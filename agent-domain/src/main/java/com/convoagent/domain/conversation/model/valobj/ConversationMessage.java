package com.convoagent.domain.conversation.model.valobj;

import com.convoagent.types.enums.MessageRoleEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话消息。
 * <p>
 * 持久化的线程历史只包含 USER 与最终的 AGENT 消息；带工具调用的 AGENT 消息与 TOOL 结果消息
 * 只存在于单轮执行中的在途转录里。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessage {

    private MessageRoleEnum role;
    private String content;
    private Map<String, Object> attachments;
    private List<ToolCallRequest> toolCalls;
    private String toolCallId;
    private String toolName;
    private LocalDateTime createdAt;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static ConversationMessage user(String content, Map<String, Object> attachments) {
        return ConversationMessage.builder()
                .role(MessageRoleEnum.USER)
                .content(content)
                .attachments(copy(attachments))
                .createdAt(LocalDateTime.now())
                .build();
    }

    public static ConversationMessage agent(String content, Map<String, Object> attachments) {
        return ConversationMessage.builder()
                .role(MessageRoleEnum.AGENT)
                .content(content)
                .attachments(copy(attachments))
                .createdAt(LocalDateTime.now())
                .build();
    }

    public static ConversationMessage agentToolCalls(String content, List<ToolCallRequest> toolCalls) {
        return ConversationMessage.builder()
                .role(MessageRoleEnum.AGENT)
                .content(content == null ? "" : content)
                .toolCalls(toolCalls == null ? Collections.emptyList() : new ArrayList<>(toolCalls))
                .createdAt(LocalDateTime.now())
                .build();
    }

    public static ConversationMessage toolResult(String toolCallId, String toolName, String content) {
        return ConversationMessage.builder()
                .role(MessageRoleEnum.TOOL)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .content(content)
                .createdAt(LocalDateTime.now())
                .build();
    }

    private static Map<String, Object> copy(Map<String, Object> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            return null;
        }
        return new LinkedHashMap<>(attachments);
    }
}

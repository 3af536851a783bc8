package com.convoagent.domain.conversation.model.entity;

import com.convoagent.domain.conversation.model.valobj.ConversationMessage;
import com.convoagent.types.enums.MessageRoleEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 会话线程实体（检查点）。
 * <p>
 * version 为乐观并发版本号：0 表示尚未持久化，每次成功保存后加一。
 * </p>
 */
@Data
public class ConversationThreadEntity {

    private String threadId;
    private String userId;
    private List<ConversationMessage> messages = new ArrayList<>();
    private String plan;
    private Long version = 0L;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ConversationThreadEntity empty(String threadId) {
        ConversationThreadEntity entity = new ConversationThreadEntity();
        entity.setThreadId(threadId);
        return entity;
    }

    public boolean isNew() {
        return version == null || version <= 0L;
    }

    public List<ConversationMessage> history() {
        return messages == null ? Collections.emptyList() : Collections.unmodifiableList(messages);
    }

    /**
     * 追加一轮完整对话（用户消息与最终 Agent 消息）。不涉及持久化。
     */
    public void appendTurn(String userId, ConversationMessage userMessage, ConversationMessage agentMessage, String plan) {
        if (userMessage == null || userMessage.getRole() != MessageRoleEnum.USER) {
            throw new IllegalStateException("Turn must start with a user message");
        }
        if (agentMessage == null || agentMessage.getRole() != MessageRoleEnum.AGENT || agentMessage.hasToolCalls()) {
            throw new IllegalStateException("Turn must end with a final agent message");
        }
        if (messages == null) {
            messages = new ArrayList<>();
        }
        if (this.userId == null) {
            this.userId = userId;
        }
        messages.add(userMessage);
        messages.add(agentMessage);
        if (plan != null && !plan.trim().isEmpty()) {
            this.plan = plan;
        }
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    public void validate() {
        if (threadId == null || threadId.trim().isEmpty()) {
            throw new IllegalStateException("Thread ID cannot be empty");
        }
        if (messages == null || messages.isEmpty()) {
            throw new IllegalStateException("Thread messages cannot be empty when saving");
        }
    }

    public long expectedVersion() {
        return version == null ? 0L : version;
    }

    public void incrementVersion() {
        this.version = expectedVersion() + 1L;
    }
}

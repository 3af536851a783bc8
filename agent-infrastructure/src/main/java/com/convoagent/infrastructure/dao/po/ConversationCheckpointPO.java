package com.convoagent.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话检查点 PO，messages 为 JSONB。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationCheckpointPO {

    private String threadId;
    private String userId;
    private String messages;
    private String plan;
    private Long version;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}

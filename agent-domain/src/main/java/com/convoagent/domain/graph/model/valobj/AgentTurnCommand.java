package com.convoagent.domain.graph.model.valobj;

import java.time.Duration;
import java.util.Map;

/**
 * 单轮调用命令。threadId 为空时生成新线程；budget 为空时使用默认预算。
 */
public record AgentTurnCommand(String threadId,
                               String message,
                               String userId,
                               Map<String, Object> attachments,
                               Duration budget) {
}

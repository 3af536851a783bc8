package com.convoagent.domain.run.model.entity;

import com.convoagent.types.enums.RunStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Agent 运行记录实体，写入后不再修改。
 */
@Data
public class AgentRunEntity {

    private String runId;
    private String threadId;
    private String userId;
    private String input;
    private String output;
    private RunStatusEnum status;
    private Long latencyMs;
    private String traceId;
    private Integer promptTokens;
    private Integer completionTokens;
    private String plan;
    private String errorMessage;
    private Map<String, Object> metadata;
    private LocalDateTime createdAt;

    public void validate() {
        if (runId == null || runId.trim().isEmpty()) {
            throw new IllegalStateException("Run ID cannot be empty");
        }
        if (userId == null || userId.trim().isEmpty()) {
            throw new IllegalStateException("User ID cannot be empty");
        }
        if (input == null) {
            throw new IllegalStateException("Run input cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Run status cannot be null");
        }
        if (latencyMs == null || latencyMs < 0L) {
            throw new IllegalStateException("Run latency must be non-negative");
        }
    }

    public boolean isOwnedBy(String candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }

    public boolean isEvaluable() {
        return input != null && !input.trim().isEmpty() && output != null && !output.trim().isEmpty();
    }
}

package com.convoagent.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 运行记录 PO，status 存 RunStatusEnum 的 code。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunPO {

    private String runId;
    private String threadId;
    private String userId;
    private String input;
    private String output;
    private String status;
    private Long latencyMs;
    private String traceId;
    private Integer promptTokens;
    private Integer completionTokens;
    private String plan;
    private String errorMessage;
    private String metadata;
    private LocalDateTime createdAt;
}

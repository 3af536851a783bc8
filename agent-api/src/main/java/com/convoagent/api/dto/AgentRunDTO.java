package com.convoagent.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 运行记录视图。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentRunDTO {

    private String runId;
    private String threadId;
    private String userId;
    private String input;
    private String output;
    private String status;
    private Long latencyMs;
    private String traceId;
    private String traceUrl;
    private Integer promptTokens;
    private Integer completionTokens;
    private String plan;
    private String errorMessage;
    private Map<String, Object> metadata;
    private LocalDateTime createdAt;
}

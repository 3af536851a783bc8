package com.convoagent.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * Agent 调用响应。status 取值 success / error / timeout。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentInvocationResponseDTO {

    private String response;
    private String threadId;
    private String traceId;
    private String traceUrl;
    private String runId;
    private Long latencyMs;
    private String status;
    private String plan;
    private Boolean truncated;
}

package com.convoagent.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * Agent 健康状态。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentHealthDTO {

    private String status;
    private String modelName;
    private Boolean tracingEnabled;
    private Double traceSampleRate;
    private List<String> availableTools;
}

package com.convoagent.domain.graph.model.valobj;

import com.convoagent.types.enums.RunStatusEnum;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 单轮执行结果。
 */
@Data
@Builder
public class AgentTurnResult {

    private String threadId;
    private String response;
    private String plan;
    private RunStatusEnum status;
    private boolean truncated;
    private int promptTokens;
    private int completionTokens;
    private int steps;
    private List<String> toolCalls;
    private String errorMessage;

    public boolean isSuccess() {
        return status == RunStatusEnum.SUCCESS;
    }
}

package com.convoagent.domain.graph.service;

import com.convoagent.domain.graph.model.valobj.NodeOutcome;
import com.convoagent.types.enums.GraphStateEnum;
import com.convoagent.types.enums.RunStatusEnum;
import org.springframework.stereotype.Service;

/**
 * 状态转移函数 (state, outcome) -> next state，以及终态对应的运行状态。
 */
@Service
public class GraphTransitionDomainService {

    public GraphStateEnum next(GraphStateEnum state, NodeOutcome outcome) {
        if (state == null || outcome == null) {
            throw new IllegalStateException("state and outcome cannot be null");
        }
        if (state == GraphStateEnum.DONE) {
            throw new IllegalStateException("DONE is terminal, outcome=" + outcome);
        }
        if (outcome == NodeOutcome.TIMED_OUT) {
            return GraphStateEnum.DONE;
        }
        return switch (state) {
            case PLANNING -> switch (outcome) {
                case PLAN_READY -> GraphStateEnum.EXECUTING;
                case PLAN_FAILED -> GraphStateEnum.DONE;
                default -> throw illegal(state, outcome);
            };
            case EXECUTING -> switch (outcome) {
                case TOOL_CALLS_REQUESTED -> GraphStateEnum.EXECUTING;
                case FINAL_RESPONSE, STEP_BUDGET_EXHAUSTED, NODE_FAILED -> GraphStateEnum.DONE;
                default -> throw illegal(state, outcome);
            };
            case DONE -> throw illegal(state, outcome);
        };
    }

    /**
     * 进入 DONE 的结果对应的运行状态。
     */
    public RunStatusEnum resolveStatus(NodeOutcome terminalOutcome) {
        if (terminalOutcome == null) {
            return RunStatusEnum.ERROR;
        }
        return switch (terminalOutcome) {
            case FINAL_RESPONSE -> RunStatusEnum.SUCCESS;
            case TIMED_OUT -> RunStatusEnum.TIMEOUT;
            case PLAN_FAILED, NODE_FAILED, STEP_BUDGET_EXHAUSTED -> RunStatusEnum.ERROR;
            case PLAN_READY, TOOL_CALLS_REQUESTED -> throw new IllegalStateException("Outcome is not terminal: " + terminalOutcome);
        };
    }

    private IllegalStateException illegal(GraphStateEnum state, NodeOutcome outcome) {
        return new IllegalStateException("Illegal transition: state=" + state + ", outcome=" + outcome);
    }
}

package com.convoagent.domain.run.service;

import com.convoagent.domain.run.adapter.repository.IAgentRunRepository;
import com.convoagent.domain.run.model.entity.AgentRunEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 运行记录器：成功、失败、超时路径都记录一次。写入失败只记日志，不影响调用方响应。
 */
@Slf4j
@Service
public class AgentRunRecorder {

    private final IAgentRunRepository agentRunRepository;

    public AgentRunRecorder(IAgentRunRepository agentRunRepository) {
        this.agentRunRepository = agentRunRepository;
    }

    public String record(AgentRunEntity run) {
        if (run.getRunId() == null) {
            run.setRunId(UUID.randomUUID().toString());
        }
        if (run.getCreatedAt() == null) {
            run.setCreatedAt(LocalDateTime.now());
        }
        try {
            run.validate();
            agentRunRepository.save(run);
            log.info("AGENT_RUN_RECORDED runId={}, threadId={}, status={}, latencyMs={}, traceId={}",
                    run.getRunId(), run.getThreadId(), run.getStatus(), run.getLatencyMs(), run.getTraceId());
        } catch (RuntimeException ex) {
            log.warn("AGENT_RUN_RECORD_DROPPED runId={}, threadId={}, status={}, errorType={}, error={}",
                    run.getRunId(), run.getThreadId(), run.getStatus(), ex.getClass().getSimpleName(), ex.getMessage());
        }
        return run.getRunId();
    }
}

package com.convoagent.trigger.application.command;

import com.convoagent.api.dto.AgentInvocationRequestDTO;
import com.convoagent.api.dto.AgentInvocationResponseDTO;
import com.convoagent.domain.conversation.service.ConversationDomainService;
import com.convoagent.domain.graph.model.valobj.AgentTurnCommand;
import com.convoagent.domain.graph.model.valobj.AgentTurnResult;
import com.convoagent.domain.graph.service.AgentGraphEngine;
import com.convoagent.domain.run.model.entity.AgentRunEntity;
import com.convoagent.domain.run.service.AgentRunRecorder;
import com.convoagent.domain.trace.model.valobj.TraceHandle;
import com.convoagent.domain.trace.service.AgentTracer;
import com.convoagent.domain.trace.service.SpanScope;
import com.convoagent.trigger.application.common.AdmissionGuard;
import com.convoagent.trigger.application.common.AdmissionRoutes;
import com.convoagent.types.enums.ResponseCode;
import com.convoagent.types.enums.RunStatusEnum;
import com.convoagent.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Agent 调用写用例：校验、准入、trace、执行引擎与运行记录。
 * <p>
 * 校验失败与准入拒绝发生在引擎之前，不产生运行记录；进入引擎后无论成功、失败还是超时都记录一次。
 * </p>
 */
@Slf4j
@Service
public class AgentInvocationCommandService {

    private final AgentGraphEngine agentGraphEngine;
    private final ConversationDomainService conversationDomainService;
    private final AgentRunRecorder agentRunRecorder;
    private final AgentTracer agentTracer;
    private final AdmissionGuard admissionGuard;

    public AgentInvocationCommandService(AgentGraphEngine agentGraphEngine,
                                         ConversationDomainService conversationDomainService,
                                         AgentRunRecorder agentRunRecorder,
                                         AgentTracer agentTracer,
                                         AdmissionGuard admissionGuard) {
        this.agentGraphEngine = agentGraphEngine;
        this.conversationDomainService = conversationDomainService;
        this.agentRunRecorder = agentRunRecorder;
        this.agentTracer = agentTracer;
        this.admissionGuard = admissionGuard;
    }

    public AgentInvocationResponseDTO invoke(String userId, AgentInvocationRequestDTO request) {
        if (StringUtils.isBlank(userId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "userId 不能为空");
        }
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "请求体不能为空");
        }
        String message = conversationDomainService.normalizeMessage(request.getMessage());
        String threadId = conversationDomainService.resolveThreadId(request.getThreadId());
        admissionGuard.admit(AdmissionRoutes.RUN, userId, 1);

        Map<String, Object> metadata = request.getMetadata() == null
                ? new HashMap<>()
                : new HashMap<>(request.getMetadata());
        metadata.put("thread_id", threadId);

        long startedNanos = System.nanoTime();
        TraceHandle handle = agentTracer.beginTrace(userId, agentTracer.sampleDecision(), metadata);
        try {
            AgentTurnResult result;
            try (SpanScope root = agentTracer.withSpan(handle, "agent.run")) {
                root.attribute("thread_id", threadId).attribute("user_id", userId);
                result = execute(threadId, message, userId, request.getMetadata());
                root.attribute("status", result.getStatus().getCode())
                        .attribute("steps", result.getSteps());
                if (!result.isSuccess()) {
                    root.markError(result.getErrorMessage());
                }
            }
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
            String runId = agentRunRecorder.record(toRunEntity(userId, message, request.getMetadata(), result, handle.traceId(), latencyMs));

            Counter.builder("agent.run.total")
                    .tag("status", result.getStatus().getCode())
                    .register(Metrics.globalRegistry)
                    .increment();
            Timer.builder("agent.run.latency")
                    .register(Metrics.globalRegistry)
                    .record(latencyMs, TimeUnit.MILLISECONDS);
            log.info("AGENT_RUN_DONE runId={}, threadId={}, userId={}, status={}, latencyMs={}, steps={}, traceId={}",
                    runId,
                    result.getThreadId(),
                    userId,
                    result.getStatus().getCode(),
                    latencyMs,
                    result.getSteps(),
                    handle.traceId());
            return toResponse(result, runId, handle, latencyMs);
        } finally {
            agentTracer.flush(handle);
        }
    }

    private AgentTurnResult execute(String threadId, String message, String userId, Map<String, Object> attachments) {
        try {
            return agentGraphEngine.execute(new AgentTurnCommand(threadId, message, userId, attachments, null));
        } catch (AppException ex) {
            if (ResponseCode.FORBIDDEN.getCode().equals(ex.getCode())) {
                throw ex;
            }
            return failedTurn(threadId, userId, ex);
        } catch (RuntimeException ex) {
            return failedTurn(threadId, userId, ex);
        }
    }

    private AgentTurnResult failedTurn(String threadId, String userId, RuntimeException ex) {
        String errorMessage = conversationDomainService.resolveErrorMessage(ex);
        log.error("AGENT_RUN_UNEXPECTED_FAILURE threadId={}, userId={}, error={}", threadId, userId, errorMessage, ex);
        return AgentTurnResult.builder()
                .threadId(threadId)
                .response(conversationDomainService.failureMessage(null))
                .status(RunStatusEnum.ERROR)
                .toolCalls(Collections.emptyList())
                .errorMessage(errorMessage)
                .build();
    }

    private AgentRunEntity toRunEntity(String userId, String message, Map<String, Object> callerMetadata,
                                       AgentTurnResult result, String traceId, long latencyMs) {
        Map<String, Object> runMetadata = new LinkedHashMap<>();
        if (callerMetadata != null) {
            runMetadata.putAll(callerMetadata);
        }
        runMetadata.put("steps", result.getSteps());
        runMetadata.put("tool_calls", result.getToolCalls() == null ? Collections.emptyList() : result.getToolCalls());
        runMetadata.put("truncated", result.isTruncated());
        runMetadata.put("model", agentGraphEngine.modelName());

        AgentRunEntity run = new AgentRunEntity();
        run.setThreadId(result.getThreadId());
        run.setUserId(userId);
        run.setInput(message);
        run.setOutput(result.getResponse());
        run.setStatus(result.getStatus());
        run.setLatencyMs(latencyMs);
        run.setTraceId(traceId);
        run.setPromptTokens(result.getPromptTokens());
        run.setCompletionTokens(result.getCompletionTokens());
        run.setPlan(result.getPlan());
        run.setErrorMessage(result.getErrorMessage());
        run.setMetadata(runMetadata);
        run.setCreatedAt(LocalDateTime.now());
        return run;
    }

    private AgentInvocationResponseDTO toResponse(AgentTurnResult result, String runId, TraceHandle handle, long latencyMs) {
        AgentInvocationResponseDTO dto = new AgentInvocationResponseDTO();
        dto.setResponse(result.getResponse());
        dto.setThreadId(result.getThreadId());
        dto.setTraceId(handle.traceId());
        dto.setTraceUrl(handle.sampled() ? agentTracer.traceUrl(handle.traceId()) : null);
        dto.setRunId(runId);
        dto.setLatencyMs(latencyMs);
        dto.setStatus(result.getStatus().getCode());
        dto.setPlan(result.getPlan());
        dto.setTruncated(result.isTruncated());
        return dto;
    }
}

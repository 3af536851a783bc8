package com.convoagent.trigger.application.common;

import com.convoagent.api.dto.AgentRunDTO;
import com.convoagent.api.dto.AgentRunPageDTO;
import com.convoagent.api.dto.EvaluationReportDTO;
import com.convoagent.api.dto.MetricSummaryDTO;
import com.convoagent.domain.evaluation.model.valobj.EvaluationReport;
import com.convoagent.domain.evaluation.model.valobj.MetricSummary;
import com.convoagent.domain.run.model.entity.AgentRunEntity;
import com.convoagent.domain.run.model.valobj.AgentRunPage;
import com.convoagent.domain.trace.service.AgentTracer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 运行记录与评测报告的视图组装。
 */
@Component
public class AgentRunViewAssembler {

    private final AgentTracer agentTracer;

    public AgentRunViewAssembler(AgentTracer agentTracer) {
        this.agentTracer = agentTracer;
    }

    public AgentRunDTO toRunDTO(AgentRunEntity entity) {
        AgentRunDTO dto = new AgentRunDTO();
        dto.setRunId(entity.getRunId());
        dto.setThreadId(entity.getThreadId() == null ? "" : entity.getThreadId());
        dto.setUserId(entity.getUserId());
        dto.setInput(entity.getInput());
        dto.setOutput(entity.getOutput() == null ? "" : entity.getOutput());
        dto.setStatus(entity.getStatus() == null ? null : entity.getStatus().getCode());
        dto.setLatencyMs(entity.getLatencyMs() == null ? 0L : entity.getLatencyMs());
        dto.setTraceId(entity.getTraceId());
        dto.setTraceUrl(entity.getTraceId() == null ? null : agentTracer.traceUrl(entity.getTraceId()));
        dto.setPromptTokens(entity.getPromptTokens());
        dto.setCompletionTokens(entity.getCompletionTokens());
        dto.setPlan(entity.getPlan());
        dto.setErrorMessage(entity.getErrorMessage());
        dto.setMetadata(entity.getMetadata());
        dto.setCreatedAt(entity.getCreatedAt());
        return dto;
    }

    public AgentRunPageDTO toPageDTO(AgentRunPage page) {
        List<AgentRunDTO> data = new ArrayList<>(page.data().size());
        for (AgentRunEntity entity : page.data()) {
            data.add(toRunDTO(entity));
        }
        AgentRunPageDTO dto = new AgentRunPageDTO();
        dto.setData(data);
        dto.setTotal(page.total());
        dto.setLimit(page.limit());
        dto.setOffset(page.offset());
        return dto;
    }

    public EvaluationReportDTO toReportDTO(EvaluationReport report) {
        EvaluationReportDTO dto = new EvaluationReportDTO();
        dto.setStartedAt(report.getStartedAt());
        dto.setDurationMs(report.getDurationMs());
        dto.setJudgeModel(report.getJudgeModel());
        dto.setWindowStart(report.getWindowStart());
        dto.setWindowEnd(report.getWindowEnd());
        dto.setTotal(report.getTotal());
        dto.setSuccessCount(report.getSuccessCount());
        dto.setFailureCount(report.getFailureCount());
        dto.setSkippedPairs(report.getSkippedPairs());
        Map<String, MetricSummaryDTO> summaries = new LinkedHashMap<>();
        if (report.getPerMetricSummary() != null) {
            for (Map.Entry<String, MetricSummary> entry : report.getPerMetricSummary().entrySet()) {
                MetricSummaryDTO summary = new MetricSummaryDTO();
                summary.setSuccessCount(entry.getValue().getSuccessCount());
                summary.setFailureCount(entry.getValue().getFailureCount());
                summary.setAvgScore(entry.getValue().getAvgScore());
                summaries.put(entry.getKey(), summary);
            }
        }
        dto.setPerMetricSummary(summaries);
        return dto;
    }
}

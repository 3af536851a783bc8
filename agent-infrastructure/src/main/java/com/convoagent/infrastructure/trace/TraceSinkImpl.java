package com.convoagent.infrastructure.trace;

import com.convoagent.domain.trace.adapter.gateway.ITraceSink;
import com.convoagent.domain.trace.model.entity.TraceSpanEntity;
import com.convoagent.domain.trace.model.valobj.TraceRecord;
import com.convoagent.infrastructure.dao.AgentTraceSpanDao;
import com.convoagent.infrastructure.dao.po.AgentTraceSpanPO;
import com.convoagent.infrastructure.util.JsonCodec;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 把采样命中的 trace 写入 agent_trace_span 表。导出失败只记日志与计数，不影响调用结果。
 */
@Slf4j
@Component
public class TraceSinkImpl implements ITraceSink {

    private final AgentTraceSpanDao traceSpanDao;
    private final JsonCodec jsonCodec;
    private final Counter exportedCounter;
    private final Counter failedCounter;

    public TraceSinkImpl(AgentTraceSpanDao traceSpanDao, JsonCodec jsonCodec) {
        this.traceSpanDao = traceSpanDao;
        this.jsonCodec = jsonCodec;
        this.exportedCounter = Counter.builder("agent.trace.export.total")
                .tag("result", "success")
                .description("已导出的 trace 数")
                .register(Metrics.globalRegistry);
        this.failedCounter = Counter.builder("agent.trace.export.total")
                .tag("result", "failure")
                .description("导出失败的 trace 数")
                .register(Metrics.globalRegistry);
    }

    @Override
    public void export(TraceRecord record) {
        if (record == null || record.spans() == null || record.spans().isEmpty()) {
            return;
        }
        List<AgentTraceSpanPO> rows = new ArrayList<>(record.spans().size());
        for (TraceSpanEntity span : record.spans()) {
            rows.add(toPO(span, record.userId()));
        }
        try {
            traceSpanDao.batchInsert(rows);
            exportedCounter.increment();
            log.debug("TRACE_EXPORTED traceId={}, spans={}", record.traceId(), rows.size());
        } catch (RuntimeException ex) {
            failedCounter.increment();
            log.warn("TRACE_EXPORT_FAILED traceId={}, spans={}, error={}", record.traceId(), rows.size(), ex.getMessage());
        }
    }

    private AgentTraceSpanPO toPO(TraceSpanEntity span, String userId) {
        return AgentTraceSpanPO.builder()
                .traceId(span.getTraceId())
                .spanId(span.getSpanId())
                .parentSpanId(span.getParentSpanId())
                .name(span.getName())
                .status(span.getStatus() == null ? null : span.getStatus().name())
                .errorMessage(span.getErrorMessage())
                .attributes(span.getAttributes() == null || span.getAttributes().isEmpty()
                        ? null : jsonCodec.writeValue(span.getAttributes()))
                .userId(userId)
                .startedAt(span.getStartedAt())
                .endedAt(span.getEndedAt())
                .durationMs(span.getDurationMs())
                .build();
    }
}

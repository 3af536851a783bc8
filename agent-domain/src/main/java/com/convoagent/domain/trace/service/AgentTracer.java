package com.convoagent.domain.trace.service;

import com.convoagent.domain.trace.adapter.gateway.ITraceSink;
import com.convoagent.domain.trace.model.entity.TraceSpanEntity;
import com.convoagent.domain.trace.model.valobj.TraceContext;
import com.convoagent.domain.trace.model.valobj.TraceHandle;
import com.convoagent.domain.trace.model.valobj.TraceRecord;
import com.convoagent.types.common.Constants;
import com.convoagent.types.enums.SpanStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Trace 上下文服务。
 * <p>
 * 上下文通过 {@link TraceContextHolder} 隐式携带；任务切换到工作线程时用 {@link #wrap(Callable)} 显式重新绑定。
 * 未采样的 trace 仍生成 traceId，但所有 span 都是空操作。
 * </p>
 */
@Slf4j
public class AgentTracer {

    private final TraceSampler sampler;
    private final ITraceSink traceSink;
    private final String uiBaseUrl;

    public AgentTracer(TraceSampler sampler, ITraceSink traceSink, String uiBaseUrl) {
        this.sampler = sampler;
        this.traceSink = traceSink;
        this.uiBaseUrl = uiBaseUrl == null ? null : uiBaseUrl.trim().replaceAll("/+$", "");
    }

    public boolean sampleDecision() {
        return sampler.sample();
    }

    public boolean isTracingEnabled() {
        return sampler.isEnabled();
    }

    public double sampleRate() {
        return sampler.getSampleRate();
    }

    /**
     * 开始 trace 并绑定到当前线程。
     */
    public TraceHandle beginTrace(String userId, boolean sampled, Map<String, Object> metadata) {
        TraceContext context = new TraceContext(newId(), sampled, userId, metadata);
        String previousMdcTraceId = MDC.get(Constants.MDC_TRACE_ID);
        TraceContext previous = TraceContextHolder.bind(context);
        return new TraceHandle(context, previous, previousMdcTraceId, System.nanoTime());
    }

    public SpanScope withSpan(TraceHandle handle, String name) {
        if (handle == null) {
            return SpanScope.NOOP;
        }
        return open(handle.context(), name);
    }

    /**
     * 在当前线程绑定的 trace 下开启 span；无上下文时为空操作。
     */
    public SpanScope span(String name) {
        return open(TraceContextHolder.current(), name);
    }

    public String currentTraceId() {
        TraceContext context = TraceContextHolder.current();
        return context == null ? null : context.getTraceId();
    }

    /**
     * 输出已采集的 span 并解绑，恢复 begin 之前的线程上下文。可重复调用。
     */
    public void flush(TraceHandle handle) {
        if (handle == null) {
            return;
        }
        TraceContext context = handle.context();
        boolean alreadyClosed = context.isClosed();
        List<TraceSpanEntity> spans = context.close();
        if (TraceContextHolder.current() == context) {
            TraceContextHolder.restore(handle.previousContext());
            if (handle.previousContext() == null && handle.previousMdcTraceId() != null) {
                MDC.put(Constants.MDC_TRACE_ID, handle.previousMdcTraceId());
            }
        }
        if (alreadyClosed || !context.isSampled()) {
            return;
        }
        try {
            traceSink.export(new TraceRecord(context.getTraceId(), context.getUserId(), context.getMetadata(), spans));
        } catch (RuntimeException ex) {
            log.warn("TRACE_FLUSH_FAILED traceId={}, spans={}, error={}", context.getTraceId(), spans.size(), ex.getMessage());
        }
    }

    public String traceUrl(String traceId) {
        if (traceId == null || uiBaseUrl == null || uiBaseUrl.isEmpty() || !sampler.isEnabled()) {
            return null;
        }
        return uiBaseUrl + "/trace/" + traceId;
    }

    /**
     * 捕获当前线程的 trace 上下文，在执行线程上绑定后运行，结束后恢复执行线程原有上下文。
     */
    public <T> Callable<T> wrap(Callable<T> task) {
        TraceContext captured = TraceContextHolder.current();
        return () -> {
            TraceContext previous = TraceContextHolder.bind(captured);
            try {
                return task.call();
            } finally {
                TraceContextHolder.restore(previous);
            }
        };
    }

    public Runnable wrap(Runnable task) {
        TraceContext captured = TraceContextHolder.current();
        return () -> {
            TraceContext previous = TraceContextHolder.bind(captured);
            try {
                task.run();
            } finally {
                TraceContextHolder.restore(previous);
            }
        };
    }

    private SpanScope open(TraceContext context, String name) {
        if (context == null || !context.isSampled() || context.isClosed()) {
            return SpanScope.NOOP;
        }
        return new RecordingSpanScope(context, name);
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static final class RecordingSpanScope implements SpanScope {

        private final TraceContext context;
        private final TraceSpanEntity span;
        private final long startNanos;
        private boolean closed;

        private RecordingSpanScope(TraceContext context, String name) {
            this.context = context;
            this.startNanos = System.nanoTime();
            this.span = new TraceSpanEntity();
            span.setTraceId(context.getTraceId());
            span.setSpanId(newId().substring(0, 16));
            span.setName(name);
            span.setStatus(SpanStatusEnum.OK);
            span.setStartedAt(LocalDateTime.now());
            span.setParentSpanId(context.push(span.getSpanId()));
        }

        @Override
        public String spanId() {
            return span.getSpanId();
        }

        @Override
        public SpanScope attribute(String key, Object value) {
            if (key != null && value != null) {
                span.getAttributes().put(key, value);
            }
            return this;
        }

        @Override
        public void markError(Throwable error) {
            markError(error == null ? null : error.getClass().getSimpleName() + ": " + error.getMessage());
        }

        @Override
        public void markError(String message) {
            span.setStatus(SpanStatusEnum.ERROR);
            span.setErrorMessage(message);
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            span.setEndedAt(LocalDateTime.now());
            span.setDurationMs((System.nanoTime() - startNanos) / 1_000_000L);
            context.finish(span.getSpanId(), span);
        }
    }
}

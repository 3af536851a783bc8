package com.convoagent.domain.trace.model.valobj;

/**
 * begin_trace 返回的句柄，记录绑定前线程上的上下文，flush 时恢复。
 */
public final class TraceHandle {

    private final TraceContext context;
    private final TraceContext previous;
    private final String previousMdcTraceId;
    private final long startedNanos;

    public TraceHandle(TraceContext context, TraceContext previous, String previousMdcTraceId, long startedNanos) {
        this.context = context;
        this.previous = previous;
        this.previousMdcTraceId = previousMdcTraceId;
        this.startedNanos = startedNanos;
    }

    public TraceContext context() {
        return context;
    }

    public TraceContext previousContext() {
        return previous;
    }

    public String previousMdcTraceId() {
        return previousMdcTraceId;
    }

    public String traceId() {
        return context.getTraceId();
    }

    public boolean sampled() {
        return context.isSampled();
    }

    public long startedNanos() {
        return startedNanos;
    }
}

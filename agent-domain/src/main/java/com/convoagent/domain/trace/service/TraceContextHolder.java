package com.convoagent.domain.trace.service;

import com.convoagent.domain.trace.model.valobj.TraceContext;
import com.convoagent.types.common.Constants;
import org.slf4j.MDC;

/**
 * 线程级 trace 上下文持有者，同时维护 MDC 中的 traceId。
 */
public final class TraceContextHolder {

    private static final ThreadLocal<TraceContext> CURRENT = new ThreadLocal<>();

    private TraceContextHolder() {
    }

    public static TraceContext current() {
        return CURRENT.get();
    }

    /**
     * 绑定上下文并返回此前绑定的上下文（可能为 null），调用方负责恢复。
     */
    public static TraceContext bind(TraceContext context) {
        TraceContext previous = CURRENT.get();
        if (context == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(context);
        }
        syncMdc(previous, context);
        return previous;
    }

    public static void restore(TraceContext previous) {
        TraceContext current = CURRENT.get();
        if (previous == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
        syncMdc(current, previous);
    }

    private static void syncMdc(TraceContext from, TraceContext to) {
        if (to != null) {
            MDC.put(Constants.MDC_TRACE_ID, to.getTraceId());
        } else if (from != null && from.getTraceId().equals(MDC.get(Constants.MDC_TRACE_ID))) {
            MDC.remove(Constants.MDC_TRACE_ID);
        }
    }
}

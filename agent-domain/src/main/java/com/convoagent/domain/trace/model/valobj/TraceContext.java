package com.convoagent.domain.trace.model.valobj;

import com.convoagent.domain.trace.model.entity.TraceSpanEntity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次调用独占的 trace 上下文。
 * <p>
 * 同一次调用的工作可能在调用线程与工作线程之间切换，但同一时刻只有一个线程推进，
 * span 栈与已结束 span 列表的访问在本对象上同步。flush 之后的写入被忽略。
 * </p>
 */
public class TraceContext {

    private final String traceId;
    private final boolean sampled;
    private final String userId;
    private final Map<String, Object> metadata;
    private final Deque<String> spanStack = new ArrayDeque<>();
    private final List<TraceSpanEntity> finishedSpans = new ArrayList<>();
    private boolean closed;

    public TraceContext(String traceId, boolean sampled, String userId, Map<String, Object> metadata) {
        this.traceId = traceId;
        this.sampled = sampled;
        this.userId = userId;
        this.metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getTraceId() {
        return traceId;
    }

    public boolean isSampled() {
        return sampled;
    }

    public String getUserId() {
        return userId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * 压入 span，返回父 span id。
     */
    public synchronized String push(String spanId) {
        String parent = spanStack.peekLast();
        if (!closed) {
            spanStack.addLast(spanId);
        }
        return parent;
    }

    /**
     * 结束 span。按 id 移除而非盲目出栈，被放弃的工作线程晚到的结束不会破坏栈。
     */
    public synchronized void finish(String spanId, TraceSpanEntity span) {
        spanStack.removeLastOccurrence(spanId);
        if (!closed && span != null) {
            finishedSpans.add(span);
        }
    }

    public synchronized List<TraceSpanEntity> close() {
        closed = true;
        spanStack.clear();
        return new ArrayList<>(finishedSpans);
    }
}

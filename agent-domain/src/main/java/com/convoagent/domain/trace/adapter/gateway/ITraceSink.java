package com.convoagent.domain.trace.adapter.gateway;

import com.convoagent.domain.trace.model.valobj.TraceRecord;

/**
 * Trace 输出端。实现不得抛出异常影响调用结果。
 */
public interface ITraceSink {

    void export(TraceRecord record);
}

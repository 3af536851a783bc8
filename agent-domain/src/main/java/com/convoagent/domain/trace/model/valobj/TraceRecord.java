package com.convoagent.domain.trace.model.valobj;

import com.convoagent.domain.trace.model.entity.TraceSpanEntity;

import java.util.List;
import java.util.Map;

/**
 * flush 时交给 trace sink 的快照。
 */
public record TraceRecord(String traceId,
                          String userId,
                          Map<String, Object> metadata,
                          List<TraceSpanEntity> spans) {
}

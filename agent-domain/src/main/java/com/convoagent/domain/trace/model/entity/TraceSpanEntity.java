package com.convoagent.domain.trace.model.entity;

import com.convoagent.types.enums.SpanStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 已结束的 span。
 */
@Data
public class TraceSpanEntity {

    private String traceId;
    private String spanId;
    private String parentSpanId;
    private String name;
    private SpanStatusEnum status;
    private String errorMessage;
    private Map<String, Object> attributes = new LinkedHashMap<>();
    private LocalDateTime startedAt;
    private LocalDateTime endedAt;
    private Long durationMs;
}

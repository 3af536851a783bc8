package com.convoagent.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Trace span PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentTraceSpanPO {

    private String traceId;
    private String spanId;
    private String parentSpanId;
    private String name;
    private String status;
    private String errorMessage;
    private String attributes;
    private String userId;
    private LocalDateTime startedAt;
    private LocalDateTime endedAt;
    private Long durationMs;
}

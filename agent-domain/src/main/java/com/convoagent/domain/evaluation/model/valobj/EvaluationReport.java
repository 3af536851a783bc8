package com.convoagent.domain.evaluation.model.valobj;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 一次评测批次的报告。successCount 统计所有待评指标都成功的运行记录数。
 */
@Data
@Builder
public class EvaluationReport {

    private LocalDateTime startedAt;
    private long durationMs;
    private String judgeModel;
    private LocalDateTime windowStart;
    private LocalDateTime windowEnd;
    private int total;
    private int successCount;
    private int failureCount;
    private int skippedPairs;
    private Map<String, MetricSummary> perMetricSummary;
}

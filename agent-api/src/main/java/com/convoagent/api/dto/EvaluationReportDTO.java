package com.convoagent.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 离线评测批次报告。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EvaluationReportDTO {

    private LocalDateTime startedAt;
    private Long durationMs;
    private String judgeModel;
    private LocalDateTime windowStart;
    private LocalDateTime windowEnd;
    private Integer total;
    private Integer successCount;
    private Integer failureCount;
    private Integer skippedPairs;
    private Map<String, MetricSummaryDTO> perMetricSummary;
}

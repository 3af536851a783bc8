package com.convoagent.domain.evaluation.model.entity;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 评测分数实体，(runId, metricName) 唯一。
 */
@Data
public class EvaluationScoreEntity {

    private Long id;
    private String runId;
    private String metricName;
    private Double score;
    private Map<String, Object> metadata;
    private LocalDateTime createdAt;

    public void validate() {
        if (runId == null || runId.trim().isEmpty()) {
            throw new IllegalStateException("Run ID cannot be empty");
        }
        if (metricName == null || metricName.trim().isEmpty()) {
            throw new IllegalStateException("Metric name cannot be empty");
        }
        if (score == null || score.isNaN() || score < 0D || score > 1D) {
            throw new IllegalStateException("Score must be within [0, 1]");
        }
    }
}

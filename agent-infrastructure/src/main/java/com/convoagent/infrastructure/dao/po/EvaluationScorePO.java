package com.convoagent.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 评测分数 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationScorePO {

    private Long id;
    private String runId;
    private String metricName;
    private Double score;
    private String metadata;
    private LocalDateTime createdAt;
}

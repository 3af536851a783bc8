package com.convoagent.domain.evaluation.adapter.repository;

import com.convoagent.domain.evaluation.model.entity.EvaluationScoreEntity;

import java.util.Set;

/**
 * 评测分数仓储接口。
 */
public interface IEvaluationScoreRepository {

    /**
     * 不存在同一 (runId, metricName) 分数时写入。已存在时不覆盖，返回 false。
     */
    boolean saveIfAbsent(EvaluationScoreEntity entity);

    Set<String> findScoredMetricNames(String runId);
}

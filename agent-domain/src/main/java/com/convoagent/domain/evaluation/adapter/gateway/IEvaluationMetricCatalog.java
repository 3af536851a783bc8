package com.convoagent.domain.evaluation.adapter.gateway;

import com.convoagent.domain.evaluation.model.valobj.EvaluationMetric;

import java.util.List;

/**
 * 评测指标目录。
 */
public interface IEvaluationMetricCatalog {

    List<EvaluationMetric> loadMetrics();
}

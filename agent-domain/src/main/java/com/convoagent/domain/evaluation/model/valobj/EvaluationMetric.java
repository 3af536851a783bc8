package com.convoagent.domain.evaluation.model.valobj;

/**
 * 评测指标：名称与给评审模型的评分细则。
 */
public record EvaluationMetric(String name, String rubric) {
}

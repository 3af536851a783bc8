package com.convoagent.domain.evaluation.adapter.gateway;

import com.convoagent.domain.evaluation.model.valobj.EvaluationMetric;
import com.convoagent.domain.evaluation.model.valobj.JudgeVerdict;

/**
 * 评审模型网关。
 */
public interface IJudgeGateway {

    JudgeVerdict judge(EvaluationMetric metric, String input, String output);

    String judgeModel();
}

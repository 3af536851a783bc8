package com.convoagent.domain.evaluation.adapter.gateway;

import com.convoagent.domain.evaluation.model.valobj.EvaluationReport;

/**
 * 评测报告输出。
 */
public interface IEvaluationReportWriter {

    void write(EvaluationReport report);
}

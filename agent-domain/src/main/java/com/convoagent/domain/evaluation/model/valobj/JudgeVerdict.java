package com.convoagent.domain.evaluation.model.valobj;

/**
 * 评审结果。
 */
public record JudgeVerdict(Double score, String reasoning) {
}

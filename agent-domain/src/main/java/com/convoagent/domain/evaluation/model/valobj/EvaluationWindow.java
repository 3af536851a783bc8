package com.convoagent.domain.evaluation.model.valobj;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 评测时间窗口 [start, end)。
 */
public record EvaluationWindow(LocalDateTime start, LocalDateTime end) {

    public EvaluationWindow {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("Evaluation window start must be before end");
        }
    }

    public static EvaluationWindow lookback(LocalDateTime now, Duration lookback) {
        return new EvaluationWindow(now.minus(lookback), now);
    }
}

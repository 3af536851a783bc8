package com.convoagent.domain.graph.model.valobj;

import java.time.Duration;

/**
 * 单轮执行约束。
 *
 * @param defaultBudget                单次调用的墙钟预算
 * @param maxSteps                     执行节点最多生成次数，耗尽视为节点失败
 * @param maxConsecutiveToolFailures   连续工具失败达到该值后，下一次生成不再提供工具
 */
public record ExecutionPolicy(Duration defaultBudget, int maxSteps, int maxConsecutiveToolFailures) {

    public ExecutionPolicy {
        if (defaultBudget == null || defaultBudget.isZero() || defaultBudget.isNegative()) {
            defaultBudget = Duration.ofSeconds(60);
        }
        if (maxSteps <= 0) {
            maxSteps = 8;
        }
        if (maxConsecutiveToolFailures <= 0) {
            maxConsecutiveToolFailures = 3;
        }
    }
}

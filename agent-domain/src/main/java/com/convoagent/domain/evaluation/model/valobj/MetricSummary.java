package com.convoagent.domain.evaluation.model.valobj;

/**
 * 单指标累计统计。
 */
public class MetricSummary {

    private int successCount;
    private int failureCount;
    private double scoreSum;

    public void recordSuccess(double score) {
        successCount++;
        scoreSum += score;
    }

    public void recordFailure() {
        failureCount++;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    /**
     * 平均分保留两位小数；没有成功样本时为 null。
     */
    public Double getAvgScore() {
        if (successCount == 0) {
            return null;
        }
        return Math.round(scoreSum / successCount * 100D) / 100D;
    }
}

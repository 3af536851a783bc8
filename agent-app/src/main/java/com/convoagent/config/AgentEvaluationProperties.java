package com.convoagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 离线评测配置，前缀 agent.evaluation。
 */
@Data
@ConfigurationProperties(prefix = "agent.evaluation", ignoreInvalidFields = true)
public class AgentEvaluationProperties {

    private String judgeModel = "gpt-4o-mini";

    /** 回看窗口 */
    private Duration lookback = Duration.ofHours(24);

    /** 单个 (run, metric) 的最大评审次数 */
    private int maxAttempts = 3;

    private Duration retryBackoff = Duration.ofSeconds(10);

    /** 每页读取的待评测运行记录数，一次评测按页读完整个窗口 */
    private int batchLimit = 100;

    /** 报告输出目录，为空时不落盘 */
    private String reportDir;

    private boolean scheduleEnabled = false;

    private long scheduleIntervalMs = 3_600_000L;
}

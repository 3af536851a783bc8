package com.convoagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 图引擎运行配置，前缀 agent.runtime。
 */
@Data
@ConfigurationProperties(prefix = "agent.runtime", ignoreInvalidFields = true)
public class AgentRuntimeProperties {

    /** 对话模型名称 */
    private String modelName = "gpt-4o-mini";

    /** 对话模型采样温度 */
    private Double temperature = 0.2D;

    /** 单次调用墙钟预算 */
    private Duration budget = Duration.ofSeconds(60);

    /** 执行节点最大生成次数 */
    private int maxSteps = 8;

    /** 连续工具失败上限，达到后下一次生成不再提供工具 */
    private int maxConsecutiveToolFailures = 3;

    /** 线程锁分段数 */
    private int lockStripes = 256;
}

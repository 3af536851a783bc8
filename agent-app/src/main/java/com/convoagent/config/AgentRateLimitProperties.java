package com.convoagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 准入限流配置，前缀 agent.rate-limit。
 */
@Data
@ConfigurationProperties(prefix = "agent.rate-limit", ignoreInvalidFields = true)
public class AgentRateLimitProperties {

    /** 是否启用 */
    private boolean enabled = true;

    /** 每个窗口允许的调用次数，查询接口按两倍放宽 */
    private long perMinute = 60L;

    /** 固定窗口长度 */
    private Duration window = Duration.ofSeconds(60);

    /** 本地最多跟踪的身份数 */
    private long maxTrackedIdentities = 100_000L;
}

package com.convoagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Trace 配置，前缀 agent.trace。
 */
@Data
@ConfigurationProperties(prefix = "agent.trace", ignoreInvalidFields = true)
public class AgentTraceProperties {

    /** 是否采集 trace */
    private boolean enabled = true;

    /** 采样比例（0~1） */
    private double sampleRate = 1.0D;

    /** trace 查看页面地址前缀，为空时不返回 trace_url */
    private String uiBaseUrl;
}

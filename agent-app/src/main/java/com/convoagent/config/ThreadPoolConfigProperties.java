package com.convoagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 节点工作线程池配置，前缀 thread.pool.executor.config。
 * <p>
 * 模型生成与工具调用都提交到该线程池，调用线程按截止时间等待结果。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数 */
    private Integer corePoolSize = 16;

    /** 最大线程数 */
    private Integer maxPoolSize = 64;

    /** 空闲线程存活时间（秒） */
    private Long keepAliveTime = 60L;

    /** 有界队列容量，最小为 1 */
    private Integer blockQueueSize = 5000;

    /** 线程名前缀 */
    private String threadNamePrefix = "agent-node-worker-";

    /**
     * 拒绝策略，默认 AbortPolicy。
     * <ul>
     *   <li>AbortPolicy：队列已满时抛出 RejectedExecutionException，节点按失败处理</li>
     *   <li>DiscardPolicy：直接丢弃任务</li>
     *   <li>DiscardOldestPolicy：丢弃最早进入队列的任务后重试</li>
     *   <li>CallerRunsPolicy：由提交线程执行，截止时间不再生效</li>
     * </ul>
     */
    private String policy = "AbortPolicy";

}

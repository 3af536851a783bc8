package com.convoagent.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    /**
     * 图节点工作线程池：承载模型生成与工具调用，超时的调用由引擎取消并放弃等待。
     * <p>
     * 线程占满时任务进入有界队列排队，排队时间计入调用方的截止时间；只有队列也满时才拒绝。
     * </p>
     */
    @Bean(name = "agentNodeWorker", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "agentNodeWorker")
    public ThreadPoolExecutor agentNodeWorker(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCorePoolSize(), 1);
        int maxSize = Math.max(properties.getMaxPoolSize(), coreSize);
        long keepAliveSeconds = Math.max(properties.getKeepAliveTime(), 0L);
        int queueCapacity = Math.max(properties.getBlockQueueSize(), 1);
        BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>(queueCapacity);
        String threadNamePrefix = properties.getThreadNamePrefix();
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("AGENT_NODE_WORKER_INIT coreSize={}, maxSize={}, queueCapacity={}, policy={}",
                coreSize, maxSize, queueCapacity, properties.getPolicy());
        return new ThreadPoolExecutor(
                coreSize,
                maxSize,
                keepAliveSeconds,
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(properties.getPolicy()));
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}

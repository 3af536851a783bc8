package com.convoagent.config;

import com.convoagent.domain.admission.adapter.repository.IRateBudgetRepository;
import com.convoagent.domain.admission.service.AdmissionControlDomainService;
import com.convoagent.domain.conversation.adapter.repository.ICheckpointRepository;
import com.convoagent.domain.conversation.service.ConversationDomainService;
import com.convoagent.domain.evaluation.adapter.gateway.IEvaluationMetricCatalog;
import com.convoagent.domain.evaluation.adapter.gateway.IEvaluationReportWriter;
import com.convoagent.domain.evaluation.adapter.gateway.IJudgeGateway;
import com.convoagent.domain.evaluation.adapter.repository.IEvaluationScoreRepository;
import com.convoagent.domain.evaluation.service.EvaluationPipelineService;
import com.convoagent.domain.graph.adapter.gateway.IChatModelGateway;
import com.convoagent.domain.graph.model.valobj.ExecutionPolicy;
import com.convoagent.domain.graph.service.AgentGraphEngine;
import com.convoagent.domain.graph.service.AgentPromptDomainService;
import com.convoagent.domain.graph.service.GraphTransitionDomainService;
import com.convoagent.domain.run.adapter.repository.IAgentRunRepository;
import com.convoagent.domain.tool.service.ToolRegistryFactory;
import com.convoagent.domain.trace.adapter.gateway.ITraceSink;
import com.convoagent.domain.trace.service.AgentTracer;
import com.convoagent.domain.trace.service.TraceSampler;
import com.convoagent.infrastructure.evaluation.JsonFileEvaluationReportWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 领域服务装配：需要外部参数的领域对象在此以 Bean 形式构建。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
        AgentRuntimeProperties.class,
        AgentTraceProperties.class,
        AgentRateLimitProperties.class,
        AgentEvaluationProperties.class
})
public class AgentDomainConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public AgentTracer agentTracer(AgentTraceProperties properties, ITraceSink traceSink) {
        TraceSampler sampler = new TraceSampler(properties.isEnabled(), properties.getSampleRate());
        log.info("AGENT_TRACER_INIT enabled={}, sampleRate={}, uiBaseUrl={}",
                sampler.isEnabled(), sampler.getSampleRate(), properties.getUiBaseUrl());
        return new AgentTracer(sampler, traceSink, properties.getUiBaseUrl());
    }

    @Bean
    public AdmissionControlDomainService admissionControlDomainService(IRateBudgetRepository rateBudgetRepository,
                                                                       Clock clock,
                                                                       AgentRateLimitProperties properties) {
        return new AdmissionControlDomainService(rateBudgetRepository,
                clock,
                properties.isEnabled(),
                properties.getPerMinute(),
                properties.getWindow());
    }

    @Bean
    public AgentGraphEngine agentGraphEngine(ICheckpointRepository checkpointRepository,
                                             IChatModelGateway chatModelGateway,
                                             ToolRegistryFactory toolRegistryFactory,
                                             ConversationDomainService conversationDomainService,
                                             GraphTransitionDomainService graphTransitionDomainService,
                                             AgentPromptDomainService agentPromptDomainService,
                                             AgentTracer agentTracer,
                                             @Qualifier("agentNodeWorker") ThreadPoolExecutor agentNodeWorker,
                                             AgentRuntimeProperties properties) {
        ExecutionPolicy policy = new ExecutionPolicy(properties.getBudget(),
                properties.getMaxSteps(),
                properties.getMaxConsecutiveToolFailures());
        log.info("AGENT_ENGINE_INIT model={}, budget={}, maxSteps={}, maxConsecutiveToolFailures={}",
                chatModelGateway.modelName(), policy.defaultBudget(), policy.maxSteps(), policy.maxConsecutiveToolFailures());
        return new AgentGraphEngine(checkpointRepository,
                chatModelGateway,
                toolRegistryFactory,
                conversationDomainService,
                graphTransitionDomainService,
                agentPromptDomainService,
                agentTracer,
                agentNodeWorker,
                policy,
                properties.getLockStripes());
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.evaluation", name = "report-dir")
    public JsonFileEvaluationReportWriter evaluationReportWriter(AgentEvaluationProperties properties,
                                                                 ObjectMapper objectMapper) {
        return new JsonFileEvaluationReportWriter(Paths.get(properties.getReportDir()), objectMapper);
    }

    @Bean
    public EvaluationPipelineService evaluationPipelineService(IAgentRunRepository agentRunRepository,
                                                               IEvaluationScoreRepository evaluationScoreRepository,
                                                               IJudgeGateway judgeGateway,
                                                               IEvaluationMetricCatalog evaluationMetricCatalog,
                                                               ObjectProvider<IEvaluationReportWriter> reportWriter,
                                                               Clock clock,
                                                               AgentEvaluationProperties properties) {
        return new EvaluationPipelineService(agentRunRepository,
                evaluationScoreRepository,
                judgeGateway,
                evaluationMetricCatalog,
                reportWriter.getIfAvailable(),
                clock,
                properties.getMaxAttempts(),
                properties.getRetryBackoff(),
                properties.getBatchLimit());
    }
}

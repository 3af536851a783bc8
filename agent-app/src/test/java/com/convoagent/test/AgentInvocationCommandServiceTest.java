package com.convoagent.test;

import com.convoagent.api.dto.AgentInvocationRequestDTO;
import com.convoagent.api.dto.AgentInvocationResponseDTO;
import com.convoagent.domain.admission.service.AdmissionControlDomainService;
import com.convoagent.domain.conversation.service.ConversationDomainService;
import com.convoagent.domain.graph.model.valobj.AgentTurnCommand;
import com.convoagent.domain.graph.model.valobj.ChatGeneration;
import com.convoagent.domain.graph.model.valobj.ExecutionPolicy;
import com.convoagent.domain.graph.service.AgentGraphEngine;
import com.convoagent.domain.graph.service.AgentPromptDomainService;
import com.convoagent.domain.graph.service.GraphTransitionDomainService;
import com.convoagent.domain.run.model.entity.AgentRunEntity;
import com.convoagent.domain.run.service.AgentRunRecorder;
import com.convoagent.domain.tool.service.ToolRegistryFactory;
import com.convoagent.domain.trace.model.entity.TraceSpanEntity;
import com.convoagent.domain.trace.model.valobj.TraceRecord;
import com.convoagent.domain.trace.service.AgentTracer;
import com.convoagent.domain.trace.service.TraceSampler;
import com.convoagent.infrastructure.repository.admission.RateBudgetRepositoryImpl;
import com.convoagent.test.support.InMemoryAgentRunRepository;
import com.convoagent.test.support.InMemoryCheckpointRepository;
import com.convoagent.test.support.MutableClock;
import com.convoagent.test.support.RecordingTraceSink;
import com.convoagent.test.support.ScriptedChatModelGateway;
import com.convoagent.trigger.application.command.AgentInvocationCommandService;
import com.convoagent.trigger.application.common.AdmissionGuard;
import com.convoagent.types.enums.ResponseCode;
import com.convoagent.types.enums.RunStatusEnum;
import com.convoagent.types.exception.AdmissionRejectedException;
import com.convoagent.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.cache.CacheBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class AgentInvocationCommandServiceTest {

    private InMemoryCheckpointRepository checkpointRepository;
    private InMemoryAgentRunRepository agentRunRepository;
    private ScriptedChatModelGateway chatModelGateway;
    private RecordingTraceSink traceSink;
    private ExecutorService nodeWorker;
    private MutableClock clock;

    @BeforeEach
    public void setUp() {
        checkpointRepository = new InMemoryCheckpointRepository();
        agentRunRepository = new InMemoryAgentRunRepository();
        chatModelGateway = new ScriptedChatModelGateway();
        traceSink = new RecordingTraceSink();
        nodeWorker = Executors.newCachedThreadPool();
        clock = new MutableClock(Instant.ofEpochMilli(60_000L * 28_333_334L + 5_000L));
    }

    @AfterEach
    public void tearDown() {
        nodeWorker.shutdownNow();
    }

    @Test
    public void shouldRecordSuccessfulRunAndReturnTraceUrl() {
        AgentTracer tracer = tracer(true);
        AgentInvocationCommandService service = service(engine(tracer), tracer, 10);
        chatModelGateway.thenText("answer directly").thenText("Hello! How can I help?");

        AgentInvocationResponseDTO response = service.invoke("u-1", request("  hello  ", null, Map.of("source", "web")));

        Assertions.assertEquals("success", response.getStatus());
        Assertions.assertEquals("Hello! How can I help?", response.getResponse());
        Assertions.assertEquals("answer directly", response.getPlan());
        Assertions.assertEquals(Boolean.FALSE, response.getTruncated());
        Assertions.assertNotNull(response.getTraceId());
        Assertions.assertEquals("http://trace.local/trace/" + response.getTraceId(), response.getTraceUrl());

        List<AgentRunEntity> runs = agentRunRepository.all();
        Assertions.assertEquals(1, runs.size());
        AgentRunEntity run = runs.get(0);
        Assertions.assertEquals(response.getRunId(), run.getRunId());
        Assertions.assertEquals(response.getThreadId(), run.getThreadId());
        Assertions.assertEquals("u-1", run.getUserId());
        Assertions.assertEquals("hello", run.getInput());
        Assertions.assertEquals(RunStatusEnum.SUCCESS, run.getStatus());
        Assertions.assertEquals(response.getTraceId(), run.getTraceId());
        Assertions.assertEquals("scripted-model", run.getMetadata().get("model"));
        Assertions.assertEquals(Boolean.FALSE, run.getMetadata().get("truncated"));
        Assertions.assertEquals("web", run.getMetadata().get("source"));

        Assertions.assertEquals(1, traceSink.records().size());
        TraceRecord record = traceSink.records().get(0);
        Assertions.assertEquals(response.getTraceId(), record.traceId());
        Assertions.assertEquals("web", record.metadata().get("source"));
        Assertions.assertEquals(response.getThreadId(), record.metadata().get("thread_id"));
        List<String> spanNames = record.spans().stream().map(TraceSpanEntity::getName).collect(Collectors.toList());
        Assertions.assertTrue(spanNames.contains("agent.run"));
        Assertions.assertTrue(spanNames.contains("node.planner"));
    }

    @Test
    public void shouldOmitTraceUrlWhenTraceIsNotSampled() {
        AgentTracer tracer = tracer(false);
        AgentInvocationCommandService service = service(engine(tracer), tracer, 10);
        chatModelGateway.thenText("answer directly").thenText("Hi");

        AgentInvocationResponseDTO response = service.invoke("u-1", request("hello", "thread-7", null));

        Assertions.assertEquals("thread-7", response.getThreadId());
        Assertions.assertNull(response.getTraceUrl());
        Assertions.assertTrue(traceSink.records().isEmpty());
        Assertions.assertEquals(1, agentRunRepository.all().size());
    }

    @Test
    public void shouldRecordErrorRunWhenEngineThrowsUnexpectedly() {
        AgentTracer tracer = tracer(true);
        AgentGraphEngine brokenEngine = mock(AgentGraphEngine.class);
        when(brokenEngine.execute(any(AgentTurnCommand.class))).thenThrow(new IllegalStateException("graph exploded"));
        when(brokenEngine.modelName()).thenReturn("scripted-model");
        AgentInvocationCommandService service = service(brokenEngine, tracer, 10);

        AgentInvocationResponseDTO response = service.invoke("u-1", request("hello", null, null));

        Assertions.assertEquals("error", response.getStatus());
        Assertions.assertEquals(new ConversationDomainService().failureMessage(null), response.getResponse());
        AgentRunEntity run = agentRunRepository.all().get(0);
        Assertions.assertEquals(RunStatusEnum.ERROR, run.getStatus());
        Assertions.assertEquals("graph exploded", run.getErrorMessage());
        Assertions.assertEquals(1, traceSink.records().size());
    }

    @Test
    public void shouldRecordErrorRunWhenCheckpointStoreIsDown() {
        AgentTracer tracer = tracer(true);
        AgentInvocationCommandService service = service(engine(tracer), tracer, 10);
        checkpointRepository.setUnavailable(true);

        AgentInvocationResponseDTO response = service.invoke("u-1", request("hello", null, null));

        Assertions.assertEquals("error", response.getStatus());
        Assertions.assertEquals(RunStatusEnum.ERROR, agentRunRepository.all().get(0).getStatus());
        Assertions.assertTrue(chatModelGateway.requests().isEmpty());
    }

    @Test
    public void shouldRejectInvalidInputBeforeAdmissionAndWithoutRecording() {
        AgentTracer tracer = tracer(true);
        AgentInvocationCommandService service = service(engine(tracer), tracer, 1);

        AppException blank = Assertions.assertThrows(AppException.class,
                () -> service.invoke("u-1", request("   ", null, null)));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), blank.getCode());
        AppException badThread = Assertions.assertThrows(AppException.class,
                () -> service.invoke("u-1", request("hello", "bad thread id!", null)));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), badThread.getCode());
        Assertions.assertTrue(agentRunRepository.all().isEmpty());
        Assertions.assertTrue(traceSink.records().isEmpty());

        chatModelGateway.thenText("answer directly").thenText("Hi");
        AgentInvocationResponseDTO admitted = service.invoke("u-1", request("hello", null, null));
        Assertions.assertEquals("success", admitted.getStatus());
    }

    @Test
    public void shouldNotRunEngineWhenAdmissionRejects() {
        AgentTracer tracer = tracer(true);
        AgentInvocationCommandService service = service(engine(tracer), tracer, 1);
        chatModelGateway.thenText("answer directly").thenText("Hi");
        service.invoke("u-1", request("hello", null, null));
        int modelCalls = chatModelGateway.requests().size();

        AdmissionRejectedException rejected = Assertions.assertThrows(AdmissionRejectedException.class,
                () -> service.invoke("u-1", request("hello again", null, null)));

        Assertions.assertEquals(55L, rejected.getRetryAfterSeconds());
        Assertions.assertEquals(modelCalls, chatModelGateway.requests().size());
        Assertions.assertEquals(1, agentRunRepository.all().size());

        chatModelGateway.thenText("answer directly").thenText("Hi other");
        Assertions.assertEquals("success", service.invoke("u-2", request("hello", null, null)).getStatus());
    }

    @Test
    public void shouldRecordTimeoutRunWithLatencyCoveringBudget() {
        AgentTracer tracer = tracer(true);
        Duration budget = Duration.ofMillis(200);
        AgentInvocationCommandService service = service(
                engine(tracer, new ExecutionPolicy(budget, 8, 3)), tracer, 10);
        chatModelGateway.otherwise(request -> {
            try {
                Thread.sleep(2_000L);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", ex);
            }
            return ChatGeneration.text("too late");
        });

        AgentInvocationResponseDTO response = service.invoke("u-1", request("hello", "t-timeout", null));

        Assertions.assertEquals("timeout", response.getStatus());
        AgentRunEntity run = agentRunRepository.findById(response.getRunId());
        Assertions.assertNotNull(run);
        Assertions.assertEquals(RunStatusEnum.TIMEOUT, run.getStatus());
        Assertions.assertTrue(run.getLatencyMs() >= budget.toMillis(), "latency " + run.getLatencyMs());
        Assertions.assertNull(checkpointRepository.snapshot("t-timeout"));
    }

    @Test
    public void shouldRejectContinuingAnotherUsersThread() {
        AgentTracer tracer = tracer(true);
        AgentInvocationCommandService service = service(engine(tracer), tracer, 10);
        chatModelGateway.thenText("answer directly").thenText("Your secret is safe.");
        service.invoke("u-1", request("remember my secret", "t-owned", null));
        int modelCalls = chatModelGateway.requests().size();

        AppException forbidden = Assertions.assertThrows(AppException.class,
                () -> service.invoke("u-2", request("what was the secret?", "t-owned", null)));

        Assertions.assertEquals(ResponseCode.FORBIDDEN.getCode(), forbidden.getCode());
        Assertions.assertEquals(modelCalls, chatModelGateway.requests().size());
        Assertions.assertEquals(1, agentRunRepository.all().size());
        Assertions.assertEquals(2, checkpointRepository.snapshot("t-owned").history().size());
        Assertions.assertEquals("u-1", checkpointRepository.snapshot("t-owned").getUserId());
    }

    private AgentInvocationRequestDTO request(String message, String threadId, Map<String, Object> metadata) {
        AgentInvocationRequestDTO request = new AgentInvocationRequestDTO();
        request.setMessage(message);
        request.setThreadId(threadId);
        request.setMetadata(metadata);
        return request;
    }

    private AgentTracer tracer(boolean sampled) {
        return new AgentTracer(new TraceSampler(true, sampled ? 1D : 0D), traceSink, "http://trace.local/");
    }

    private AgentGraphEngine engine(AgentTracer tracer) {
        return engine(tracer, new ExecutionPolicy(Duration.ofSeconds(5), 8, 3));
    }

    private AgentGraphEngine engine(AgentTracer tracer, ExecutionPolicy policy) {
        return new AgentGraphEngine(
                checkpointRepository,
                chatModelGateway,
                new ToolRegistryFactory(List.of(), new ObjectMapper()),
                new ConversationDomainService(),
                new GraphTransitionDomainService(),
                new AgentPromptDomainService(),
                tracer,
                nodeWorker,
                policy,
                16);
    }

    private AgentInvocationCommandService service(AgentGraphEngine engine, AgentTracer tracer, long limit) {
        AdmissionControlDomainService admission = new AdmissionControlDomainService(
                new RateBudgetRepositoryImpl(CacheBuilder.newBuilder().maximumSize(100L).build()),
                clock,
                true,
                limit,
                Duration.ofSeconds(60));
        return new AgentInvocationCommandService(
                engine,
                new ConversationDomainService(),
                new AgentRunRecorder(agentRunRepository),
                tracer,
                new AdmissionGuard(admission));
    }
}

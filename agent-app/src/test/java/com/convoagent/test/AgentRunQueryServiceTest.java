package com.convoagent.test;

import com.convoagent.api.dto.AgentRunDTO;
import com.convoagent.api.dto.AgentRunPageDTO;
import com.convoagent.domain.admission.service.AdmissionControlDomainService;
import com.convoagent.domain.run.model.entity.AgentRunEntity;
import com.convoagent.domain.trace.service.AgentTracer;
import com.convoagent.domain.trace.service.TraceSampler;
import com.convoagent.infrastructure.repository.admission.RateBudgetRepositoryImpl;
import com.convoagent.test.support.InMemoryAgentRunRepository;
import com.convoagent.test.support.MutableClock;
import com.convoagent.test.support.RecordingTraceSink;
import com.convoagent.trigger.application.common.AdmissionGuard;
import com.convoagent.trigger.application.common.AgentRunViewAssembler;
import com.convoagent.trigger.application.query.AgentRunQueryService;
import com.convoagent.types.enums.ResponseCode;
import com.convoagent.types.enums.RunStatusEnum;
import com.convoagent.types.exception.AdmissionRejectedException;
import com.convoagent.types.exception.AppException;
import com.google.common.cache.CacheBuilder;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

public class AgentRunQueryServiceTest {

    private static final LocalDateTime BASE_TIME = LocalDateTime.of(2026, 3, 1, 9, 0, 0);

    private InMemoryAgentRunRepository agentRunRepository;
    private AgentRunQueryService queryService;
    private String ownerRunId;

    @BeforeEach
    public void setUp() {
        agentRunRepository = new InMemoryAgentRunRepository();
        queryService = service(100L);

        ownerRunId = save("u-1", "thread-a", "What is the weather?", "Sunny", RunStatusEnum.SUCCESS, 0, "trace-1");
        save("u-1", "thread-a", "And tomorrow?", "", RunStatusEnum.TIMEOUT, 1, null);
        save("u-1", "thread-b", "Find admin", "Lookup failed", RunStatusEnum.ERROR, 2, null);
        save("u-2", "thread-c", "What is the WEATHER in Paris?", "Rainy", RunStatusEnum.SUCCESS, 3, null);
    }

    @Test
    public void shouldListOnlyCallerRunsNewestFirst() {
        AgentRunPageDTO page = queryService.listRuns("u-1", null, null, null, null, null);

        Assertions.assertEquals(3L, page.getTotal());
        Assertions.assertEquals(100, page.getLimit());
        Assertions.assertEquals(0, page.getOffset());
        Assertions.assertEquals(List.of("Find admin", "And tomorrow?", "What is the weather?"),
                page.getData().stream().map(AgentRunDTO::getInput).collect(Collectors.toList()));
        Assertions.assertTrue(page.getData().stream().allMatch(run -> "u-1".equals(run.getUserId())));
    }

    @Test
    public void shouldFilterBySearchStatusAndThread() {
        AgentRunPageDTO searched = queryService.listRuns("u-1", null, "WEATHER", null, null, null);
        Assertions.assertEquals(1L, searched.getTotal());
        Assertions.assertEquals(ownerRunId, searched.getData().get(0).getRunId());

        AgentRunPageDTO timedOut = queryService.listRuns("u-1", null, null, "timeout", null, null);
        Assertions.assertEquals(1L, timedOut.getTotal());
        Assertions.assertEquals("timeout", timedOut.getData().get(0).getStatus());

        AgentRunPageDTO thread = queryService.listRuns("u-1", "thread-a", null, null, null, null);
        Assertions.assertEquals(2L, thread.getTotal());
    }

    @Test
    public void shouldPageWithSkipAndClampedLimit() {
        AgentRunPageDTO page = queryService.listRuns("u-1", null, null, null, 1, 5000);

        Assertions.assertEquals(3L, page.getTotal());
        Assertions.assertEquals(1000, page.getLimit());
        Assertions.assertEquals(1, page.getOffset());
        Assertions.assertEquals(2, page.getData().size());
        Assertions.assertEquals("And tomorrow?", page.getData().get(0).getInput());
    }

    @Test
    public void shouldRejectUnknownStatusFilter() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> queryService.listRuns("u-1", null, null, "finished", null, null));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    @Test
    public void shouldReturnOwnRunWithTraceUrl() {
        AgentRunDTO run = queryService.getRun("u-1", false, ownerRunId);

        Assertions.assertEquals(ownerRunId, run.getRunId());
        Assertions.assertEquals("success", run.getStatus());
        Assertions.assertEquals("http://trace.local/trace/trace-1", run.getTraceUrl());
        Assertions.assertEquals(1, run.getMetadata().get("steps"));
    }

    @Test
    public void shouldReportNotFoundForMalformedOrMissingRunId() {
        AppException malformed = Assertions.assertThrows(AppException.class,
                () -> queryService.getRun("u-1", false, "not-a-uuid"));
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), malformed.getCode());
        Assertions.assertEquals("Agent run not found", malformed.getInfo());

        AppException missing = Assertions.assertThrows(AppException.class,
                () -> queryService.getRun("u-1", false, UUID.randomUUID().toString()));
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), missing.getCode());
    }

    @Test
    public void shouldForbidOtherUsersUnlessSuperuser() {
        AppException forbidden = Assertions.assertThrows(AppException.class,
                () -> queryService.getRun("u-2", false, ownerRunId));
        Assertions.assertEquals(ResponseCode.FORBIDDEN.getCode(), forbidden.getCode());
        Assertions.assertEquals("Not enough permissions to access this run", forbidden.getInfo());

        AgentRunDTO asAdmin = queryService.getRun("admin", true, ownerRunId);
        Assertions.assertEquals("u-1", asAdmin.getUserId());
    }

    @Test
    public void shouldAllowDoubleQuotaForHistoryReads() {
        AgentRunQueryService limited = service(1L);

        limited.listRuns("u-1", null, null, null, null, null);
        limited.listRuns("u-1", null, null, null, null, null);

        Assertions.assertThrows(AdmissionRejectedException.class,
                () -> limited.listRuns("u-1", null, null, null, null, null));
        Assertions.assertDoesNotThrow(() -> limited.getRun("u-1", false, ownerRunId));
    }

    private AgentRunQueryService service(long limit) {
        MutableClock clock = new MutableClock(Instant.ofEpochMilli(60_000L * 28_333_334L + 1_000L));
        AdmissionControlDomainService admission = new AdmissionControlDomainService(
                new RateBudgetRepositoryImpl(CacheBuilder.newBuilder().maximumSize(100L).build()),
                clock,
                true,
                limit,
                Duration.ofSeconds(60));
        AgentTracer tracer = new AgentTracer(new TraceSampler(true, 1D), new RecordingTraceSink(), "http://trace.local");
        return new AgentRunQueryService(agentRunRepository, new AgentRunViewAssembler(tracer), new AdmissionGuard(admission));
    }

    private String save(String userId, String threadId, String input, String output,
                        RunStatusEnum status, int minutesAfterBase, String traceId) {
        AgentRunEntity run = new AgentRunEntity();
        run.setRunId(UUID.randomUUID().toString());
        run.setUserId(userId);
        run.setThreadId(threadId);
        run.setInput(input);
        run.setOutput(output);
        run.setStatus(status);
        run.setLatencyMs(120L);
        run.setTraceId(traceId);
        run.setMetadata(Map.of("steps", 1));
        run.setCreatedAt(BASE_TIME.plusMinutes(minutesAfterBase));
        agentRunRepository.save(run);
        return run.getRunId();
    }
}

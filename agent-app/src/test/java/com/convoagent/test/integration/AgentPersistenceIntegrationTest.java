package com.convoagent.test.integration;

import com.convoagent.Application;
import com.convoagent.domain.conversation.adapter.repository.ICheckpointRepository;
import com.convoagent.domain.conversation.model.entity.ConversationThreadEntity;
import com.convoagent.domain.conversation.model.valobj.ConversationMessage;
import com.convoagent.domain.evaluation.adapter.repository.IEvaluationScoreRepository;
import com.convoagent.domain.evaluation.model.entity.EvaluationScoreEntity;
import com.convoagent.domain.run.adapter.repository.IAgentRunRepository;
import com.convoagent.domain.run.model.entity.AgentRunEntity;
import com.convoagent.domain.run.model.valobj.AgentRunQuery;
import com.convoagent.infrastructure.dao.DirectoryLookupDao;
import com.convoagent.infrastructure.dao.po.DirectoryItemPO;
import com.convoagent.infrastructure.dao.po.DirectoryUserPO;
import com.convoagent.types.enums.MessageRoleEnum;
import com.convoagent.types.enums.RunStatusEnum;
import com.convoagent.types.exception.StoreUnavailableException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@SpringBootTest(
        classes = Application.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "agent.trace.enabled=false",
                "agent.tools.http.enabled=false"
        }
)
@EnabledIfSystemProperty(named = "it.docker.enabled", matches = "true")
public class AgentPersistenceIntegrationTest extends PostgresIntegrationTestSupport {

    @Autowired
    private ICheckpointRepository checkpointRepository;

    @Autowired
    private IAgentRunRepository agentRunRepository;

    @Autowired
    private IEvaluationScoreRepository evaluationScoreRepository;

    @Autowired
    private DirectoryLookupDao directoryLookupDao;

    @Test
    public void shouldPersistTurnsAndRejectStaleCheckpointWrites() {
        ConversationThreadEntity fresh = checkpointRepository.load("thread-it-1");
        Assertions.assertTrue(fresh.isNew());
        Assertions.assertTrue(fresh.history().isEmpty());

        fresh.appendTurn("u-1", ConversationMessage.user("Who is the admin?", Map.of("source", "it")),
                ConversationMessage.agent("Admin is admin@example.com", null), "1. look up admin");
        checkpointRepository.save(fresh);
        Assertions.assertEquals(1L, fresh.getVersion());

        ConversationThreadEntity first = checkpointRepository.load("thread-it-1");
        ConversationThreadEntity stale = checkpointRepository.load("thread-it-1");
        Assertions.assertEquals(1L, first.getVersion());
        Assertions.assertEquals(List.of(MessageRoleEnum.USER, MessageRoleEnum.AGENT),
                first.history().stream().map(ConversationMessage::getRole).collect(Collectors.toList()));
        Assertions.assertEquals("it", first.history().get(0).getAttachments().get("source"));
        Assertions.assertEquals("1. look up admin", first.getPlan());

        first.appendTurn("u-1", ConversationMessage.user("And their items?", null),
                ConversationMessage.agent("One laptop", null), null);
        checkpointRepository.save(first);

        stale.appendTurn("u-1", ConversationMessage.user("Concurrent", null),
                ConversationMessage.agent("Lost", null), null);
        Assertions.assertThrows(StoreUnavailableException.class, () -> checkpointRepository.save(stale));

        ConversationThreadEntity reloaded = checkpointRepository.load("thread-it-1");
        Assertions.assertEquals(2L, reloaded.getVersion());
        Assertions.assertEquals(4, reloaded.history().size());
        Assertions.assertEquals("One laptop", reloaded.history().get(3).getContent());
    }

    @Test
    public void shouldPageRunsByUserWithCaseInsensitiveSearch() {
        LocalDateTime base = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS).minusMinutes(30);
        String newest = saveRun("u-1", "thread-a", "Weather in Paris?", "Sunny", RunStatusEnum.SUCCESS, base.plusMinutes(3));
        saveRun("u-1", "thread-a", "weather tomorrow", "", RunStatusEnum.TIMEOUT, base.plusMinutes(2));
        saveRun("u-1", "thread-b", "Find admin", "Failed", RunStatusEnum.ERROR, base.plusMinutes(1));
        saveRun("u-2", "thread-c", "Weather in Rome?", "Rainy", RunStatusEnum.SUCCESS, base);

        AgentRunQuery search = AgentRunQuery.of("u-1", null, "WEATHER", null, 0, 10);
        List<AgentRunEntity> page = agentRunRepository.findPage(search);
        Assertions.assertEquals(2L, agentRunRepository.count(search));
        Assertions.assertEquals(newest, page.get(0).getRunId());
        Assertions.assertEquals("Sunny", page.get(0).getOutput());
        Assertions.assertEquals(1, ((Number) page.get(0).getMetadata().get("steps")).intValue());

        AgentRunQuery errors = AgentRunQuery.of("u-1", null, null, RunStatusEnum.ERROR, 0, 10);
        Assertions.assertEquals(1L, agentRunRepository.count(errors));
        Assertions.assertEquals("Find admin", agentRunRepository.findPage(errors).get(0).getInput());

        AgentRunQuery second = AgentRunQuery.of("u-1", null, null, null, 1, 1);
        Assertions.assertEquals(3L, agentRunRepository.count(second));
        Assertions.assertEquals("weather tomorrow", agentRunRepository.findPage(second).get(0).getInput());

        Assertions.assertNull(agentRunRepository.findById(UUID.randomUUID().toString()));
        Assertions.assertEquals("u-1", agentRunRepository.findById(newest).getUserId());
    }

    @Test
    public void shouldKeepFirstScoreAndExcludeFullyScoredRuns() {
        LocalDateTime base = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS).minusMinutes(10);
        String scored = saveRun("u-1", "thread-a", "hello", "hi", RunStatusEnum.SUCCESS, base);
        String partial = saveRun("u-1", "thread-a", "how are you", "fine", RunStatusEnum.SUCCESS, base.plusMinutes(1));
        saveRun("u-1", "thread-a", "too old", "ignored", RunStatusEnum.SUCCESS, base.minusDays(3));

        Assertions.assertTrue(evaluationScoreRepository.saveIfAbsent(score(scored, "helpfulness", 0.9D)));
        Assertions.assertTrue(evaluationScoreRepository.saveIfAbsent(score(scored, "relevancy", 0.8D)));
        Assertions.assertTrue(evaluationScoreRepository.saveIfAbsent(score(partial, "helpfulness", 0.7D)));
        Assertions.assertFalse(evaluationScoreRepository.saveIfAbsent(score(partial, "helpfulness", 0.1D)));

        Assertions.assertEquals(Set.of("helpfulness", "relevancy"), evaluationScoreRepository.findScoredMetricNames(scored));
        Double kept = jdbcTemplate.queryForObject(
                "SELECT score FROM agent_evaluation_score WHERE run_id = CAST(? AS uuid) AND metric_name = 'helpfulness'",
                Double.class, partial);
        Assertions.assertEquals(0.7D, kept);

        List<AgentRunEntity> lacking = agentRunRepository.findLackingScores(
                base.minusHours(1), LocalDateTime.now().plusMinutes(1), List.of("helpfulness", "relevancy"), null, 100);
        Assertions.assertEquals(List.of(partial),
                lacking.stream().map(AgentRunEntity::getRunId).collect(Collectors.toList()));
        Assertions.assertTrue(agentRunRepository.findLackingScores(
                base.minusHours(1), LocalDateTime.now().plusMinutes(1), List.of("helpfulness", "relevancy"),
                lacking.get(0), 100).isEmpty());
    }

    @Test
    public void shouldLookUpDirectoryRecords() {
        String userId = UUID.randomUUID().toString();
        String itemId = UUID.randomUUID().toString();
        jdbcTemplate.update("INSERT INTO app_user (id, email, full_name, is_active, is_superuser) VALUES (CAST(? AS uuid), ?, ?, TRUE, TRUE)",
                userId, "admin@example.com", "Admin");
        jdbcTemplate.update("INSERT INTO item (id, title, description, owner_id) VALUES (CAST(? AS uuid), ?, ?, CAST(? AS uuid))",
                itemId, "Laptop", "Work laptop", userId);

        DirectoryUserPO user = directoryLookupDao.selectUserByEmail("admin@example.com");
        Assertions.assertEquals(userId, user.getId());
        Assertions.assertEquals("Admin", user.getFullName());
        Assertions.assertTrue(user.getIsSuperuser());

        DirectoryItemPO item = directoryLookupDao.selectItemById(itemId);
        Assertions.assertEquals("Laptop", item.getTitle());
        Assertions.assertEquals(userId, item.getOwnerId());
        Assertions.assertEquals(1, directoryLookupDao.selectItemsByOwnerId(userId, 10).size());
        Assertions.assertNull(directoryLookupDao.selectUserByEmail("nobody@example.com"));
    }

    private String saveRun(String userId, String threadId, String input, String output,
                           RunStatusEnum status, LocalDateTime createdAt) {
        AgentRunEntity run = new AgentRunEntity();
        run.setRunId(UUID.randomUUID().toString());
        run.setUserId(userId);
        run.setThreadId(threadId);
        run.setInput(input);
        run.setOutput(output);
        run.setStatus(status);
        run.setLatencyMs(250L);
        run.setMetadata(Map.of("steps", 1));
        run.setCreatedAt(createdAt);
        agentRunRepository.save(run);
        return run.getRunId();
    }

    private EvaluationScoreEntity score(String runId, String metricName, double value) {
        EvaluationScoreEntity entity = new EvaluationScoreEntity();
        entity.setRunId(runId);
        entity.setMetricName(metricName);
        entity.setScore(value);
        entity.setMetadata(Map.of("reasoning", "ok"));
        return entity;
    }
}

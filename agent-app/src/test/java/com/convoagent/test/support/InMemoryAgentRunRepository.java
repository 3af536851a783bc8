package com.convoagent.test.support;

import com.convoagent.domain.run.adapter.repository.IAgentRunRepository;
import com.convoagent.domain.run.model.entity.AgentRunEntity;
import com.convoagent.domain.run.model.valobj.AgentRunQuery;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 内存运行记录仓储。findLackingScores 依赖同一测试里的内存分数仓储。
 */
public class InMemoryAgentRunRepository implements IAgentRunRepository {

    private final Map<String, AgentRunEntity> store = new LinkedHashMap<>();
    private final InMemoryEvaluationScoreRepository scoreRepository;

    public InMemoryAgentRunRepository() {
        this(null);
    }

    public InMemoryAgentRunRepository(InMemoryEvaluationScoreRepository scoreRepository) {
        this.scoreRepository = scoreRepository;
    }

    @Override
    public synchronized AgentRunEntity save(AgentRunEntity entity) {
        if (store.containsKey(entity.getRunId())) {
            throw new IllegalStateException("duplicate run id: " + entity.getRunId());
        }
        store.put(entity.getRunId(), entity);
        return entity;
    }

    @Override
    public synchronized AgentRunEntity findById(String runId) {
        return store.get(runId);
    }

    @Override
    public synchronized List<AgentRunEntity> findPage(AgentRunQuery query) {
        return filter(query).stream()
                .sorted(Comparator.comparing(AgentRunEntity::getCreatedAt).reversed())
                .skip(query.offset())
                .limit(query.limit())
                .collect(Collectors.toList());
    }

    @Override
    public synchronized long count(AgentRunQuery query) {
        return filter(query).size();
    }

    @Override
    public synchronized List<AgentRunEntity> findLackingScores(LocalDateTime start, LocalDateTime end,
                                                               Collection<String> metricNames,
                                                               AgentRunEntity after, int limit) {
        Comparator<AgentRunEntity> order = Comparator.comparing(AgentRunEntity::getCreatedAt)
                .thenComparing(AgentRunEntity::getRunId);
        return store.values().stream()
                .filter(run -> !run.getCreatedAt().isBefore(start) && run.getCreatedAt().isBefore(end))
                .filter(run -> after == null || order.compare(run, after) > 0)
                .filter(run -> {
                    Set<String> scored = scoreRepository == null
                            ? Set.of()
                            : scoreRepository.findScoredMetricNames(run.getRunId());
                    return !scored.containsAll(metricNames);
                })
                .sorted(order)
                .limit(limit)
                .collect(Collectors.toList());
    }

    public synchronized List<AgentRunEntity> all() {
        return new ArrayList<>(store.values());
    }

    private List<AgentRunEntity> filter(AgentRunQuery query) {
        List<AgentRunEntity> matched = new ArrayList<>();
        for (AgentRunEntity run : store.values()) {
            if (query.userId() != null && !query.userId().equals(run.getUserId())) {
                continue;
            }
            if (query.threadId() != null && !query.threadId().equals(run.getThreadId())) {
                continue;
            }
            if (query.status() != null && query.status() != run.getStatus()) {
                continue;
            }
            if (query.search() != null && !contains(run.getInput(), query.search()) && !contains(run.getOutput(), query.search())) {
                continue;
            }
            matched.add(run);
        }
        return matched;
    }

    private boolean contains(String text, String search) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(search.toLowerCase(Locale.ROOT));
    }
}

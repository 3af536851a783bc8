package com.convoagent.infrastructure.repository.run;

import com.convoagent.domain.run.adapter.repository.IAgentRunRepository;
import com.convoagent.domain.run.model.entity.AgentRunEntity;
import com.convoagent.domain.run.model.valobj.AgentRunQuery;
import com.convoagent.infrastructure.dao.AgentRunDao;
import com.convoagent.infrastructure.dao.po.AgentRunPO;
import com.convoagent.infrastructure.util.JsonCodec;
import com.convoagent.types.enums.RunStatusEnum;
import com.convoagent.types.exception.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 运行记录仓储实现。
 */
@Repository
public class AgentRunRepositoryImpl implements IAgentRunRepository {

    private final AgentRunDao agentRunDao;
    private final JsonCodec jsonCodec;

    public AgentRunRepositoryImpl(AgentRunDao agentRunDao, JsonCodec jsonCodec) {
        this.agentRunDao = agentRunDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public AgentRunEntity save(AgentRunEntity entity) {
        entity.validate();
        try {
            agentRunDao.insert(toPO(entity));
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("运行记录写入失败: " + entity.getRunId(), ex);
        }
        return entity;
    }

    @Override
    public AgentRunEntity findById(String runId) {
        AgentRunPO po = agentRunDao.selectByRunId(runId);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<AgentRunEntity> findPage(AgentRunQuery query) {
        List<AgentRunPO> list = agentRunDao.selectPage(query.userId(), query.threadId(), query.search(),
                statusCode(query.status()), query.offset(), query.limit());
        return toEntities(list);
    }

    @Override
    public long count(AgentRunQuery query) {
        return agentRunDao.count(query.userId(), query.threadId(), query.search(), statusCode(query.status()));
    }

    @Override
    public List<AgentRunEntity> findLackingScores(LocalDateTime start, LocalDateTime end,
                                                  Collection<String> metricNames, AgentRunEntity after, int limit) {
        if (metricNames == null || metricNames.isEmpty()) {
            return Collections.emptyList();
        }
        LocalDateTime afterCreatedAt = after == null ? null : after.getCreatedAt();
        String afterRunId = after == null ? null : after.getRunId();
        return toEntities(agentRunDao.selectLackingScores(start, end, metricNames, metricNames.size(),
                afterCreatedAt, afterRunId, limit));
    }

    private List<AgentRunEntity> toEntities(List<AgentRunPO> list) {
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        return list.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private String statusCode(RunStatusEnum status) {
        return status == null ? null : status.getCode();
    }

    private AgentRunEntity toEntity(AgentRunPO po) {
        AgentRunEntity entity = new AgentRunEntity();
        entity.setRunId(po.getRunId());
        entity.setThreadId(po.getThreadId());
        entity.setUserId(po.getUserId());
        entity.setInput(po.getInput());
        entity.setOutput(po.getOutput());
        entity.setStatus(RunStatusEnum.fromCode(po.getStatus()));
        entity.setLatencyMs(po.getLatencyMs());
        entity.setTraceId(po.getTraceId());
        entity.setPromptTokens(po.getPromptTokens());
        entity.setCompletionTokens(po.getCompletionTokens());
        entity.setPlan(po.getPlan());
        entity.setErrorMessage(po.getErrorMessage());
        if (po.getMetadata() != null) {
            entity.setMetadata(jsonCodec.readMap(po.getMetadata()));
        }
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private AgentRunPO toPO(AgentRunEntity entity) {
        AgentRunPO po = AgentRunPO.builder()
                .runId(entity.getRunId())
                .threadId(entity.getThreadId())
                .userId(entity.getUserId())
                .input(entity.getInput())
                .output(entity.getOutput())
                .status(statusCode(entity.getStatus()))
                .latencyMs(entity.getLatencyMs())
                .traceId(entity.getTraceId())
                .promptTokens(entity.getPromptTokens())
                .completionTokens(entity.getCompletionTokens())
                .plan(entity.getPlan())
                .errorMessage(entity.getErrorMessage())
                .createdAt(entity.getCreatedAt())
                .build();
        if (entity.getMetadata() != null) {
            po.setMetadata(jsonCodec.writeValue(entity.getMetadata()));
        }
        return po;
    }
}

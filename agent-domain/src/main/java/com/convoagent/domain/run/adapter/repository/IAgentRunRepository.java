package com.convoagent.domain.run.adapter.repository;

import com.convoagent.domain.run.model.entity.AgentRunEntity;
import com.convoagent.domain.run.model.valobj.AgentRunQuery;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 运行记录仓储接口。
 */
public interface IAgentRunRepository {

    AgentRunEntity save(AgentRunEntity entity);

    AgentRunEntity findById(String runId);

    /**
     * 按 created_at 倒序分页。
     */
    List<AgentRunEntity> findPage(AgentRunQuery query);

    long count(AgentRunQuery query);

    /**
     * 窗口 [start, end) 内、至少缺少一个指定指标分数的运行记录，按 (created_at, run_id) 升序。
     * <p>
     * {@code after} 为上一页最后一条记录，为 null 时从窗口起点开始；按键集翻页，评审持续失败的记录不会挡住后面的记录。
     * </p>
     */
    List<AgentRunEntity> findLackingScores(LocalDateTime start, LocalDateTime end, Collection<String> metricNames,
                                           AgentRunEntity after, int limit);
}

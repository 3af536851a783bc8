package com.convoagent.infrastructure.dao;

import com.convoagent.infrastructure.dao.po.AgentRunPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 运行记录 DAO。
 */
@Mapper
public interface AgentRunDao {

    int insert(AgentRunPO po);

    AgentRunPO selectByRunId(@Param("runId") String runId);

    List<AgentRunPO> selectPage(@Param("userId") String userId,
                                @Param("threadId") String threadId,
                                @Param("search") String search,
                                @Param("status") String status,
                                @Param("offset") int offset,
                                @Param("limit") int limit);

    long count(@Param("userId") String userId,
               @Param("threadId") String threadId,
               @Param("search") String search,
               @Param("status") String status);

    List<AgentRunPO> selectLackingScores(@Param("start") LocalDateTime start,
                                         @Param("end") LocalDateTime end,
                                         @Param("metricNames") Collection<String> metricNames,
                                         @Param("metricCount") int metricCount,
                                         @Param("afterCreatedAt") LocalDateTime afterCreatedAt,
                                         @Param("afterRunId") String afterRunId,
                                         @Param("limit") int limit);
}

package com.convoagent.infrastructure.dao;

import com.convoagent.infrastructure.dao.po.AgentTraceSpanPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Trace span DAO。
 */
@Mapper
public interface AgentTraceSpanDao {

    int batchInsert(@Param("list") List<AgentTraceSpanPO> list);

    List<AgentTraceSpanPO> selectByTraceId(@Param("traceId") String traceId);
}

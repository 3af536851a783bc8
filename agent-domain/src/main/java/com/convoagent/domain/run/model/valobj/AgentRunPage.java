package com.convoagent.domain.run.model.valobj;

import com.convoagent.domain.run.model.entity.AgentRunEntity;

import java.util.List;

/**
 * 运行记录分页。
 */
public record AgentRunPage(List<AgentRunEntity> data, long total, int limit, int offset) {
}

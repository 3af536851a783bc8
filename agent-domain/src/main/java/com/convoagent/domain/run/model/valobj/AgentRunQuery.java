package com.convoagent.domain.run.model.valobj;

import com.convoagent.types.enums.RunStatusEnum;

/**
 * 运行记录查询条件。search 对 input/output 做不区分大小写的包含匹配。
 */
public record AgentRunQuery(String userId,
                            String threadId,
                            String search,
                            RunStatusEnum status,
                            int offset,
                            int limit) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public static AgentRunQuery of(String userId, String threadId, String search, RunStatusEnum status,
                                   Integer skip, Integer limit) {
        int normalizedOffset = skip == null ? 0 : Math.max(skip, 0);
        int normalizedLimit = limit == null ? DEFAULT_LIMIT : Math.min(Math.max(limit, 1), MAX_LIMIT);
        return new AgentRunQuery(userId, blankToNull(threadId), blankToNull(search), status, normalizedOffset, normalizedLimit);
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

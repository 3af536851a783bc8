package com.convoagent.infrastructure.tool.directory;

import com.convoagent.domain.tool.model.valobj.ToolResult;
import com.convoagent.infrastructure.dao.DirectoryLookupDao;
import com.convoagent.infrastructure.dao.po.DirectoryItemPO;
import com.convoagent.infrastructure.tool.AbstractAgentTool;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 查询某用户拥有的条目，limit 取值 1..100，默认 10。
 */
public class LookupUserItemsTool extends AbstractAgentTool<LookupUserItemsTool.Input> {

    public static final String NAME = "lookup_user_items";

    static final int DEFAULT_LIMIT = 10;
    static final int MAX_LIMIT = 100;

    private static final String SCHEMA = "{\"type\":\"object\","
            + "\"properties\":{"
            + "\"user_id\":{\"type\":\"string\",\"description\":\"UUID of the user whose items to retrieve\"},"
            + "\"limit\":{\"type\":\"integer\",\"minimum\":1,\"maximum\":100,\"default\":10,"
            + "\"description\":\"Maximum number of items to return (1-100)\"}},"
            + "\"required\":[\"user_id\"]}";

    private final DirectoryLookupDao directoryLookupDao;

    public LookupUserItemsTool(DirectoryLookupDao directoryLookupDao) {
        super(NAME,
                "Look up all items owned by a specific user. Returns a list of items with pagination.",
                SCHEMA,
                Input.class);
        this.directoryLookupDao = directoryLookupDao;
    }

    @Override
    protected ToolResult execute(Input input) {
        String userId = input == null ? null : input.userId();
        int limit = input == null || input.limit() == null ? DEFAULT_LIMIT : input.limit();
        if (limit < 1 || limit > MAX_LIMIT) {
            return ToolResult.failure("limit must be between 1 and " + MAX_LIMIT);
        }
        if (!DirectoryPayloads.isUuid(userId)) {
            return ToolResult.failure("Invalid user ID: " + userId);
        }
        List<DirectoryItemPO> rows;
        try {
            rows = directoryLookupDao.selectItemsByOwnerId(userId.trim(), limit);
        } catch (DataAccessException ex) {
            return ToolResult.failure("Database error: " + ex.getMostSpecificCause().getMessage());
        }
        List<Map<String, Object>> items = new ArrayList<>();
        if (rows != null) {
            for (DirectoryItemPO row : rows) {
                items.add(DirectoryPayloads.item(row));
            }
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("count", items.size());
        payload.put("items", items);
        payload.put("limit", limit);
        return ToolResult.success(payload);
    }

    public record Input(@JsonProperty("user_id") String userId, Integer limit) {
    }
}

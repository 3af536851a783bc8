package com.convoagent.infrastructure.tool.directory;

import com.convoagent.domain.tool.model.valobj.ToolResult;
import com.convoagent.infrastructure.dao.DirectoryLookupDao;
import com.convoagent.infrastructure.dao.po.DirectoryItemPO;
import com.convoagent.infrastructure.tool.AbstractAgentTool;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.dao.DataAccessException;

/**
 * 按 ID 查询条目。
 */
public class LookupItemByIdTool extends AbstractAgentTool<LookupItemByIdTool.Input> {

    public static final String NAME = "lookup_item_by_id";

    private static final String SCHEMA = "{\"type\":\"object\","
            + "\"properties\":{\"item_id\":{\"type\":\"string\",\"description\":\"UUID of the item to look up\"}},"
            + "\"required\":[\"item_id\"]}";

    private final DirectoryLookupDao directoryLookupDao;

    public LookupItemByIdTool(DirectoryLookupDao directoryLookupDao) {
        super(NAME,
                "Look up an item by its UUID. Returns item details including title, description, and owner.",
                SCHEMA,
                Input.class);
        this.directoryLookupDao = directoryLookupDao;
    }

    @Override
    protected ToolResult execute(Input input) {
        String itemId = input == null ? null : input.itemId();
        if (!DirectoryPayloads.isUuid(itemId)) {
            return ToolResult.failure("No item found with ID: " + itemId);
        }
        DirectoryItemPO item;
        try {
            item = directoryLookupDao.selectItemById(itemId.trim());
        } catch (DataAccessException ex) {
            return ToolResult.failure("Database error: " + ex.getMostSpecificCause().getMessage());
        }
        if (item == null) {
            return ToolResult.failure("No item found with ID: " + itemId);
        }
        return ToolResult.success(DirectoryPayloads.item(item));
    }

    public record Input(@JsonProperty("item_id") String itemId) {
    }
}

package com.convoagent.infrastructure.tool.directory;

import com.convoagent.domain.tool.model.valobj.ToolResult;
import com.convoagent.infrastructure.dao.DirectoryLookupDao;
import com.convoagent.infrastructure.dao.po.DirectoryUserPO;
import com.convoagent.infrastructure.tool.AbstractAgentTool;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataAccessException;

/**
 * 按邮箱查询用户。
 */
public class LookupUserByEmailTool extends AbstractAgentTool<LookupUserByEmailTool.Input> {

    public static final String NAME = "lookup_user_by_email";

    private static final String SCHEMA = "{\"type\":\"object\","
            + "\"properties\":{\"email\":{\"type\":\"string\",\"description\":\"Email address of the user to look up\"}},"
            + "\"required\":[\"email\"]}";

    private final DirectoryLookupDao directoryLookupDao;

    public LookupUserByEmailTool(DirectoryLookupDao directoryLookupDao) {
        super(NAME,
                "Look up a user by their email address. Returns user details including ID, name, and status.",
                SCHEMA,
                Input.class);
        this.directoryLookupDao = directoryLookupDao;
    }

    @Override
    protected ToolResult execute(Input input) {
        String email = input == null ? null : StringUtils.trimToNull(input.email());
        if (email == null) {
            return ToolResult.failure("email is required");
        }
        DirectoryUserPO user;
        try {
            user = directoryLookupDao.selectUserByEmail(email);
        } catch (DataAccessException ex) {
            return ToolResult.failure("Database error: " + ex.getMostSpecificCause().getMessage());
        }
        if (user == null) {
            return ToolResult.failure("No user found with email: " + email);
        }
        return ToolResult.success(DirectoryPayloads.user(user));
    }

    public record Input(String email) {
    }
}

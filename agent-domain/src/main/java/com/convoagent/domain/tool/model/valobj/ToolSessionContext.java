package com.convoagent.domain.tool.model.valobj;

/**
 * 组装工具注册表时的调用方上下文。userId 为空时不提供会话级工具。
 */
public record ToolSessionContext(String userId, String threadId) {

    public boolean hasSession() {
        return userId != null && !userId.trim().isEmpty();
    }
}

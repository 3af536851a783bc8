package com.convoagent.domain.tool.model.valobj;

/**
 * 工具执行结果：成功时携带 payload，失败时携带结构化错误。工具实现只返回本类型，不向外抛异常。
 */
public final class ToolResult {

    private final boolean success;
    private final Object payload;
    private final String error;
    private final Integer statusCode;

    private ToolResult(boolean success, Object payload, String error, Integer statusCode) {
        this.success = success;
        this.payload = payload;
        this.error = error;
        this.statusCode = statusCode;
    }

    public static ToolResult success(Object payload) {
        return new ToolResult(true, payload, null, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error, null);
    }

    public static ToolResult failure(String error, Integer statusCode) {
        return new ToolResult(false, null, error, statusCode);
    }

    public boolean isSuccess() {
        return success;
    }

    public Object getPayload() {
        return payload;
    }

    public String getError() {
        return error;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    @Override
    public String toString() {
        return success ? "ToolResult{success}" : "ToolResult{error='" + error + "', statusCode=" + statusCode + "}";
    }
}

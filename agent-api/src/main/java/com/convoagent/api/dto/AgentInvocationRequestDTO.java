package com.convoagent.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.Map;

/**
 * Agent 调用请求。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentInvocationRequestDTO {

    /** 用户消息，不能为空 */
    private String message;

    /** 会话线程标识，缺省时由服务端生成 */
    private String threadId;

    /** 调用方元数据，随 trace 与运行记录一并保存 */
    private Map<String, Object> metadata;
}

package com.convoagent.types.enums;

/**
 * 对话消息角色枚举。
 */
public enum MessageRoleEnum {
    USER,
    AGENT,
    TOOL
}

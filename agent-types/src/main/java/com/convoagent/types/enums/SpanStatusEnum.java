package com.convoagent.types.enums;

/**
 * Trace span 结束状态。
 */
public enum SpanStatusEnum {
    OK,
    ERROR
}

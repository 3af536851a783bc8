package com.convoagent.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 请求被限流 */
    RATE_LIMITED("0003", "请求过于频繁，请稍后重试"),

    /** 存储不可用 */
    STORE_UNAVAILABLE("0004", "存储暂不可用"),

    /** 图节点执行失败 */
    NODE_FAILURE("0005", "节点执行失败"),

    /** 评测打分失败 */
    JUDGE_FAILURE("0006", "评测打分失败"),

    /** 资源不存在 */
    NOT_FOUND("0404", "资源不存在"),

    /** 无权访问 */
    FORBIDDEN("0403", "无权访问");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}

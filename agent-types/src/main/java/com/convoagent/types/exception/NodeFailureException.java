package com.convoagent.types.exception;

import com.convoagent.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 图节点执行失败（生成失败、步数耗尽等），本轮运行以 error 结束。
 */
@Getter
public class NodeFailureException extends AppException {

    private static final long serialVersionUID = -6203113861325866254L;

    private final String node;

    public NodeFailureException(String node, String message) {
        super(ResponseCode.NODE_FAILURE.getCode(), message);
        this.node = node;
    }

    public NodeFailureException(String node, String message, Throwable cause) {
        super(ResponseCode.NODE_FAILURE.getCode(), message, cause);
        this.node = node;
    }
}

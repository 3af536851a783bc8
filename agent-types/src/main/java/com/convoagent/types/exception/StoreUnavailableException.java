package com.convoagent.types.exception;

import com.convoagent.types.enums.ResponseCode;

/**
 * 持久化介质不可达或写入冲突。对检查点是本轮致命错误，对运行记录只记录日志。
 */
public class StoreUnavailableException extends AppException {

    private static final long serialVersionUID = 4086261310911290331L;

    public StoreUnavailableException(String message) {
        super(ResponseCode.STORE_UNAVAILABLE.getCode(), message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(ResponseCode.STORE_UNAVAILABLE.getCode(), message, cause);
    }
}

package com.convoagent.types.exception;

import com.convoagent.types.enums.ResponseCode;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 准入拒绝：调用在进入执行引擎之前被限流，不记录运行记录。
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class AdmissionRejectedException extends AppException {

    private static final long serialVersionUID = -2431779187654312090L;

    private final String identity;

    private final long retryAfterMillis;

    public AdmissionRejectedException(String identity, long retryAfterMillis) {
        super(ResponseCode.RATE_LIMITED.getCode(), ResponseCode.RATE_LIMITED.getInfo());
        this.identity = identity;
        this.retryAfterMillis = Math.max(retryAfterMillis, 0L);
    }

    /**
     * 向上取整到秒，至少 1 秒，用于 Retry-After 响应头。
     */
    public long getRetryAfterSeconds() {
        return Math.max(1L, (retryAfterMillis + 999L) / 1000L);
    }
}

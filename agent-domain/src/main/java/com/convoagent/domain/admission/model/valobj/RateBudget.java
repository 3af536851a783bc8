package com.convoagent.domain.admission.model.valobj;

/**
 * 某身份在一个固定窗口内的计数。windowStartMillis 为窗口起点（epoch 毫秒）。
 */
public record RateBudget(String identity, long windowStartMillis, long count) {

    public RateBudget next(long currentWindowStartMillis) {
        if (currentWindowStartMillis != windowStartMillis) {
            return new RateBudget(identity, currentWindowStartMillis, 1L);
        }
        return new RateBudget(identity, windowStartMillis, count + 1L);
    }

    public static RateBudget first(String identity, long windowStartMillis) {
        return new RateBudget(identity, windowStartMillis, 1L);
    }
}

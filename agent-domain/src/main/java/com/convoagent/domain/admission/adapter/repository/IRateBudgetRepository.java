package com.convoagent.domain.admission.adapter.repository;

import com.convoagent.domain.admission.model.valobj.RateBudget;

/**
 * 限流计数仓储。
 */
public interface IRateBudgetRepository {

    /**
     * 原子地对 identity 在给定窗口内计数加一并返回加一后的结果；窗口变化时从 1 重新计数。
     * 同一 identity 的并发调用必须得到各不相同的计数值。
     */
    RateBudget incrementAndGet(String identity, long windowStartMillis, long windowMillis);
}

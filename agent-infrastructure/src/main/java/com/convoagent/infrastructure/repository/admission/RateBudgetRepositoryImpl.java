package com.convoagent.infrastructure.repository.admission;

import com.convoagent.domain.admission.adapter.repository.IRateBudgetRepository;
import com.convoagent.domain.admission.model.valobj.RateBudget;
import com.google.common.cache.Cache;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * 单实例内存限流计数。
 * <p>
 * 计数放在 Guava Cache 中，按最近访问过期回收不活跃身份；同一 identity 的读改写由
 * {@code asMap().compute} 原子完成。多实例部署需要换成共享存储实现。
 * </p>
 */
@Repository
public class RateBudgetRepositoryImpl implements IRateBudgetRepository {

    private final Cache<String, RateBudget> rateBudgetCache;

    public RateBudgetRepositoryImpl(@Qualifier("rateBudgetCache") Cache<String, RateBudget> rateBudgetCache) {
        this.rateBudgetCache = rateBudgetCache;
    }

    @Override
    public RateBudget incrementAndGet(String identity, long windowStartMillis, long windowMillis) {
        return rateBudgetCache.asMap().compute(identity, (key, current) -> {
            if (current == null || current.windowStartMillis() + windowMillis <= windowStartMillis) {
                return RateBudget.first(key, windowStartMillis);
            }
            return current.next(windowStartMillis);
        });
    }
}

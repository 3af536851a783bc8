package com.convoagent.domain.admission.service;

import com.convoagent.domain.admission.adapter.repository.IRateBudgetRepository;
import com.convoagent.domain.admission.model.valobj.AdmissionDecision;
import com.convoagent.domain.admission.model.valobj.RateBudget;
import com.convoagent.types.exception.AdmissionRejectedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * 固定窗口准入控制。
 */
@Slf4j
public class AdmissionControlDomainService {

    private final IRateBudgetRepository rateBudgetRepository;
    private final Clock clock;
    private final boolean enabled;
    private final long defaultLimit;
    private final long windowMillis;

    public AdmissionControlDomainService(IRateBudgetRepository rateBudgetRepository,
                                         Clock clock,
                                         boolean enabled,
                                         long defaultLimit,
                                         Duration window) {
        this.rateBudgetRepository = rateBudgetRepository;
        this.clock = clock;
        this.enabled = enabled;
        this.defaultLimit = Math.max(defaultLimit, 1L);
        this.windowMillis = window == null || window.toMillis() <= 0L ? 60_000L : window.toMillis();
    }

    public AdmissionDecision admit(String identity) {
        return admit(identity, defaultLimit);
    }

    public AdmissionDecision admit(String identity, long limit) {
        long normalizedLimit = Math.max(limit, 1L);
        if (!enabled) {
            return AdmissionDecision.allowed(identity, 0L, normalizedLimit);
        }
        if (identity == null || identity.trim().isEmpty()) {
            throw new IllegalArgumentException("identity 不能为空");
        }
        long now = clock.millis();
        long windowStart = now - Math.floorMod(now, windowMillis);
        RateBudget budget = rateBudgetRepository.incrementAndGet(identity, windowStart, windowMillis);
        if (budget.count() <= normalizedLimit) {
            return AdmissionDecision.allowed(identity, budget.count(), normalizedLimit);
        }
        long retryAfter = budget.windowStartMillis() + windowMillis - now;
        log.info("ADMISSION_REJECTED identity={}, used={}, limit={}, retryAfterMs={}",
                identity, budget.count(), normalizedLimit, retryAfter);
        return AdmissionDecision.rejected(identity, budget.count(), normalizedLimit, retryAfter);
    }

    /**
     * 准入失败时抛出 {@link AdmissionRejectedException}。
     */
    public void admitOrThrow(String identity, long limit) {
        AdmissionDecision decision = admit(identity, limit);
        if (!decision.allowed()) {
            throw new AdmissionRejectedException(identity, decision.retryAfterMillis());
        }
    }

    public long defaultLimit() {
        return defaultLimit;
    }
}

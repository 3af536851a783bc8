package com.convoagent.trigger.application.common;

import com.convoagent.domain.admission.service.AdmissionControlDomainService;
import com.convoagent.types.exception.AdmissionRejectedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import org.springframework.stereotype.Component;

/**
 * 接口级准入：按路由放大默认配额，拒绝时计数后原样抛出。
 */
@Component
public class AdmissionGuard {

    private final AdmissionControlDomainService admissionControlDomainService;

    public AdmissionGuard(AdmissionControlDomainService admissionControlDomainService) {
        this.admissionControlDomainService = admissionControlDomainService;
    }

    public void admit(String route, String userId, int multiplier) {
        long limit = admissionControlDomainService.defaultLimit() * Math.max(multiplier, 1);
        try {
            admissionControlDomainService.admitOrThrow(AdmissionRoutes.identity(route, userId), limit);
        } catch (AdmissionRejectedException ex) {
            Counter.builder("agent.admission.rejected.total")
                    .tag("route", route)
                    .register(Metrics.globalRegistry)
                    .increment();
            throw ex;
        }
    }
}

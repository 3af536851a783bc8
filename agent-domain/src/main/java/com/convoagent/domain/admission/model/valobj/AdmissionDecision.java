package com.convoagent.domain.admission.model.valobj;

/**
 * 准入结果。拒绝时 retryAfterMillis 为距窗口结束的剩余时间，大于 0。
 */
public record AdmissionDecision(boolean allowed, String identity, long used, long limit, long retryAfterMillis) {

    public static AdmissionDecision allowed(String identity, long used, long limit) {
        return new AdmissionDecision(true, identity, used, limit, 0L);
    }

    public static AdmissionDecision rejected(String identity, long used, long limit, long retryAfterMillis) {
        return new AdmissionDecision(false, identity, used, limit, Math.max(retryAfterMillis, 1L));
    }
}

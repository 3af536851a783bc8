package com.convoagent.trigger.application.common;

/**
 * 限流身份按 "路由模板:user:用户ID" 组装，各接口的计数互相独立。
 */
public final class AdmissionRoutes {

    public static final String RUN = "/api/v1/agent/run";
    public static final String HISTORY = "/api/v1/agent/runs";
    public static final String EVALUATION = "/api/v1/agent/evaluations";

    private AdmissionRoutes() {
    }

    public static String identity(String route, String userId) {
        return route + ":user:" + userId;
    }
}

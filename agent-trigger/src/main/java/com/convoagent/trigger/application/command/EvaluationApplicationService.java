package com.convoagent.trigger.application.command;

import com.convoagent.api.dto.EvaluationReportDTO;
import com.convoagent.domain.evaluation.model.valobj.EvaluationReport;
import com.convoagent.domain.evaluation.model.valobj.EvaluationWindow;
import com.convoagent.domain.evaluation.service.EvaluationPipelineService;
import com.convoagent.trigger.application.common.AdmissionGuard;
import com.convoagent.trigger.application.common.AdmissionRoutes;
import com.convoagent.trigger.application.common.AgentRunViewAssembler;
import com.convoagent.types.enums.ResponseCode;
import com.convoagent.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 离线评测触发：接口触发与定时作业共用同一回看窗口。
 */
@Slf4j
@Service
public class EvaluationApplicationService {

    private final EvaluationPipelineService evaluationPipelineService;
    private final AgentRunViewAssembler agentRunViewAssembler;
    private final AdmissionGuard admissionGuard;
    private final Clock clock;
    private final Duration lookback;

    public EvaluationApplicationService(EvaluationPipelineService evaluationPipelineService,
                                        AgentRunViewAssembler agentRunViewAssembler,
                                        AdmissionGuard admissionGuard,
                                        Clock clock,
                                        @Value("${agent.evaluation.lookback:PT24H}") Duration lookback) {
        this.evaluationPipelineService = evaluationPipelineService;
        this.agentRunViewAssembler = agentRunViewAssembler;
        this.admissionGuard = admissionGuard;
        this.clock = clock;
        this.lookback = lookback == null || lookback.isZero() || lookback.isNegative() ? Duration.ofHours(24) : lookback;
    }

    /**
     * 接口触发。评测覆盖窗口内所有用户的运行记录，只允许超级用户触发。
     */
    public EvaluationReportDTO triggerByUser(String userId, boolean superuser) {
        if (StringUtils.isBlank(userId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "userId 不能为空");
        }
        if (!superuser) {
            log.warn("EVALUATION_TRIGGER_FORBIDDEN userId={}", userId);
            throw new AppException(ResponseCode.FORBIDDEN.getCode(), "Not enough permissions to run evaluations");
        }
        admissionGuard.admit(AdmissionRoutes.EVALUATION, userId, 1);
        log.info("EVALUATION_TRIGGERED source=http, userId={}", userId);
        return agentRunViewAssembler.toReportDTO(runWindow());
    }

    public EvaluationReport runScheduled() {
        log.info("EVALUATION_TRIGGERED source=schedule");
        return runWindow();
    }

    private EvaluationReport runWindow() {
        EvaluationWindow window = EvaluationWindow.lookback(LocalDateTime.now(clock), lookback);
        return evaluationPipelineService.run(window);
    }
}

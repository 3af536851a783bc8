package com.convoagent.trigger.job;

import com.convoagent.domain.evaluation.model.valobj.EvaluationReport;
import com.convoagent.trigger.application.command.EvaluationApplicationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时离线评测作业，默认关闭。
 */
@Slf4j
@Component
public class EvaluationPipelineJob {

    private final EvaluationApplicationService evaluationApplicationService;
    private final boolean enabled;

    public EvaluationPipelineJob(EvaluationApplicationService evaluationApplicationService,
                                 @Value("${agent.evaluation.schedule-enabled:false}") boolean enabled) {
        this.evaluationApplicationService = evaluationApplicationService;
        this.enabled = enabled;
    }

    @Scheduled(
            fixedDelayString = "${agent.evaluation.schedule-interval-ms:3600000}",
            initialDelayString = "${agent.evaluation.schedule-initial-delay-ms:60000}",
            scheduler = "daemonScheduler"
    )
    public void evaluateRecentRuns() {
        if (!enabled) {
            return;
        }
        try {
            EvaluationReport report = evaluationApplicationService.runScheduled();
            log.info("EVALUATION_JOB_DONE total={}, success={}, failure={}, skippedPairs={}, durationMs={}",
                    report.getTotal(),
                    report.getSuccessCount(),
                    report.getFailureCount(),
                    report.getSkippedPairs(),
                    report.getDurationMs());
        } catch (RuntimeException ex) {
            log.error("EVALUATION_JOB_FAILED error={}", ex.getMessage(), ex);
        }
    }
}

package com.convoagent.domain.evaluation.service;

import com.convoagent.domain.evaluation.adapter.gateway.IEvaluationMetricCatalog;
import com.convoagent.domain.evaluation.adapter.gateway.IEvaluationReportWriter;
import com.convoagent.domain.evaluation.adapter.gateway.IJudgeGateway;
import com.convoagent.domain.evaluation.adapter.repository.IEvaluationScoreRepository;
import com.convoagent.domain.evaluation.model.entity.EvaluationScoreEntity;
import com.convoagent.domain.evaluation.model.valobj.EvaluationMetric;
import com.convoagent.domain.evaluation.model.valobj.EvaluationReport;
import com.convoagent.domain.evaluation.model.valobj.EvaluationWindow;
import com.convoagent.domain.evaluation.model.valobj.JudgeVerdict;
import com.convoagent.domain.evaluation.model.valobj.MetricSummary;
import com.convoagent.domain.run.adapter.repository.IAgentRunRepository;
import com.convoagent.domain.run.model.entity.AgentRunEntity;
import com.convoagent.types.exception.JudgeFailureException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 离线评测流水线。
 * <p>
 * 对窗口内每个尚未打分的 (run, metric) 调用评审模型打分并持久化。单个评审失败只计入该指标失败数，批次继续；
 * 已有分数的组合跳过，不重复、不覆盖。
 * </p>
 */
@Slf4j
public class EvaluationPipelineService {

    private final IAgentRunRepository agentRunRepository;
    private final IEvaluationScoreRepository evaluationScoreRepository;
    private final IJudgeGateway judgeGateway;
    private final IEvaluationMetricCatalog metricCatalog;
    private final IEvaluationReportWriter reportWriter;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration retryBackoff;
    private final int batchLimit;

    public EvaluationPipelineService(IAgentRunRepository agentRunRepository,
                                     IEvaluationScoreRepository evaluationScoreRepository,
                                     IJudgeGateway judgeGateway,
                                     IEvaluationMetricCatalog metricCatalog,
                                     IEvaluationReportWriter reportWriter,
                                     Clock clock,
                                     int maxAttempts,
                                     Duration retryBackoff,
                                     int batchLimit) {
        this.agentRunRepository = agentRunRepository;
        this.evaluationScoreRepository = evaluationScoreRepository;
        this.judgeGateway = judgeGateway;
        this.metricCatalog = metricCatalog;
        this.reportWriter = reportWriter;
        this.clock = clock;
        this.maxAttempts = Math.max(maxAttempts, 1);
        this.retryBackoff = retryBackoff == null || retryBackoff.isNegative() ? Duration.ZERO : retryBackoff;
        this.batchLimit = batchLimit > 0 ? batchLimit : 100;
    }

    public EvaluationReport run(EvaluationWindow window) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        long startNs = System.nanoTime();
        List<EvaluationMetric> metrics = metricCatalog.loadMetrics();
        Map<String, MetricSummary> summaries = new LinkedHashMap<>();
        for (EvaluationMetric metric : metrics) {
            summaries.put(metric.name(), new MetricSummary());
        }

        int total = 0;
        int successCount = 0;
        int failureCount = 0;
        int skippedPairs = 0;

        if (metrics.isEmpty()) {
            log.warn("EVALUATION_NO_METRICS windowStart={}, windowEnd={}", window.start(), window.end());
        } else {
            List<String> metricNames = metrics.stream().map(EvaluationMetric::name).collect(Collectors.toList());
            log.info("EVALUATION_BATCH_START windowStart={}, windowEnd={}, pageSize={}, metrics={}",
                    window.start(), window.end(), batchLimit, metricNames);
            AgentRunEntity cursor = null;
            int pages = 0;
            while (true) {
                List<AgentRunEntity> runs = agentRunRepository.findLackingScores(
                        window.start(), window.end(), metricNames, cursor, batchLimit);
                if (runs.isEmpty()) {
                    break;
                }
                pages++;
                for (AgentRunEntity run : runs) {
                    Set<String> scored = evaluationScoreRepository.findScoredMetricNames(run.getRunId());
                    boolean attempted = false;
                    boolean allSucceeded = true;
                    for (EvaluationMetric metric : metrics) {
                        if (scored.contains(metric.name())) {
                            skippedPairs++;
                            continue;
                        }
                        attempted = true;
                        MetricSummary summary = summaries.get(metric.name());
                        try {
                            PairOutcome outcome = evaluatePair(run, metric);
                            if (outcome.persisted()) {
                                summary.recordSuccess(outcome.score());
                            } else {
                                skippedPairs++;
                            }
                        } catch (RuntimeException ex) {
                            allSucceeded = false;
                            summary.recordFailure();
                            log.warn("EVALUATION_PAIR_FAILED runId={}, metric={}, errorType={}, error={}",
                                    run.getRunId(), metric.name(), ex.getClass().getSimpleName(), ex.getMessage());
                        }
                    }
                    if (!attempted) {
                        continue;
                    }
                    total++;
                    if (allSucceeded) {
                        successCount++;
                    } else {
                        failureCount++;
                    }
                }
                if (runs.size() < batchLimit) {
                    break;
                }
                cursor = runs.get(runs.size() - 1);
            }
            log.debug("EVALUATION_BATCH_PAGES pages={}", pages);
        }

        EvaluationReport report = EvaluationReport.builder()
                .startedAt(startedAt)
                .durationMs((System.nanoTime() - startNs) / 1_000_000L)
                .judgeModel(judgeGateway.judgeModel())
                .windowStart(window.start())
                .windowEnd(window.end())
                .total(total)
                .successCount(successCount)
                .failureCount(failureCount)
                .skippedPairs(skippedPairs)
                .perMetricSummary(summaries)
                .build();
        log.info("EVALUATION_BATCH_DONE total={}, success={}, failure={}, skippedPairs={}, durationMs={}",
                total, successCount, failureCount, skippedPairs, report.getDurationMs());
        if (reportWriter != null) {
            try {
                reportWriter.write(report);
            } catch (RuntimeException ex) {
                log.warn("EVALUATION_REPORT_WRITE_FAILED error={}", ex.getMessage());
            }
        }
        return report;
    }

    private PairOutcome evaluatePair(AgentRunEntity run, EvaluationMetric metric) {
        if (!run.isEvaluable()) {
            throw new JudgeFailureException("Run has no input or output to evaluate");
        }
        JudgeVerdict verdict = judgeWithRetry(run, metric);
        EvaluationScoreEntity score = new EvaluationScoreEntity();
        score.setRunId(run.getRunId());
        score.setMetricName(metric.name());
        score.setScore(verdict.score());
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (verdict.reasoning() != null) {
            metadata.put("reasoning", verdict.reasoning());
        }
        metadata.put("judge_model", judgeGateway.judgeModel());
        if (run.getTraceId() != null) {
            metadata.put("trace_id", run.getTraceId());
        }
        score.setMetadata(metadata);
        score.setCreatedAt(LocalDateTime.now(clock));
        boolean persisted = evaluationScoreRepository.saveIfAbsent(score);
        return new PairOutcome(persisted, verdict.score());
    }

    private JudgeVerdict judgeWithRetry(AgentRunEntity run, EvaluationMetric metric) {
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return validate(judgeGateway.judge(metric, run.getInput(), run.getOutput()));
            } catch (RuntimeException ex) {
                lastError = ex;
                log.info("EVALUATION_JUDGE_RETRY runId={}, metric={}, attempt={}/{}, error={}",
                        run.getRunId(), metric.name(), attempt, maxAttempts, ex.getMessage());
                if (attempt < maxAttempts) {
                    backoff();
                }
            }
        }
        throw new JudgeFailureException("Judge failed after " + maxAttempts + " attempts: "
                + (lastError == null ? "unknown" : lastError.getMessage()), lastError);
    }

    private JudgeVerdict validate(JudgeVerdict verdict) {
        if (verdict == null || verdict.score() == null) {
            throw new JudgeFailureException("Judge returned no score");
        }
        double score = verdict.score();
        if (Double.isNaN(score) || Double.isInfinite(score) || score < 0D || score > 1D) {
            throw new JudgeFailureException("Judge score out of range: " + score);
        }
        return verdict;
    }

    private void backoff() {
        if (retryBackoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(retryBackoff.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new JudgeFailureException("Interrupted while waiting to retry judge", ex);
        }
    }

    private record PairOutcome(boolean persisted, double score) {
    }
}

package com.convoagent.infrastructure.evaluation;

import com.convoagent.domain.evaluation.adapter.gateway.IEvaluationReportWriter;
import com.convoagent.domain.evaluation.model.valobj.EvaluationReport;
import com.convoagent.domain.evaluation.model.valobj.MetricSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 把评测报告写成 JSON 文件：{reportDir}/evaluation_report_yyyyMMdd_HHmmss.json。
 */
@Slf4j
public class JsonFileEvaluationReportWriter implements IEvaluationReportWriter {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path reportDir;
    private final ObjectMapper objectMapper;

    public JsonFileEvaluationReportWriter(Path reportDir, ObjectMapper objectMapper) {
        this.reportDir = reportDir;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void write(EvaluationReport report) {
        Path target = reportDir.resolve("evaluation_report_" + FILE_TIMESTAMP.format(report.getStartedAt()) + ".json");
        try {
            Files.createDirectories(reportDir);
            Files.writeString(target, objectMapper.writeValueAsString(toDocument(report)), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("评测报告写入失败: " + target, ex);
        }
        log.info("EVALUATION_REPORT_WRITTEN path={}", target);
    }

    Map<String, Object> toDocument(EvaluationReport report) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("started_at", report.getStartedAt() == null ? null : report.getStartedAt().toString());
        document.put("duration_ms", report.getDurationMs());
        document.put("judge_model", report.getJudgeModel());
        document.put("window_start", report.getWindowStart() == null ? null : report.getWindowStart().toString());
        document.put("window_end", report.getWindowEnd() == null ? null : report.getWindowEnd().toString());
        document.put("total", report.getTotal());
        document.put("success_count", report.getSuccessCount());
        document.put("failure_count", report.getFailureCount());
        document.put("skipped_pairs", report.getSkippedPairs());
        Map<String, Object> metrics = new LinkedHashMap<>();
        if (report.getPerMetricSummary() != null) {
            for (Map.Entry<String, MetricSummary> entry : report.getPerMetricSummary().entrySet()) {
                Map<String, Object> summary = new LinkedHashMap<>();
                summary.put("success_count", entry.getValue().getSuccessCount());
                summary.put("failure_count", entry.getValue().getFailureCount());
                summary.put("avg_score", entry.getValue().getAvgScore());
                metrics.put(entry.getKey(), summary);
            }
        }
        document.put("per_metric_summary", metrics);
        return document;
    }
}

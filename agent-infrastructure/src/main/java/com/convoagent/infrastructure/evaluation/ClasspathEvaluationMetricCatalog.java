package com.convoagent.infrastructure.evaluation;

import com.convoagent.domain.evaluation.adapter.gateway.IEvaluationMetricCatalog;
import com.convoagent.domain.evaluation.model.valobj.EvaluationMetric;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 从 classpath 自动发现评测指标：每个 markdown 文件是一个指标，文件名（去掉 .md）为指标名，内容为评分细则。
 */
@Slf4j
@Component
public class ClasspathEvaluationMetricCatalog implements IEvaluationMetricCatalog {

    private static final String SUFFIX = ".md";

    private final ResourcePatternResolver resolver;
    private final String locationPattern;

    public ClasspathEvaluationMetricCatalog(
            @Value("${agent.evaluation.metrics-location:classpath*:evaluation/metrics/*.md}") String locationPattern) {
        this(new PathMatchingResourcePatternResolver(), locationPattern);
    }

    ClasspathEvaluationMetricCatalog(ResourcePatternResolver resolver, String locationPattern) {
        this.resolver = resolver;
        this.locationPattern = locationPattern;
    }

    @Override
    public List<EvaluationMetric> loadMetrics() {
        Resource[] resources;
        try {
            resources = resolver.getResources(locationPattern);
        } catch (IOException ex) {
            throw new IllegalStateException("评测指标加载失败: " + locationPattern, ex);
        }
        List<EvaluationMetric> metrics = new ArrayList<>();
        for (Resource resource : resources) {
            String filename = resource.getFilename();
            if (filename == null || !filename.endsWith(SUFFIX)) {
                continue;
            }
            String name = filename.substring(0, filename.length() - SUFFIX.length());
            String rubric = read(resource);
            if (StringUtils.isBlank(name) || StringUtils.isBlank(rubric)) {
                log.warn("EVALUATION_METRIC_SKIPPED file={}", filename);
                continue;
            }
            metrics.add(new EvaluationMetric(name, rubric.trim()));
        }
        metrics.sort(Comparator.comparing(EvaluationMetric::name));
        return metrics;
    }

    private String read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("评测指标读取失败: " + resource.getDescription(), ex);
        }
    }
}

package com.convoagent.infrastructure.repository.evaluation;

import com.convoagent.domain.evaluation.adapter.repository.IEvaluationScoreRepository;
import com.convoagent.domain.evaluation.model.entity.EvaluationScoreEntity;
import com.convoagent.infrastructure.dao.EvaluationScoreDao;
import com.convoagent.infrastructure.dao.po.EvaluationScorePO;
import com.convoagent.infrastructure.util.JsonCodec;
import com.convoagent.types.exception.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 评测分数仓储实现，依赖 (run_id, metric_name) 唯一约束保证幂等。
 */
@Repository
public class EvaluationScoreRepositoryImpl implements IEvaluationScoreRepository {

    private final EvaluationScoreDao evaluationScoreDao;
    private final JsonCodec jsonCodec;

    public EvaluationScoreRepositoryImpl(EvaluationScoreDao evaluationScoreDao, JsonCodec jsonCodec) {
        this.evaluationScoreDao = evaluationScoreDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public boolean saveIfAbsent(EvaluationScoreEntity entity) {
        entity.validate();
        EvaluationScorePO po = EvaluationScorePO.builder()
                .runId(entity.getRunId())
                .metricName(entity.getMetricName())
                .score(entity.getScore())
                .metadata(jsonCodec.writeValue(entity.getMetadata()))
                .createdAt(entity.getCreatedAt())
                .build();
        try {
            boolean inserted = evaluationScoreDao.insertIgnoreConflict(po) > 0;
            if (inserted) {
                entity.setId(po.getId());
            }
            return inserted;
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("评测分数写入失败: " + entity.getRunId(), ex);
        }
    }

    @Override
    public Set<String> findScoredMetricNames(String runId) {
        List<String> names = evaluationScoreDao.selectMetricNamesByRunId(runId);
        return names == null ? new LinkedHashSet<>() : new LinkedHashSet<>(names);
    }
}

package com.convoagent.infrastructure.dao;

import com.convoagent.infrastructure.dao.po.EvaluationScorePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 评测分数 DAO。
 */
@Mapper
public interface EvaluationScoreDao {

    /**
     * (run_id, metric_name) 冲突时不写，返回 0。
     */
    int insertIgnoreConflict(EvaluationScorePO po);

    List<String> selectMetricNamesByRunId(@Param("runId") String runId);
}

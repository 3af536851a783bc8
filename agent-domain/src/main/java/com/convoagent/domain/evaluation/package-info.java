/**
 * 离线评测上下文：按指标为窗口内运行记录打分，(run, metric) 幂等。
 */
package com.convoagent.domain.evaluation;

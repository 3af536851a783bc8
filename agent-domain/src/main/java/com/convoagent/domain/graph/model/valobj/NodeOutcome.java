package com.convoagent.domain.graph.model.valobj;

/**
 * 节点执行结果，作为状态转移函数的输入。
 */
public enum NodeOutcome {
    /** 规划完成 */
    PLAN_READY,
    /** 规划失败 */
    PLAN_FAILED,
    /** 执行节点请求了工具调用，工具结果已回填 */
    TOOL_CALLS_REQUESTED,
    /** 执行节点给出了最终回复 */
    FINAL_RESPONSE,
    /** 执行步数耗尽 */
    STEP_BUDGET_EXHAUSTED,
    /** 执行节点生成失败 */
    NODE_FAILED,
    /** 调用墙钟预算耗尽 */
    TIMED_OUT
}

package com.convoagent.types.enums;

/**
 * 规划/执行两节点状态图的状态。DONE 为终态。
 */
public enum GraphStateEnum {
    PLANNING,
    EXECUTING,
    DONE;

    public boolean isTerminal() {
        return this == DONE;
    }
}

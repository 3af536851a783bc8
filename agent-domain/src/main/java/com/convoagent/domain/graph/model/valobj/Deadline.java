package com.convoagent.domain.graph.model.valobj;

import java.time.Duration;

/**
 * 基于 nanoTime 的截止时间。
 */
public final class Deadline {

    private final long budgetNanos;
    private final long deadlineNanos;

    private Deadline(long startNanos, long budgetNanos) {
        this.budgetNanos = budgetNanos;
        this.deadlineNanos = startNanos + budgetNanos;
    }

    public static Deadline after(Duration budget) {
        return new Deadline(System.nanoTime(), Math.max(budget.toNanos(), 0L));
    }

    public boolean expired() {
        return System.nanoTime() - deadlineNanos >= 0L;
    }

    public long remainingNanos() {
        return Math.max(deadlineNanos - System.nanoTime(), 0L);
    }

    public long budgetMillis() {
        return budgetNanos / 1_000_000L;
    }
}

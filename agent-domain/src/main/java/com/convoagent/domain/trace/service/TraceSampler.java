package com.convoagent.domain.trace.service;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 按配置概率做一次性采样决策。
 */
public class TraceSampler {

    private final boolean enabled;
    private final double sampleRate;

    public TraceSampler(boolean enabled, double sampleRate) {
        this.enabled = enabled;
        this.sampleRate = Math.max(0D, Math.min(1D, sampleRate));
    }

    public boolean sample() {
        if (!enabled || sampleRate <= 0D) {
            return false;
        }
        if (sampleRate >= 1D) {
            return true;
        }
        return ThreadLocalRandom.current().nextDouble() < sampleRate;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public double getSampleRate() {
        return sampleRate;
    }
}

package buaa.search.service;

import lombok.Getter;

import java.time.Duration;

/**
 * 固定间隔重试策略
 */
@Getter
public class RetryPolicy {

    /** 总尝试次数（含首次） */
    private final int maxAttempts;

    private final Duration delay;

    public RetryPolicy(int maxAttempts, Duration delay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts 至少为 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
    }

    /**
     * 第 attempt 次尝试失败后是否还能重试
     */
    public boolean canRetry(int attempt) {
        return attempt < maxAttempts;
    }
}

package com.initialone.jconstify.pipeline;

/**
 * 指数退避：第 k 次尝试失败后等待 backoff * 2^(k-1)，不超过 maxBackoff。
 * maxAttempts 是总尝试次数（含第一次）。
 */
public final class RetryPolicy {
    private final int maxAttempts;
    private final long backoffMs;
    private final long maxBackoffMs;

    public RetryPolicy(int maxAttempts, long backoffMs, long maxBackoffMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = Math.max(0, backoffMs);
        this.maxBackoffMs = Math.max(this.backoffMs, maxBackoffMs);
    }

    public static RetryPolicy ofSeconds(int maxAttempts, double backoffSec, double maxBackoffSec) {
        return new RetryPolicy(maxAttempts, (long) (backoffSec * 1000), (long) (maxBackoffSec * 1000));
    }

    public int maxAttempts() { return maxAttempts; }

    /** 第 attempt 次（从 1 开始）失败后的等待毫秒数 */
    public long delayAfter(int attempt) {
        long d = backoffMs;
        for (int i = 1; i < attempt && d < maxBackoffMs; i++) {
            d *= 2;
        }
        return Math.min(d, maxBackoffMs);
    }

    @Override
    public String toString() {
        return "RetryPolicy{attempts=" + maxAttempts + ", backoff=" + backoffMs + "ms, max=" + maxBackoffMs + "ms}";
    }
}

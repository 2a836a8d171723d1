package com.dlxretry.model;

/**
 * 重试策略, 部署期内固定
 */
public final class RetryPolicy {

    private final int maxRetries;

    private RetryPolicy(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("dlx-retry.max-retries must be >= 0, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
    }

    public static RetryPolicy of(int maxRetries) {
        return new RetryPolicy(maxRetries);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /** retryCount == maxRetries 视为耗尽 */
    public boolean allowsRetry(long retryCount) {
        return retryCount < maxRetries;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + "}";
    }
}

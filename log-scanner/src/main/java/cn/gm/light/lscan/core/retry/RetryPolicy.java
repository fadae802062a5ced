package cn.gm.light.lscan.core.retry;

/**
 * fetch 失败后的重试策略，注入到每个 fetch 线程。
 *
 * <p>attempt 从 1 开始，表示同一区间已经连续失败的次数；区间有进展后重新计数。
 */
public interface RetryPolicy {

    long GIVE_UP = -1L;

    /**
     * 第 attempt 次失败之后应等待的毫秒数，返回 {@link #GIVE_UP} 表示放弃。
     */
    long nextDelayMillis(int attempt);

    /**
     * 无限次、无等待地重试同一区间。
     */
    static RetryPolicy unbounded() {
        return FixedDelayRetryPolicy.UNBOUNDED;
    }

    /**
     * @param maxAttempts 最多失败次数，小于等于 0 表示不限
     * @param delayMillis 每次重试前等待的毫秒数
     */
    static RetryPolicy fixed(int maxAttempts, long delayMillis) {
        return new FixedDelayRetryPolicy(maxAttempts, delayMillis);
    }

    /**
     * 等待时间从 initialDelayMillis 开始每次翻倍，最多 maxDelayMillis。
     *
     * @param maxAttempts 最多失败次数，小于等于 0 表示不限
     */
    static RetryPolicy exponential(long initialDelayMillis, long maxDelayMillis, int maxAttempts) {
        return new ExponentialBackoffRetryPolicy(initialDelayMillis, maxDelayMillis, maxAttempts);
    }
}

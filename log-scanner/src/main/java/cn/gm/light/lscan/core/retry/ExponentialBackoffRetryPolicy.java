package cn.gm.light.lscan.core.retry;

import lombok.Getter;
import lombok.ToString;

/**
 * 指数退避：initial, 2*initial, 4*initial ... 封顶 maxDelayMillis。
 */
@Getter
@ToString
public class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private final long initialDelayMillis;
    private final long maxDelayMillis;
    private final int maxAttempts;

    public ExponentialBackoffRetryPolicy(long initialDelayMillis, long maxDelayMillis, int maxAttempts) {
        if (initialDelayMillis <= 0) {
            throw new IllegalArgumentException("initialDelayMillis must be positive");
        }
        if (maxDelayMillis < initialDelayMillis) {
            throw new IllegalArgumentException("maxDelayMillis must not be less than initialDelayMillis");
        }
        this.initialDelayMillis = initialDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public long nextDelayMillis(int attempt) {
        if (maxAttempts > 0 && attempt >= maxAttempts) {
            return GIVE_UP;
        }
        int shift = Math.max(0, Math.min(attempt - 1, 62));
        long delay = initialDelayMillis << shift;
        // 左移溢出或超过上限
        if (delay <= 0 || (delay >> shift) != initialDelayMillis || delay > maxDelayMillis) {
            return maxDelayMillis;
        }
        return delay;
    }
}

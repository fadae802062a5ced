package cn.gm.light.lscan.core.retry;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class FixedDelayRetryPolicy implements RetryPolicy {

    static final FixedDelayRetryPolicy UNBOUNDED = new FixedDelayRetryPolicy(0, 0);

    private final int maxAttempts;
    private final long delayMillis;

    public FixedDelayRetryPolicy(int maxAttempts, long delayMillis) {
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delayMillis must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.delayMillis = delayMillis;
    }

    @Override
    public long nextDelayMillis(int attempt) {
        if (maxAttempts > 0 && attempt >= maxAttempts) {
            return GIVE_UP;
        }
        return delayMillis;
    }
}

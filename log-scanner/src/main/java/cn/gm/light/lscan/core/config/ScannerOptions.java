package cn.gm.light.lscan.core.config;

import cn.gm.light.lscan.core.retry.RetryPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Properties;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description TODO
 * @date 2025/4/2 10:01:17
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScannerOptions {
    public static final String PREFIX = "scanner.";

    // 每次向日志请求的条目数
    @Builder.Default
    private int batchSize = 1000;

    // 并发调用 handler 的线程数
    @Builder.Default
    private int numProcessWorkers = 1;

    // 并发 fetch 的线程数
    @Builder.Default
    private int numFetchWorkers = 1;

    // 不打印进度信息，告警仍然打印
    @Builder.Default
    private boolean quiet = false;

    @Builder.Default
    private int workQueueCapacity = 1000;

    // ring buffer 大小，会向上取到 2 的幂
    @Builder.Default
    private int entryQueueCapacity = 131072;

    @Builder.Default
    private long progressIntervalMs = 1000;

    @Builder.Default
    private RetryPolicy retryPolicy = RetryPolicy.unbounded();

    public static ScannerOptions defaults() {
        return ScannerOptions.builder().build();
    }

    /**
     * 校验线程数和队列容量，batchSize 不校验：小于等于 0 时 scan 直接得到空区间。
     */
    public ScannerOptions validate() {
        if (numProcessWorkers <= 0) {
            throw new IllegalArgumentException("numProcessWorkers must be positive");
        }
        if (numFetchWorkers <= 0) {
            throw new IllegalArgumentException("numFetchWorkers must be positive");
        }
        if (workQueueCapacity <= 0) {
            throw new IllegalArgumentException("workQueueCapacity must be positive");
        }
        if (entryQueueCapacity <= 0 || entryQueueCapacity > (1 << 30)) {
            throw new IllegalArgumentException("entryQueueCapacity must be in (0, 2^30]");
        }
        if (progressIntervalMs <= 0) {
            throw new IllegalArgumentException("progressIntervalMs must be positive");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy must not be null");
        }
        return this;
    }

    public int ringBufferSize() {
        int size = Integer.highestOneBit(entryQueueCapacity);
        return size == entryQueueCapacity ? size : size << 1;
    }

    /**
     * 从 scanner.* 配置项读取，缺省项使用默认值。
     */
    public static ScannerOptions fromProperties(Properties props) {
        ScannerOptions defaults = defaults();
        int maxAttempts = intValue(props, "retry.maxAttempts", 0);
        long initialDelayMs = longValue(props, "retry.initialDelayMs", 0);
        long maxDelayMs = longValue(props, "retry.maxDelayMs", Math.max(initialDelayMs, 30_000));
        RetryPolicy retryPolicy;
        if (initialDelayMs > 0) {
            retryPolicy = RetryPolicy.exponential(initialDelayMs, maxDelayMs, maxAttempts);
        } else if (maxAttempts > 0) {
            retryPolicy = RetryPolicy.fixed(maxAttempts, 0);
        } else {
            retryPolicy = RetryPolicy.unbounded();
        }
        return ScannerOptions.builder()
                .batchSize(intValue(props, "batchSize", defaults.getBatchSize()))
                .numProcessWorkers(intValue(props, "numProcessWorkers", defaults.getNumProcessWorkers()))
                .numFetchWorkers(intValue(props, "numFetchWorkers", defaults.getNumFetchWorkers()))
                .quiet(Boolean.parseBoolean(props.getProperty(PREFIX + "quiet", String.valueOf(defaults.isQuiet())).trim()))
                .workQueueCapacity(intValue(props, "workQueueCapacity", defaults.getWorkQueueCapacity()))
                .entryQueueCapacity(intValue(props, "entryQueueCapacity", defaults.getEntryQueueCapacity()))
                .progressIntervalMs(longValue(props, "progressIntervalMs", defaults.getProgressIntervalMs()))
                .retryPolicy(retryPolicy)
                .build()
                .validate();
    }

    private static int intValue(Properties props, String key, int defaultValue) {
        String value = props.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not an integer: " + value, e);
        }
    }

    private static long longValue(Properties props, String key, long defaultValue) {
        String value = props.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a number: " + value, e);
        }
    }
}

package cn.gm.light.lscan.core;

import cn.gm.light.lscan.entity.IndexRange;
import cn.gm.light.lscan.exception.ScanException;
import lombok.Getter;
import lombok.Setter;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * 一次 scan 调用的状态，调用返回后丢弃。
 */
@Getter
public class ScanJob {
    private final String logId;
    private final long startIndex;
    private final long endIndex;
    private final List<IndexRange> ranges;
    // 已放入 entry 队列的条目数
    private final LongAdder fetched = new LongAdder();
    // 已交给 handler 的条目数
    private final LongAdder processed = new LongAdder();
    private final long startNanos = System.nanoTime();
    private final AtomicReference<ScanException> failure = new AtomicReference<>();
    private volatile boolean cancelled;
    // fetch 线程池，cancel 时中断
    @Setter
    private volatile ExecutorService fetchExecutor;

    public ScanJob(String logId, long startIndex, long endIndex, List<IndexRange> ranges) {
        this.logId = logId;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.ranges = ranges;
    }

    /**
     * 记录失败并取消任务，只保留第一个失败。
     *
     * @return 是否是第一个失败
     */
    public boolean fail(ScanException e) {
        boolean first = failure.compareAndSet(null, e);
        cancelled = true;
        return first;
    }

    public long total() {
        return Math.max(0, endIndex - startIndex);
    }

    public long elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}

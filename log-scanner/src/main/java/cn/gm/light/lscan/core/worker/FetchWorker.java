package cn.gm.light.lscan.core.worker;

import cn.gm.light.lscan.core.LogClient;
import cn.gm.light.lscan.core.ScanJob;
import cn.gm.light.lscan.core.retry.RetryPolicy;
import cn.gm.light.lscan.entity.IndexRange;
import cn.gm.light.lscan.entity.LogEntry;
import cn.gm.light.lscan.exception.ScanException;
import com.lmax.disruptor.RingBuffer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description fetch 线程
 * 1. 从工作队列取区间，直到收到结束标记
 * 2. 按区间当前的 [start, end] 请求日志，日志可能只返回一部分，剩余部分继续请求
 * 3. 每个条目按区间游标赋 index，复制后放入 entry 队列，区间内严格递增
 * 4. 失败按 RetryPolicy 重试同一区间，策略放弃时记录失败并取消整个任务
 * @date 2025/4/2 11:05:48
 */
@Slf4j
public class FetchWorker implements Runnable {
    static final long POLL_INTERVAL_MS = 50;

    private final int id;
    private final ScanJob job;
    private final LogClient logClient;
    private final BlockingQueue<IndexRange> workQueue;
    private final RingBuffer<EntryEvent> ringBuffer;
    private final RetryPolicy retryPolicy;
    private final boolean quiet;
    private final CountDownLatch finished;

    public FetchWorker(int id, ScanJob job, LogClient logClient, BlockingQueue<IndexRange> workQueue,
                       RingBuffer<EntryEvent> ringBuffer, RetryPolicy retryPolicy, boolean quiet,
                       CountDownLatch finished) {
        this.id = id;
        this.job = job;
        this.logClient = logClient;
        this.workQueue = workQueue;
        this.ringBuffer = ringBuffer;
        this.retryPolicy = retryPolicy;
        this.quiet = quiet;
        this.finished = finished;
    }

    @Override
    public void run() {
        try {
            while (!job.isCancelled()) {
                IndexRange range = workQueue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (range == null) {
                    continue;
                }
                if (range == IndexRange.END_MARKER) {
                    break;
                }
                fetchRange(range);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!job.isCancelled()) {
                job.fail(new ScanException(ScanException.INTERRUPTED,
                        job.getLogId() + ": fetcher " + id + " interrupted", e));
            }
        } catch (Throwable t) {
            // 退出前先记录失败
            if (job.fail(new ScanException(ScanException.FETCH_FAILED,
                    job.getLogId() + ": fetcher " + id + " failed", t))) {
                log.error("{}: Fetcher {} failed, cancelling scan", job.getLogId(), id, t);
            }
            if (t instanceof Error) {
                throw (Error) t;
            }
        } finally {
            if (!quiet) {
                log.info("{}: Fetcher {} finished", job.getLogId(), id);
            }
            finished.countDown();
        }
    }

    void fetchRange(IndexRange range) throws InterruptedException {
        int attempt = 0;
        while (!range.isSatisfied()) {
            if (job.isCancelled()) {
                return;
            }
            log.debug("{}: Fetching entries {} to {}", job.getLogId(), range.getStart(), range.getEnd());
            List<LogEntry> entries;
            try {
                entries = logClient.getEntries(range.getStart(), range.getEnd());
            } catch (Exception e) {
                // 客户端可能抛出未声明的受检异常
                log.warn("{}: Problem fetching from log: {}", job.getLogId(), e.getMessage());
                attempt++;
                if (!backOff(range, attempt, e)) {
                    return;
                }
                continue;
            }
            if (publish(range, entries) > 0) {
                attempt = 0;
            } else if (!job.isCancelled()) {
                log.debug("{}: log returned no entries for {} to {}", job.getLogId(), range.getStart(), range.getEnd());
                attempt++;
                if (!backOff(range, attempt, null)) {
                    return;
                }
            }
        }
    }

    /**
     * @return 本次放入 entry 队列的条目数
     */
    private int publish(IndexRange range, List<LogEntry> entries) {
        if (entries == null) {
            return 0;
        }
        int delivered = 0;
        for (LogEntry entry : entries) {
            // 超出请求区间的条目直接丢弃
            if (range.isSatisfied() || job.isCancelled()) {
                break;
            }
            if (entry == null) {
                break;
            }
            // 客户端返回的对象可能被复用，放入队列的是副本
            ringBuffer.publishEvent(EntryEvent.TRANSLATOR,
                    new LogEntry(range.getStart(), entry.getTimestamp(), entry.getPayload()));
            job.getFetched().increment();
            range.setStart(range.getStart() + 1);
            delivered++;
        }
        return delivered;
    }

    private boolean backOff(IndexRange range, int attempt, Throwable cause) throws InterruptedException {
        long delay = retryPolicy.nextDelayMillis(attempt);
        if (delay == RetryPolicy.GIVE_UP) {
            ScanException e = new ScanException(ScanException.RANGE_STUCK,
                    String.format("%s: giving up on entries %d to %d after %d attempts",
                            job.getLogId(), range.getStart(), range.getEnd(), attempt), cause);
            log.error(e.getMessage());
            job.fail(e);
            return false;
        }
        if (delay > 0) {
            Thread.sleep(delay);
        }
        return true;
    }
}

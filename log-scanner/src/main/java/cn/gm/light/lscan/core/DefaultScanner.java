package cn.gm.light.lscan.core;

import cn.gm.light.lscan.EntryHandler;
import cn.gm.light.lscan.Scanner;
import cn.gm.light.lscan.core.config.ScannerOptions;
import cn.gm.light.lscan.core.worker.EntryEvent;
import cn.gm.light.lscan.core.worker.FetchWorker;
import cn.gm.light.lscan.core.worker.ProcessWorker;
import cn.gm.light.lscan.core.worker.ScanExceptionHandler;
import cn.gm.light.lscan.entity.IndexRange;
import cn.gm.light.lscan.enums.ScanState;
import cn.gm.light.lscan.exception.ScanException;
import cn.gm.light.lscan.utils.HumanTime;
import cn.gm.light.lscan.utils.ScanThreadFactory;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description 默认扫描实现
 * 1. 把 [startIndex, endIndex) 切成 batchSize 大小的区间，放入有界工作队列
 * 2. N 个 fetch 线程取区间、拉取日志，条目放入 Disruptor ring buffer（有界，满了 fetch 线程阻塞）
 * 3. M 个 process 线程组成 worker pool，每个条目只交给一个 handler 调用
 * 4. 关闭顺序：工作队列放入结束标记 -> 等所有 fetch 线程退出 -> 关闭 Disruptor（等 ring buffer 处理完）
 *    顺序不能颠倒，否则 process 线程可能在 entry 队列还没填满时就退出
 * @date 2025/4/2 09:55:12
 */
@Slf4j
public class DefaultScanner implements Scanner {
    private static final long OFFER_INTERVAL_MS = 50;

    private final String logId;
    private final LogClient logClient;
    private final ScannerOptions options;

    // 正在执行的 scan，cancel 只作用于它
    private final AtomicReference<ScanJob> active = new AtomicReference<>();
    private volatile ScanState state = ScanState.IDLE;
    // 最近一次 scan，用于读取进度
    private volatile ScanJob job;

    public DefaultScanner(String logId, LogClient logClient, ScannerOptions options) {
        this.logId = Objects.requireNonNull(logId, "logId");
        this.logClient = Objects.requireNonNull(logClient, "logClient");
        this.options = Objects.requireNonNull(options, "options").validate();
    }

    @Override
    public String getLogId() {
        return logId;
    }

    @Override
    public long treeSize() {
        return logClient.getTreeSize();
    }

    @Override
    public void scan(long startIndex, long endIndex, EntryHandler handler) {
        Objects.requireNonNull(handler, "handler");
        List<IndexRange> ranges = RangePartitioner.partition(startIndex, endIndex, options.getBatchSize());
        ScanJob current = new ScanJob(logId, startIndex, endIndex, ranges);
        if (!active.compareAndSet(null, current)) {
            throw new IllegalStateException(logId + ": a scan is already running on this scanner");
        }
        try {
            info("Starting scan...");
            state = ScanState.PARTITIONING;
            this.job = current;
            execute(current, handler);
            state = ScanState.COMPLETE;
        } catch (RuntimeException e) {
            state = ScanState.FAILED;
            throw e;
        } finally {
            active.set(null);
        }
    }

    private void execute(ScanJob current, EntryHandler handler) {
        if (current.getRanges().isEmpty()) {
            info("Completed 0 entries in {}", HumanTime.formatMillis(current.elapsedMillis()));
            return;
        }
        state = ScanState.RUNNING;
        int numFetchers = options.getNumFetchWorkers();
        int numProcessors = options.getNumProcessWorkers();

        Disruptor<EntryEvent> disruptor = new Disruptor<>(EntryEvent::new,
                options.ringBufferSize(),
                ScanThreadFactory.forThreadPool(logId + "-processor"),
                ProducerType.MULTI,
                new SleepingWaitStrategy(100, 1000));
        disruptor.setDefaultExceptionHandler(new ScanExceptionHandler(current));
        ProcessWorker[] processors = new ProcessWorker[numProcessors];
        for (int i = 0; i < numProcessors; i++) {
            processors[i] = new ProcessWorker(i, this, current, handler, options.isQuiet());
        }
        disruptor.handleEventsWithWorkerPool(processors);
        RingBuffer<EntryEvent> ringBuffer = disruptor.start();

        BlockingQueue<IndexRange> workQueue = new LinkedBlockingQueue<>(options.getWorkQueueCapacity());
        CountDownLatch fetchersDone = new CountDownLatch(numFetchers);
        ExecutorService executor = Executors.newFixedThreadPool(numFetchers,
                ScanThreadFactory.forThreadPool(logId + "-fetcher"));
        for (int i = 0; i < numFetchers; i++) {
            executor.execute(new FetchWorker(i, current, logClient, workQueue, ringBuffer,
                    options.getRetryPolicy(), options.isQuiet(), fetchersDone));
        }
        current.setFetchExecutor(executor);

        ProgressReporter reporter = null;
        if (!options.isQuiet()) {
            reporter = new ProgressReporter(current);
            reporter.start(options.getProgressIntervalMs());
        }
        try {
            try {
                feed(current, workQueue, numFetchers);
                state = ScanState.DRAINING;
                fetchersDone.await();
            } catch (InterruptedException e) {
                current.fail(new ScanException(ScanException.INTERRUPTED, logId + ": scan interrupted", e));
                executor.shutdownNow();
                awaitUninterruptibly(fetchersDone);
                Thread.currentThread().interrupt();
            } finally {
                executor.shutdown();
                current.setFetchExecutor(null);
            }
            // fetch 线程全部退出后才能关闭 entry 队列
            disruptor.shutdown();
        } finally {
            if (reporter != null) {
                reporter.stop();
            }
        }

        ScanException failure = current.getFailure().get();
        if (failure != null) {
            log.warn("{}: scan aborted after {} entries: {}", logId, current.getProcessed().sum(), failure.getMessage());
            throw failure;
        }
        info("Completed {} entries in {}", current.getProcessed().sum(),
                HumanTime.formatMillis(current.elapsedMillis()));
    }

    /**
     * 按顺序放入所有区间，然后每个 fetch 线程一个结束标记。任务取消后停止投递。
     */
    private void feed(ScanJob current, BlockingQueue<IndexRange> workQueue, int numFetchers) throws InterruptedException {
        for (IndexRange range : current.getRanges()) {
            if (!offer(current, workQueue, range)) {
                return;
            }
        }
        for (int i = 0; i < numFetchers; i++) {
            if (!offer(current, workQueue, IndexRange.END_MARKER)) {
                return;
            }
        }
    }

    private boolean offer(ScanJob current, BlockingQueue<IndexRange> workQueue, IndexRange range) throws InterruptedException {
        while (!current.isCancelled()) {
            if (workQueue.offer(range, OFFER_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        while (true) {
            try {
                latch.await();
                return;
            } catch (InterruptedException ignored) {
                // 调用方会在返回后恢复中断标记
            }
        }
    }

    @Override
    public boolean cancel() {
        ScanJob current = active.get();
        if (current == null) {
            return false;
        }
        current.fail(ScanException.cancelled(logId));
        ExecutorService executor = current.getFetchExecutor();
        if (executor != null) {
            executor.shutdownNow();
        }
        return true;
    }

    @Override
    public ScanState getState() {
        return state;
    }

    @Override
    public long getProcessed() {
        ScanJob current = this.job;
        return current == null ? 0 : current.getProcessed().sum();
    }

    private void info(String format, Object... args) {
        if (!options.isQuiet()) {
            log.info(logId + ": " + format, args);
        }
    }
}

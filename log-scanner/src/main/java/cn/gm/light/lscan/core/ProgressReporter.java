package cn.gm.light.lscan.core;

import cn.gm.light.lscan.utils.HumanTime;
import cn.gm.light.lscan.utils.ScanThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 定期打印进度，读计数器时不加锁，允许读到旧值。
 */
@Slf4j
public class ProgressReporter implements Runnable {
    private final ScanJob job;
    private ScheduledExecutorService executor;

    public ProgressReporter(ScanJob job) {
        this.job = job;
    }

    public void start(long intervalMs) {
        executor = Executors.newSingleThreadScheduledExecutor(
                ScanThreadFactory.forThreadPool(job.getLogId() + "-progress"));
        executor.scheduleAtFixedRate(this, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void run() {
        log.info("{}: {}", job.getLogId(), describe(job.getProcessed().sum(), job.getStartIndex(),
                job.total(), job.elapsedMillis()));
    }

    static String describe(long processed, long startIndex, long total, long elapsedMillis) {
        double seconds = Math.max(elapsedMillis, 1) / 1000.0;
        double throughput = processed / seconds;
        String eta = throughput > 0 ? HumanTime.format((long) ((total - processed) / throughput)) : "unknown";
        return String.format("Processed: %d entries (to index %d). Throughput: %3.2f ETA: %s",
                processed, startIndex + processed, throughput, eta);
    }

    public void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}

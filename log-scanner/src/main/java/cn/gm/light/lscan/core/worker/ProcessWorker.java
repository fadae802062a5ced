package cn.gm.light.lscan.core.worker;

import cn.gm.light.lscan.EntryHandler;
import cn.gm.light.lscan.Scanner;
import cn.gm.light.lscan.core.ScanJob;
import com.lmax.disruptor.LifecycleAware;
import com.lmax.disruptor.WorkHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * process 线程：每个条目只会被 worker pool 中的一个线程处理。
 * handler 抛出的异常不在这里处理，交给 {@link ScanExceptionHandler}。
 */
@Slf4j
public class ProcessWorker implements WorkHandler<EntryEvent>, LifecycleAware {
    private final int id;
    private final Scanner scanner;
    private final ScanJob job;
    private final EntryHandler handler;
    private final boolean quiet;

    public ProcessWorker(int id, Scanner scanner, ScanJob job, EntryHandler handler, boolean quiet) {
        this.id = id;
        this.scanner = scanner;
        this.job = job;
        this.handler = handler;
        this.quiet = quiet;
    }

    @Override
    public void onEvent(EntryEvent event) throws Exception {
        // 任务已取消，只排空队列
        if (job.isCancelled()) {
            return;
        }
        handler.handle(scanner, event.getEntry());
        job.getProcessed().increment();
    }

    @Override
    public void onStart() {
    }

    @Override
    public void onShutdown() {
        if (!quiet) {
            log.info("{}: Processor {} finished", job.getLogId(), id);
        }
    }
}

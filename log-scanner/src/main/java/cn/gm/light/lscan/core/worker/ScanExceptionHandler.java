package cn.gm.light.lscan.core.worker;

import cn.gm.light.lscan.core.ScanJob;
import cn.gm.light.lscan.exception.ScanException;
import com.lmax.disruptor.ExceptionHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * handler 失败时记录第一个异常并取消任务，scan 排空后抛给调用方。
 */
@Slf4j
public class ScanExceptionHandler implements ExceptionHandler<EntryEvent> {
    private final ScanJob job;

    public ScanExceptionHandler(ScanJob job) {
        this.job = job;
    }

    @Override
    public void handleEventException(Throwable ex, long sequence, EntryEvent event) {
        Long index = event.getEntry() == null ? null : event.getEntry().getIndex();
        ScanException failure = new ScanException(ScanException.HANDLER_FAILED,
                job.getLogId() + ": handler failed on entry " + index, ex);
        if (job.fail(failure)) {
            log.error("{}: handler failed on entry {}, cancelling scan", job.getLogId(), index, ex);
        }
    }

    @Override
    public void handleOnStartException(Throwable ex) {
        log.error("{}: processor failed to start", job.getLogId(), ex);
    }

    @Override
    public void handleOnShutdownException(Throwable ex) {
        log.error("{}: processor failed to shut down", job.getLogId(), ex);
    }
}

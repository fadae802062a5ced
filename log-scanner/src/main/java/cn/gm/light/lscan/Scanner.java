package cn.gm.light.lscan;

import cn.gm.light.lscan.core.DefaultScanner;
import cn.gm.light.lscan.core.LogClient;
import cn.gm.light.lscan.core.config.ScannerOptions;
import cn.gm.light.lscan.enums.ScanState;
import cn.gm.light.lscan.exception.LogClientException;
import cn.gm.light.lscan.exception.ScanException;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description 并发扫描一条追加写日志，把区间内每个条目恰好交给 handler 一次
 * @date 2025/4/2 09:48:31
 */
public interface Scanner {

    static Scanner create(String logId, LogClient logClient, ScannerOptions options) {
        return new DefaultScanner(logId, logClient, options);
    }

    String getLogId();

    /**
     * 当前日志大小，失败原样抛出，不重试。
     *
     * @throws LogClientException 远端访问失败
     */
    long treeSize();

    /**
     * 同步扫描 [startIndex, endIndex)，所有条目交给 handler 之后才返回。
     *
     * <p>fetch 失败按配置的 {@code RetryPolicy} 重试，默认无限重试。
     *
     * @throws ScanException 重试耗尽、fetch 线程异常退出、handler 抛错、被取消或调用线程被中断
     * @throws IllegalStateException 同一个 Scanner 上已有一次 scan 在执行
     */
    void scan(long startIndex, long endIndex, EntryHandler handler);

    /**
     * 中止正在执行的 scan，没有正在执行的 scan 时返回 false。
     */
    boolean cancel();

    ScanState getState();

    /**
     * 当前（或最近一次）scan 已交给 handler 的条目数。
     */
    long getProcessed();
}

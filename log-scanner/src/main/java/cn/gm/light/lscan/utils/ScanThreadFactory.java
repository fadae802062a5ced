package cn.gm.light.lscan.utils;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description fetch/process 线程池使用的守护线程，命名为 poolName-thread-N
 * @date 2025/4/2 10:31:08
 */
@Slf4j
public final class ScanThreadFactory implements ThreadFactory {
    private final String poolName;
    private final AtomicInteger counter = new AtomicInteger();

    private ScanThreadFactory(String poolName) {
        this.poolName = poolName;
    }

    public static ThreadFactory forThreadPool(String poolName) {
        return new ScanThreadFactory(poolName);
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, poolName + "-thread-" + counter.incrementAndGet());
        // scan 结束后残留的线程不能阻止 JVM 退出
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) -> log.error("{} crashed", t.getName(), e));
        return thread;
    }
}

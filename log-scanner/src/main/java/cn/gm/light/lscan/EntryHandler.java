package cn.gm.light.lscan;

import cn.gm.light.lscan.entity.LogEntry;

/**
 * 调用方提供的条目回调。多个 process 线程会并发调用，
 * 除非只配置了一个 process 线程，否则实现必须线程安全。
 */
@FunctionalInterface
public interface EntryHandler {

    void handle(Scanner scanner, LogEntry entry) throws Exception;
}

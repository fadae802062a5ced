package cn.gm.light.lscan.core.storage;

import cn.gm.light.lscan.core.LogStorage;
import cn.gm.light.lscan.entity.LogEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description 内存日志存储，下标从 0 开始连续分配
 * @date 2025/4/4 09:30:26
 */
@Slf4j
public class MemoryLogStorage implements LogStorage {
    private final List<LogEntry> entries = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public long append(LogEntry[] batch) {
        lock.writeLock().lock();
        try {
            long expectedIndex = entries.size();
            // 先校验整批，失败时不写入任何条目
            for (LogEntry entry : batch) {
                if (entry.getIndex() != null && entry.getIndex() != expectedIndex) {
                    throw new IllegalStateException("Invalid log index sequence. Expected:"
                            + expectedIndex + " Actual:" + entry.getIndex());
                }
                expectedIndex++;
            }
            long index = entries.size();
            for (LogEntry entry : batch) {
                entry.setIndex(index++);
                entries.add(entry);
            }
            return index - 1;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<LogEntry> scan(long startIndex, int maxSize) {
        if (startIndex < 0) {
            throw new IllegalArgumentException("Start index cannot be negative");
        }
        if (maxSize <= 0) {
            return Collections.emptyList();
        }
        lock.readLock().lock();
        try {
            if (startIndex >= entries.size()) {
                return Collections.emptyList();
            }
            int from = (int) startIndex;
            int to = (int) Math.min(entries.size(), startIndex + maxSize);
            List<LogEntry> result = new ArrayList<>(to - from);
            // 返回副本，调用方会改写 index
            for (int i = from; i < to; i++) {
                LogEntry entry = entries.get(i);
                result.add(new LogEntry(entry.getIndex(), entry.getTimestamp(), entry.getPayload()));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public LogEntry readByIndex(long index) {
        lock.readLock().lock();
        try {
            if (index < 0 || index >= entries.size()) {
                return null;
            }
            return entries.get((int) index);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void init() {
    }

    @Override
    public void start() {
    }

    @Override
    public void stop() {
        lock.writeLock().lock();
        try {
            log.debug("clearing {} entries", entries.size());
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}

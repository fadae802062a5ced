package cn.gm.light.lscan.core.storage;

import cn.gm.light.lscan.core.LogClient;
import cn.gm.light.lscan.core.LogStorage;
import cn.gm.light.lscan.entity.LogEntry;

import java.util.List;

/**
 * 进程内直接读 {@link LogStorage}，maxBatchSize 模拟服务端对单次返回条数的限制。
 */
public class LocalLogClient implements LogClient {
    private final LogStorage storage;
    private final int maxBatchSize;

    public LocalLogClient(LogStorage storage) {
        this(storage, Integer.MAX_VALUE);
    }

    public LocalLogClient(LogStorage storage, int maxBatchSize) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive");
        }
        this.storage = storage;
        this.maxBatchSize = maxBatchSize;
    }

    @Override
    public List<LogEntry> getEntries(long start, long end) {
        return storage.scan(start, batchLimit(start, end, maxBatchSize));
    }

    @Override
    public long getTreeSize() {
        return storage.size();
    }

    static int batchLimit(long start, long end, int maxBatchSize) {
        if (end < start) {
            return 0;
        }
        return (int) Math.min(end - start + 1, maxBatchSize);
    }
}

package cn.gm.light.lscan.core;

import cn.gm.light.lscan.entity.LogEntry;

import java.util.List;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description 服务端日志存储
 * @date 2025/4/4 09:16:02
 */
public interface LogStorage extends LifeCycle {

    // 追加日志条目（支持批量），返回最后一条的下标
    long append(LogEntry[] entries);

    // 从起始下标读取，最多 maxSize 条
    List<LogEntry> scan(long startIndex, int maxSize);

    LogEntry readByIndex(long index);

    // 条目总数，下标范围 [0, size)
    long size();
}

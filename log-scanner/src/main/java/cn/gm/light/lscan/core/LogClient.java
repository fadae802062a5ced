package cn.gm.light.lscan.core;

import cn.gm.light.lscan.entity.LogEntry;
import cn.gm.light.lscan.exception.LogClientException;

import java.util.List;

/**
 * 远端日志的只读访问能力。
 *
 * <p>日志是追加写、按连续下标寻址的。批量读取允许返回少于请求数量的条目，
 * 但返回的条目必须从 {@code start} 开始连续，不能越过请求区间。
 */
public interface LogClient {

    /**
     * 读取闭区间 [start, end] 内的条目。
     *
     * @param start 起始下标（包含）
     * @param end   结束下标（包含）
     * @return 从 start 开始的连续条目，可能被截断
     * @throws LogClientException 网络或服务端错误
     */
    List<LogEntry> getEntries(long start, long end);

    /**
     * 当前日志大小。
     *
     * @throws LogClientException 网络或服务端错误
     */
    long getTreeSize();
}

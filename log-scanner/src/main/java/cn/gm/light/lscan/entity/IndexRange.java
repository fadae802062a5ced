package cn.gm.light.lscan.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description 闭区间 [start, end]，start 会被持有它的 fetch 线程原地推进
 * @date 2025/4/2 10:20:05
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndexRange {

    /**
     * 工作队列结束标记，每个 fetch 线程收到一个后退出
     */
    public static final IndexRange END_MARKER = new IndexRange(-1L, -2L);

    private long start;
    private long end;

    public long size() {
        return end - start + 1;
    }

    /**
     * 所有条目都已取回
     */
    public boolean isSatisfied() {
        return start > end;
    }
}

package cn.gm.light.lscan.core;

import cn.gm.light.lscan.entity.IndexRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 把半开区间 [startIndex, endIndex) 切成宽度不超过 batchSize 的有序闭区间。
 */
public final class RangePartitioner {

    private RangePartitioner() {
    }

    public static List<IndexRange> partition(long startIndex, long endIndex, int batchSize) {
        if (startIndex >= endIndex || batchSize <= 0) {
            return Collections.emptyList();
        }
        long total = endIndex - startIndex;
        List<IndexRange> ranges = new ArrayList<>((int) Math.min(Integer.MAX_VALUE - 8, (total + batchSize - 1) / batchSize));
        long start = startIndex;
        while (start < endIndex) {
            // endIndex - start 不会溢出，start + batchSize 可能溢出
            long end = start + Math.min(batchSize, endIndex - start) - 1;
            ranges.add(new IndexRange(start, end));
            start = end + 1;
        }
        return ranges;
    }
}

package cn.gm.light.lscan.core;

import cn.gm.light.lscan.entity.IndexRange;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class RangePartitionerTest {

    @Test
    public void testCoversIntervalWithoutGaps() {
        long[][] cases = {{0, 5000, 1000}, {0, 5001, 1000}, {7, 8, 1}, {3, 100, 7}, {0, 999, 1000}, {10, 11, 1000}};
        for (long[] c : cases) {
            long start = c[0];
            long end = c[1];
            int batch = (int) c[2];
            List<IndexRange> ranges = RangePartitioner.partition(start, end, batch);

            Assertions.assertFalse(ranges.isEmpty());
            Assertions.assertEquals(start, ranges.get(0).getStart());
            Assertions.assertEquals(end - 1, ranges.get(ranges.size() - 1).getEnd());
            long covered = 0;
            for (int i = 0; i < ranges.size(); i++) {
                IndexRange r = ranges.get(i);
                Assertions.assertTrue(r.getStart() <= r.getEnd());
                Assertions.assertTrue(r.size() <= batch, "range wider than batch: " + r);
                if (i > 0) {
                    Assertions.assertEquals(ranges.get(i - 1).getEnd() + 1, r.getStart());
                }
                covered += r.size();
            }
            Assertions.assertEquals(end - start, covered);
        }
    }

    @Test
    public void testExactMultipleOfBatch() {
        List<IndexRange> ranges = RangePartitioner.partition(0, 5000, 1000);
        Assertions.assertEquals(5, ranges.size());
        Assertions.assertEquals(new IndexRange(4000, 4999), ranges.get(4));
    }

    @Test
    public void testLastRangeNarrower() {
        List<IndexRange> ranges = RangePartitioner.partition(0, 2500, 1000);
        Assertions.assertEquals(3, ranges.size());
        Assertions.assertEquals(new IndexRange(2000, 2499), ranges.get(2));
    }

    @Test
    public void testDegenerateInput() {
        Assertions.assertTrue(RangePartitioner.partition(5, 5, 10).isEmpty());
        Assertions.assertTrue(RangePartitioner.partition(6, 5, 10).isEmpty());
        Assertions.assertTrue(RangePartitioner.partition(0, 100, 0).isEmpty());
        Assertions.assertTrue(RangePartitioner.partition(0, 100, -1).isEmpty());
    }

    @Test
    public void testNearMaxValue() {
        long end = Long.MAX_VALUE;
        long start = end - 2500;
        List<IndexRange> ranges = RangePartitioner.partition(start, end, 1000);
        Assertions.assertEquals(3, ranges.size());
        Assertions.assertEquals(end - 1, ranges.get(2).getEnd());
    }
}

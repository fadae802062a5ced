package cn.gm.light.lscan.core.storage;

import cn.gm.light.lscan.entity.LogEntry;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description TODO
 * @date 2025/4/6 15:20:08
 */
@Slf4j
public class MemoryLogStorageTest {
    private MemoryLogStorage storage;

    @BeforeEach
    public void setUp() {
        storage = new MemoryLogStorage();
        storage.init();
        storage.start();
        LogEntry[] batch = new LogEntry[10];
        for (int i = 0; i < batch.length; i++) {
            batch[i] = new LogEntry(("entry-" + i).getBytes(StandardCharsets.UTF_8));
        }
        Assertions.assertEquals(9, storage.append(batch));
    }

    @Test
    public void testAppendAssignsIndexes() {
        Assertions.assertEquals(10, storage.size());
        Assertions.assertEquals(3L, storage.readByIndex(3).getIndex());
        Assertions.assertEquals(10, storage.append(new LogEntry[]{new LogEntry(10L, 0L, new byte[0])}));
        Assertions.assertNull(storage.readByIndex(11));
        Assertions.assertNull(storage.readByIndex(-1));
    }

    @Test
    public void testAppendRejectsGap() {
        IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
                () -> storage.append(new LogEntry[]{new LogEntry(12L, 0L, new byte[0])}));
        Assertions.assertTrue(e.getMessage().contains("Expected:10"));
        Assertions.assertEquals(10, storage.size());
    }

    @Test
    public void testRejectedBatchWritesNothing() {
        LogEntry valid = new LogEntry(10L, 0L, new byte[0]);
        LogEntry gap = new LogEntry(12L, 0L, new byte[0]);

        Assertions.assertThrows(IllegalStateException.class, () -> storage.append(new LogEntry[]{valid, gap}));

        Assertions.assertEquals(10, storage.size());
        Assertions.assertNull(storage.readByIndex(10));
        Assertions.assertEquals(10, storage.append(new LogEntry[]{new LogEntry(new byte[0])}));
    }

    @Test
    public void testScan() {
        List<LogEntry> entries = storage.scan(4, 3);
        Assertions.assertEquals(3, entries.size());
        Assertions.assertEquals(4L, entries.get(0).getIndex());
        Assertions.assertEquals("entry-6", new String(entries.get(2).getPayload(), StandardCharsets.UTF_8));

        Assertions.assertEquals(2, storage.scan(8, 100).size());
        Assertions.assertTrue(storage.scan(10, 5).isEmpty());
        Assertions.assertTrue(storage.scan(0, 0).isEmpty());
        Assertions.assertThrows(IllegalArgumentException.class, () -> storage.scan(-1, 5));
    }

    @Test
    public void testScanReturnsCopies() {
        storage.scan(0, 1).get(0).setIndex(99L);
        Assertions.assertEquals(0L, storage.readByIndex(0).getIndex());
    }

    @Test
    public void testStopClears() {
        storage.stop();
        Assertions.assertEquals(0, storage.size());
    }
}

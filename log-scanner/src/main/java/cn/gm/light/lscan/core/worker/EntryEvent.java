package cn.gm.light.lscan.core.worker;

import cn.gm.light.lscan.entity.LogEntry;
import com.lmax.disruptor.EventTranslatorOneArg;
import lombok.Data;

/**
 * ring buffer 里的槽位
 */
@Data
public class EntryEvent {
    public static final EventTranslatorOneArg<EntryEvent, LogEntry> TRANSLATOR =
            (event, sequence, entry) -> event.setEntry(entry);

    private LogEntry entry;
}

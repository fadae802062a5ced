package cn.gm.light.lscan.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description 日志条目，index 由 fetch 线程按请求区间重新赋值
 * @date 2025/4/2 10:12:40
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogEntry implements Serializable {
    private static final long serialVersionUID = 1L;
    private Long index;
    private long timestamp;
    private byte[] payload;

    public LogEntry(byte[] payload) {
        this(null, System.currentTimeMillis(), payload);
    }
}

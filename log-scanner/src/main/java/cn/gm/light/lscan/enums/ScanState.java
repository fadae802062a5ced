package cn.gm.light.lscan.enums;

/**
 * 一次 scan 调用的生命周期
 */
public enum ScanState {
    IDLE,
    PARTITIONING,
    RUNNING,
    DRAINING,
    COMPLETE,
    FAILED
}

package cn.gm.light.lscan.exception;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description scan 被中止时抛给调用方
 * @date 2025/4/3 15:12:09
 */
public class ScanException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public static final int RANGE_STUCK = 1001;
    public static final int HANDLER_FAILED = 1002;
    public static final int CANCELLED = 1003;
    public static final int INTERRUPTED = 1004;
    public static final int FETCH_FAILED = 1005;

    private final int code;

    public ScanException(int code, String message) {
        super(message);
        this.code = code;
    }

    public ScanException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static ScanException cancelled(String logId) {
        return new ScanException(CANCELLED, logId + ": scan cancelled");
    }

    public int getCode() { return code; }
}

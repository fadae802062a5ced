package cn.gm.light.lscan.exception;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description 远端日志访问失败（网络错误或服务端返回错误）
 * @date 2025/4/3 15:10:44
 */
public class LogClientException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final int code;

    public LogClientException(int code, String message) {
        super(message);
        this.code = code;
    }

    public LogClientException(String message, Throwable cause) {
        this(500, message, cause);
    }

    public LogClientException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    // 默认错误码
    public static LogClientException of(String message) {
        return new LogClientException(500, message);
    }

    public int getCode() { return code; }
}

package cn.gm.light.lscan.entity;

import lombok.Data;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description 远端日志服务地址
 * @date 2025/4/3 13:40:22
 */
@Data
public class Endpoint {
    private String ip;
    private int port;
    private String addr;

    public Endpoint(String ip, int port) {
        this.ip = ip;
        this.port = port;
        this.addr = ip + ":" + port;
    }

    public Endpoint(String addr) {
        int idx = addr == null ? -1 : addr.lastIndexOf(':');
        if (idx <= 0 || idx == addr.length() - 1) {
            throw new IllegalArgumentException("endpoint must be host:port, got " + addr);
        }
        this.addr = addr;
        this.ip = addr.substring(0, idx);
        this.port = Integer.parseInt(addr.substring(idx + 1));
    }
}

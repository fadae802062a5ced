package cn.gm.light.lscan.core.rpc;

import cn.gm.light.lscan.core.LifeCycle;
import cn.gm.light.lscan.core.LogClient;
import cn.gm.light.lscan.entity.Endpoint;
import cn.gm.light.lscan.entity.LogEntry;
import cn.gm.light.lscan.entity.RequestCommand;
import cn.gm.light.lscan.entity.ResponseCommand;
import cn.gm.light.lscan.exception.LogClientException;
import com.alipay.remoting.exception.RemotingException;
import com.alipay.remoting.rpc.RpcClient;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description 基于 bolt 的远端日志客户端，所有失败统一转换成 LogClientException
 * @date 2025/4/4 10:15:03
 */
@Slf4j
public class BoltLogClient implements LogClient, LifeCycle {
    private final RpcClient client = new RpcClient();
    private final Endpoint endpoint;
    private final int timeoutMillis;

    public BoltLogClient(Endpoint endpoint, int timeoutMillis) {
        this.endpoint = endpoint;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public void init() {
        client.startup();
    }

    @Override
    public void start() {
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<LogEntry> getEntries(long start, long end) {
        ResponseCommand response = invoke(RequestCommand.getEntries(start, end));
        return (List<LogEntry>) response.getData();
    }

    @Override
    public long getTreeSize() {
        ResponseCommand response = invoke(RequestCommand.getTreeSize());
        return ((Number) response.getData()).longValue();
    }

    private ResponseCommand invoke(RequestCommand request) {
        Object result;
        try {
            result = client.invokeSync(endpoint.getAddr(), request, timeoutMillis);
        } catch (RemotingException e) {
            throw new LogClientException("rpc to " + endpoint.getAddr() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LogClientException("rpc to " + endpoint.getAddr() + " interrupted", e);
        }
        if (!(result instanceof ResponseCommand)) {
            throw LogClientException.of("unexpected response from " + endpoint.getAddr() + ": " + result);
        }
        ResponseCommand response = (ResponseCommand) result;
        if (!response.isOk()) {
            int code = response.getCode() == null ? 500 : response.getCode();
            throw new LogClientException(code, endpoint.getAddr() + " returned error: " + response.getMsg());
        }
        return response;
    }

    @Override
    public void stop() {
        client.shutdown();
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }
}

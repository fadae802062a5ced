package cn.gm.light.lscan.core.rpc;

import cn.gm.light.lscan.core.LifeCycle;
import cn.gm.light.lscan.core.LogStorage;
import cn.gm.light.lscan.entity.LogEntry;
import cn.gm.light.lscan.entity.RequestCommand;
import cn.gm.light.lscan.entity.ResponseCommand;
import com.alibaba.fastjson2.JSON;
import com.alipay.remoting.BizContext;
import com.alipay.remoting.rpc.RpcServer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * @author 明溪
 * @version 1.0
 * @project logScanner
 * @description 通过 bolt 暴露一个 LogStorage，单次最多返回 maxBatchSize 条
 * @date 2025/4/4 10:42:19
 */
@Slf4j
public class BoltLogServer implements LifeCycle {
    public static final int BAD_REQUEST = 400;
    public static final int INTERNAL_ERROR = 500;

    private final int port;
    private final LogStorage storage;
    private final int maxBatchSize;
    private RpcServer rpcServer;
    private volatile boolean running;

    public BoltLogServer(int port, LogStorage storage, int maxBatchSize) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive");
        }
        this.port = port;
        this.storage = storage;
        this.maxBatchSize = maxBatchSize;
    }

    @Override
    public void init() {
        rpcServer = new RpcServer(port);
        rpcServer.registerUserProcessor(new DefaultUserProcessor<RequestCommand>(RequestCommand.class) {
            @Override
            public Object handleRequest(BizContext bizContext, RequestCommand request) {
                return handlerRequest(request);
            }
        });
    }

    @Override
    public void start() {
        if (rpcServer == null) {
            init();
        }
        rpcServer.start();
        running = true;
        log.info("log server started on port {}, {} entries", port, storage.size());
    }

    public ResponseCommand handlerRequest(RequestCommand request) {
        log.debug("request:{}", JSON.toJSONString(request));
        if (request == null || request.getCommandType() == null) {
            return ResponseCommand.error(BAD_REQUEST, "missing command type");
        }
        try {
            switch (request.getCommandType()) {
                case GET_TREE_SIZE:
                    return ResponseCommand.ok(storage.size());
                case GET_ENTRIES:
                    return getEntries(request.getStart(), request.getEnd());
                default:
                    return ResponseCommand.error(BAD_REQUEST, "unsupported command " + request.getCommandType());
            }
        } catch (RuntimeException e) {
            log.error("failed to handle request {}", JSON.toJSONString(request), e);
            return ResponseCommand.error(INTERNAL_ERROR, e.getMessage());
        }
    }

    private ResponseCommand getEntries(long start, long end) {
        if (start < 0 || end < start) {
            return ResponseCommand.error(BAD_REQUEST, "invalid range " + start + " to " + end);
        }
        int limit = (int) Math.min(end - start + 1, maxBatchSize);
        List<LogEntry> entries = storage.scan(start, limit);
        // hessian 序列化需要可变的具体类型
        return ResponseCommand.ok(new ArrayList<>(entries));
    }

    @Override
    public void stop() {
        if (rpcServer != null) {
            rpcServer.stop();
        }
        running = false;
    }

    public boolean isRunning() {
        return running;
    }
}

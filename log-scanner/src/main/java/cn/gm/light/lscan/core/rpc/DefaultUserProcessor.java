package cn.gm.light.lscan.core.rpc;

import com.alipay.remoting.rpc.protocol.SyncUserProcessor;

/**
 * @author gongmeng
 * @version 1.0
 * @description: 按请求类型注册的同步处理器
 */
public abstract class DefaultUserProcessor<T> extends SyncUserProcessor<T> {
    private final Class<T> requestType;

    protected DefaultUserProcessor(Class<T> requestType) {
        this.requestType = requestType;
    }

    @Override
    public String interest() {
        return requestType.getName();
    }
}

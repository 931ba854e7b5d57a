package com.casinohub.casinoservice.platform.broadcast;

import com.casinohub.casinoservice.platform.transport.Envelope;

/**
 * 广播传输：本地投递之后，消息是否还要转发到其他实例。
 * 启动时按 casino.broadcast.mode 选择实现，{@link BroadcastHub} 不感知具体实现。
 */
public interface BroadcastTransport {

    /**
     * 注册本地投递回调，其他实例发来的消息经此交给本地连接。
     */
    void start(LocalDelivery localDelivery);

    /**
     * 转发已在本地投递过的消息。实现不得抛出异常。
     */
    void forward(String roomId, Envelope<?> envelope);

    /**
     * 是否处于降级（只做本地投递）状态。
     */
    boolean degraded();
}

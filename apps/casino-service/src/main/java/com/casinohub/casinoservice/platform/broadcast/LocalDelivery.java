package com.casinohub.casinoservice.platform.broadcast;

import com.casinohub.casinoservice.platform.transport.Envelope;

/**
 * 本地投递回调：把消息交给本实例上订阅该房间的连接。
 */
@FunctionalInterface
public interface LocalDelivery {

    void deliver(String roomId, Envelope<?> envelope);
}

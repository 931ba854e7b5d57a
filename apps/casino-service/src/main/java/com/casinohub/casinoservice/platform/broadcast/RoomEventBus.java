package com.casinohub.casinoservice.platform.broadcast;

import com.casinohub.casinoservice.platform.transport.Envelope;

/**
 * 跨实例的房间消息总线。
 */
public interface RoomEventBus {

    /**
     * 发布消息到其他实例。
     *
     * @throws RuntimeException 总线不可用
     */
    void publish(String roomId, Envelope<?> envelope);

    /**
     * 订阅其他实例发布的消息（本实例发出的消息不会回调）。
     */
    void subscribe(LocalDelivery handler);

    /** 最近一次发布是否成功 */
    boolean healthy();
}

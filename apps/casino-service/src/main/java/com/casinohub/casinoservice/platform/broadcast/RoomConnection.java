package com.casinohub.casinoservice.platform.broadcast;

import com.casinohub.casinoservice.platform.transport.Envelope;

/**
 * 本实例上的一条房间连接（观察者）。具体传输（STOMP、测试桩等）由实现决定。
 */
public interface RoomConnection {

    /** 连接 ID，在房间内唯一 */
    String connectionId();

    /** 建立连接时出示的会话令牌 */
    String token();

    void deliver(Envelope<?> envelope);

    /**
     * 关闭连接（如重复连接、会话过期）。
     */
    void close(String reason);
}

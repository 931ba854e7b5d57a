package com.casinohub.casinoservice.platform.ws;

import com.casinohub.casinoservice.platform.broadcast.RoomConnection;
import com.casinohub.casinoservice.platform.transport.Envelope;

/**
 * 一个 STOMP 会话对应的房间连接。连接 ID 即 STOMP sessionId。
 */
public class StompRoomConnection implements RoomConnection {

    private final String sessionId;
    private final String playerId;
    private final String token;
    private final WebSocketDisconnectHelper helper;

    public StompRoomConnection(String sessionId, String playerId, String token, WebSocketDisconnectHelper helper) {
        this.sessionId = sessionId;
        this.playerId = playerId;
        this.token = token;
        this.helper = helper;
    }

    @Override
    public String connectionId() {
        return sessionId;
    }

    @Override
    public String token() {
        return token;
    }

    @Override
    public void deliver(Envelope<?> envelope) {
        helper.sendToSession(playerId, sessionId, envelope);
    }

    /**
     * 先发踢人通知，再强制断开。
     */
    @Override
    public void close(String reason) {
        helper.sendKickMessage(playerId, sessionId, reason);
        helper.forceDisconnect(sessionId);
    }
}

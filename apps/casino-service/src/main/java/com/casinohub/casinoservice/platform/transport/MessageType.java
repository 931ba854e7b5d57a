package com.casinohub.casinoservice.platform.transport;

/**
 * 下行消息类型。
 */
public enum MessageType {
    PLAYER_JOINED,
    PLAYER_READY,
    ACTION_ACCEPTED,
    ACTION_REJECTED,
    GAME_STATE_SNAPSHOT,
    HEARTBEAT_ACK
}

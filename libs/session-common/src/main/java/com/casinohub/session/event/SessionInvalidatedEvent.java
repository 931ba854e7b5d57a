package com.casinohub.session.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话失效事件（领域模型）。
 *
 * 说明：
 * - 放在 session-common 中，作为“会话领域”的通用事件结构；
 * - 具体的传输方式（本地回调、Kafka）由 {@link SessionEventNotifier} 的实现决定；
 * - casino-service 收到后关闭该令牌对应的房间连接。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionInvalidatedEvent {

    /** 失效的令牌 */
    private String token;

    /** 玩家 ID */
    private String playerId;

    /** 房间 ID */
    private String roomId;

    /** 事件类型 */
    private EventType eventType;

    /** 事件触发时间（epoch 毫秒） */
    private Long timestamp;

    /** 可选：触发原因描述 */
    private String reason;

    /**
     * 事件类型枚举
     */
    public enum EventType {
        /** 同一玩家在同一房间建立了新连接，旧连接被顶替 */
        SUPERSEDED,
        /** 心跳超时 */
        EXPIRED,
        /** 玩家主动离开 */
        CLOSED
    }

    public static SessionInvalidatedEvent of(String token, String playerId, String roomId,
                                             EventType eventType, long timestamp, String reason) {
        return new SessionInvalidatedEvent(token, playerId, roomId, eventType, timestamp, reason);
    }
}

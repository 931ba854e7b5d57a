package com.casinohub.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对局会话信息。
 *
 * 一个令牌绑定到唯一的 (playerId, roomId)，同一时刻同一玩家在同一房间最多只有一个 ACTIVE 会话。
 * 时间字段统一使用 epoch 毫秒，便于 JSON 存储。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GameSession {

    /** 不透明令牌（URL 安全的随机串） */
    private String token;

    /** 玩家 ID */
    private String playerId;

    /** 房间 ID */
    private String roomId;

    /** 创建时间 */
    private Long createdAt;

    /** 最近一次心跳时间 */
    private Long lastHeartbeat;

    /** 会话状态 */
    private SessionStatus status;

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }
}

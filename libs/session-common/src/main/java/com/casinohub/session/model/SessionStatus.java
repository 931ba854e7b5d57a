package com.casinohub.session.model;

/**
 * 会话状态。
 *
 * - ACTIVE：正常在线，可提交动作与心跳
 * - KICKED：被同一玩家在同一房间的新连接顶替（重复连接）
 * - EXPIRED：超过心跳 TTL 未续期，已被回收或在校验时判定过期
 * - CLOSED：玩家主动离开
 */
public enum SessionStatus {
    ACTIVE,
    KICKED,
    EXPIRED,
    CLOSED
}

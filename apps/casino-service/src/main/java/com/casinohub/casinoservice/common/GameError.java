package com.casinohub.casinoservice.common;

/**
 * 错误分类。BROADCAST_DEGRADED 与 PERSISTENCE_UNAVAILABLE 只记日志，不会导致动作失败。
 */
public enum GameError {
    /** 非法走法，状态未改变 */
    VALIDATION_REJECTED,
    /** 令牌失效（过期、被顶替或已离开） */
    SESSION_EXPIRED,
    /** 被同一玩家的新连接顶替 */
    DUPLICATE_CONNECTION,
    ROOM_FULL,
    ROOM_NOT_FOUND,
    /** 动作在当前房间阶段不允许 */
    ILLEGAL_PHASE,
    /** 分布式广播不可用，只做本地投递 */
    BROADCAST_DEGRADED,
    /** 持久化写入失败，等待重试 */
    PERSISTENCE_UNAVAILABLE
}

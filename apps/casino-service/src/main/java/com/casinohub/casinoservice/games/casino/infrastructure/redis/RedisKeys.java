package com.casinohub.casinoservice.games.casino.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "casino:";

    private RedisKeys() {}

    // ---- 房间记录（最新快照） ----
    public static String room(String roomId) {
        return PFX + "room:" + roomId;
    }

    // ---- 动作日志（Hash：sequence -> 记录） ----
    public static String roomLog(String roomId) {
        return PFX + "room:" + roomId + ":log";
    }

    // ---- 跨实例广播频道 ----
    public static String broadcastChannel(String prefix) {
        return prefix + "room";
    }
}

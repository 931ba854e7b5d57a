package com.casinohub.casinoservice.games.casino.service.dto;

/**
 * 心跳应答载荷。
 *
 * @param playerId      玩家
 * @param lastHeartbeat 本次续期时间（epoch millis）
 * @param expiresAt     不再心跳时的过期时间（epoch millis）
 * @param version       房间当前版本
 * @param checksum      当前版本状态的校验和，客户端用来发现本地状态走偏
 */
public record HeartbeatAck(String playerId, long lastHeartbeat, long expiresAt, long version, String checksum) {
}

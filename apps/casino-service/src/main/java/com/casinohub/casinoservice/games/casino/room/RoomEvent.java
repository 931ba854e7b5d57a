package com.casinohub.casinoservice.games.casino.room;

import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;

/**
 * 被接受动作的广播载荷：日志条目摘要 + 应用后的快照。
 *
 * @param checksum 快照的 {@link StateChecksum}
 */
public record RoomEvent(String actionType, String action, long version, String checksum, CasinoState state) {
}

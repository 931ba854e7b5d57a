package com.casinohub.casinoservice.games.casino.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 持久化用的房间记录：rooms(id, phase, version, state-blob, created_at)。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoomRecord {
    private String roomId;
    /** RoomPhase 名称 */
    private String phase;
    private long version;
    /** 最新快照（JSON） */
    private String stateBlob;
    /** 创建时间（epoch millis） */
    private long createdAt;
}

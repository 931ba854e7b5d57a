package com.casinohub.casinoservice.games.casino.domain.repository;

import com.casinohub.casinoservice.games.casino.domain.dto.RoomRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * 房间仓储接口
 * - 保存房间最新快照，供外部查询与重启后定位房间；
 * - 当前实现为 Redis。
 */
public interface RoomRepository {

    /**
     * 保存（覆盖）房间记录
     * @param ttl 过期时间
     */
    void save(RoomRecord room, Duration ttl);

    Optional<RoomRecord> find(String roomId);

    void delete(String roomId);
}

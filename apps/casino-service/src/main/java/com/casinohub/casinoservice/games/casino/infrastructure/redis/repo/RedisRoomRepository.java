package com.casinohub.casinoservice.games.casino.infrastructure.redis.repo;

import com.alibaba.fastjson2.JSON;
import com.casinohub.casinoservice.games.casino.domain.dto.RoomRecord;
import com.casinohub.casinoservice.games.casino.domain.repository.RoomRepository;
import com.casinohub.casinoservice.games.casino.infrastructure.redis.RedisKeys;
import com.casinohub.casinoservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.Optional;

/**
 * 房间记录的 Redis 仓储实现。
 * - 仅做数据映射与 TTL 管理，不承载业务规则；
 * - 值为 RoomRecord 的 JSON。
 */
@RequiredArgsConstructor
public class RedisRoomRepository implements RoomRepository {

    private final RedisOps ops;

    @Override
    public void save(RoomRecord room, Duration ttl) {
        ops.setEx(RedisKeys.room(room.getRoomId()), JSON.toJSONString(room), ttl);
    }

    @Override
    public Optional<RoomRecord> find(String roomId) {
        String raw = ops.get(RedisKeys.room(roomId));
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(JSON.parseObject(raw, RoomRecord.class));
    }

    @Override
    public void delete(String roomId) {
        ops.del(RedisKeys.room(roomId));
    }
}

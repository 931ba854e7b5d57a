package com.casinohub.casinoservice.games.casino.infrastructure.redis.repo;

import com.alibaba.fastjson2.JSON;
import com.casinohub.casinoservice.games.casino.domain.dto.ActionLogRecord;
import com.casinohub.casinoservice.games.casino.domain.repository.ActionLogRepository;
import com.casinohub.casinoservice.games.casino.infrastructure.redis.RedisKeys;
import com.casinohub.casinoservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 动作日志的 Redis 仓储实现。
 * Hash 结构：field 为序号，value 为记录 JSON；同一序号重复写入只会覆盖。
 */
@RequiredArgsConstructor
public class RedisActionLogRepository implements ActionLogRepository {

    private final RedisOps ops;

    @Override
    public void append(ActionLogRecord record, Duration ttl) {
        String key = RedisKeys.roomLog(record.getRoomId());
        ops.hSet(key, Long.toString(record.getSequence()), JSON.toJSONString(record));
        ops.expire(key, ttl);
    }

    @Override
    public List<ActionLogRecord> findByRoom(String roomId) {
        Map<String, String> raw = ops.hGetAll(RedisKeys.roomLog(roomId));
        List<ActionLogRecord> out = new ArrayList<>(raw.size());
        for (String json : raw.values()) {
            ActionLogRecord r = JSON.parseObject(json, ActionLogRecord.class);
            if (r != null) {
                out.add(r);
            }
        }
        out.sort(Comparator.comparingLong(ActionLogRecord::getSequence));
        return out;
    }

    @Override
    public void truncateAfter(String roomId, long lastSequence) {
        String key = RedisKeys.roomLog(roomId);
        String[] stale = ops.hGetAll(key).keySet().stream()
                .filter(field -> Long.parseLong(field) > lastSequence)
                .toArray(String[]::new);
        if (stale.length > 0) {
            ops.hDel(key, stale);
        }
    }

    @Override
    public void delete(String roomId) {
        ops.del(RedisKeys.roomLog(roomId));
    }
}

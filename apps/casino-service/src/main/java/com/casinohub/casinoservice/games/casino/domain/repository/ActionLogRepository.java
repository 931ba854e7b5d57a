package com.casinohub.casinoservice.games.casino.domain.repository;

import com.casinohub.casinoservice.games.casino.domain.dto.ActionLogRecord;

import java.time.Duration;
import java.util.List;

/**
 * 动作日志仓储接口。按 (roomId, sequence) 幂等写入，重试不会产生重复条目。
 */
public interface ActionLogRepository {

    void append(ActionLogRecord record, Duration ttl);

    /**
     * 房间全部日志，按序号升序
     */
    List<ActionLogRecord> findByRoom(String roomId);

    /**
     * 删除序号大于 lastSequence 的条目（恢复时丢弃断档之后的日志）
     */
    void truncateAfter(String roomId, long lastSequence);

    void delete(String roomId);
}

package com.casinohub.casinoservice.games.casino.service.dto;

import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.log.ActionLogEntry;

import java.util.List;

/**
 * 重连结果：增量日志，或在日志已截断时返回完整快照。
 */
public sealed interface ReconnectResult permits ReconnectResult.Replay, ReconnectResult.Snapshot {

    record Replay(List<ActionLogEntry> entries) implements ReconnectResult {
        public Replay {
            entries = List.copyOf(entries);
        }
    }

    /**
     * @param sequence 快照对应的日志序号
     * @param checksum 快照的校验和
     */
    record Snapshot(CasinoState state, long sequence, String checksum) implements ReconnectResult {
    }
}

package com.casinohub.casinoservice.games.casino.log;

import java.util.List;

/**
 * 增量拉取结果：要么是连续的日志条目，要么提示客户端改用完整快照。
 */
public sealed interface LogReplay permits LogReplay.Entries, LogReplay.SnapshotRequired {

    record Entries(List<ActionLogEntry> entries) implements LogReplay {
        public Entries {
            entries = List.copyOf(entries);
        }
    }

    /**
     * 请求的区间已被截断/归档，或房间日志不在内存中。
     */
    record SnapshotRequired(String reason) implements LogReplay {
    }
}

package com.casinohub.casinoservice.games.casino.log;

import com.casinohub.casinoservice.games.casino.domain.action.GameAction;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按房间维护的动作日志（内存窗口）。
 *
 * - append 只在房间串行锁内调用，序号 = 上一个序号 + 1；
 * - 每个房间只保留最近 retainedEntries 条，更早的条目由持久化仓储保存；
 * - since 请求的起点落在窗口之外时返回 {@link LogReplay.SnapshotRequired}。
 */
@Slf4j
public class ActionLog {

    private final int retainedEntries;
    private final Map<String, RoomLog> logs = new ConcurrentHashMap<>();

    public ActionLog(int retainedEntries) {
        if (retainedEntries < 1) {
            throw new IllegalArgumentException("retainedEntries must be positive");
        }
        this.retainedEntries = retainedEntries;
    }

    /**
     * 追加一条日志。
     *
     * @param resultingVersion 应用该动作后的状态版本
     * @return 新条目
     */
    public ActionLogEntry append(String roomId, GameAction action, long resultingVersion, long timestamp) {
        RoomLog roomLog = logs.computeIfAbsent(roomId, k -> new RoomLog());
        synchronized (roomLog) {
            long seq = roomLog.lastSequence + 1;
            ActionLogEntry entry = ActionLogEntry.of(roomId, seq, action, resultingVersion, timestamp);
            roomLog.entries.addLast(entry);
            roomLog.lastSequence = seq;
            while (roomLog.entries.size() > retainedEntries) {
                roomLog.entries.pollFirst();
            }
            return entry;
        }
    }

    /**
     * 返回序号大于 lastSeenSequence 的全部条目。
     */
    public LogReplay since(String roomId, long lastSeenSequence) {
        RoomLog roomLog = logs.get(roomId);
        if (roomLog == null) {
            return new LogReplay.SnapshotRequired("no log for room " + roomId);
        }
        synchronized (roomLog) {
            if (lastSeenSequence < 0 || lastSeenSequence > roomLog.lastSequence) {
                return new LogReplay.SnapshotRequired("sequence " + lastSeenSequence + " out of range");
            }
            if (lastSeenSequence == roomLog.lastSequence) {
                return new LogReplay.Entries(List.of());
            }
            long firstRetained = roomLog.entries.isEmpty() ? roomLog.lastSequence + 1 : roomLog.entries.peekFirst().sequence();
            if (lastSeenSequence + 1 < firstRetained) {
                return new LogReplay.SnapshotRequired("entries before " + firstRetained + " are archived");
            }
            List<ActionLogEntry> out = new ArrayList<>();
            for (ActionLogEntry e : roomLog.entries) {
                if (e.sequence() > lastSeenSequence) {
                    out.add(e);
                }
            }
            return new LogReplay.Entries(out);
        }
    }

    /**
     * 房间完整日志（从序号 1 开始）；已截断时返回 null。
     */
    public List<ActionLogEntry> fullLog(String roomId) {
        LogReplay replay = since(roomId, 0);
        return replay instanceof LogReplay.Entries entries ? entries.entries() : null;
    }

    public long lastSequence(String roomId) {
        RoomLog roomLog = logs.get(roomId);
        if (roomLog == null) {
            return 0;
        }
        synchronized (roomLog) {
            return roomLog.lastSequence;
        }
    }

    /**
     * 用持久化的条目重建房间日志（房间从仓储恢复时调用）。
     */
    public void restore(String roomId, List<ActionLogEntry> entries) {
        RoomLog roomLog = new RoomLog();
        for (ActionLogEntry e : entries) {
            roomLog.entries.addLast(e);
            roomLog.lastSequence = e.sequence();
        }
        while (roomLog.entries.size() > retainedEntries) {
            roomLog.entries.pollFirst();
        }
        logs.put(roomId, roomLog);
    }

    /**
     * 归档：从内存移除房间日志。
     */
    public void archive(String roomId) {
        if (logs.remove(roomId) != null) {
            log.debug("动作日志已归档: roomId={}", roomId);
        }
    }

    private static final class RoomLog {
        private final Deque<ActionLogEntry> entries = new ArrayDeque<>();
        private long lastSequence;
    }
}

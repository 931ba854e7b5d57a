package com.casinohub.casinoservice.games.casino.room;

import com.alibaba.fastjson2.JSON;
import com.casinohub.casinoservice.games.casino.domain.dto.ActionLogRecord;
import com.casinohub.casinoservice.games.casino.domain.dto.RoomRecord;
import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.domain.repository.ActionLogRepository;
import com.casinohub.casinoservice.games.casino.domain.repository.RoomRepository;
import com.casinohub.casinoservice.games.casino.log.ActionLogEntry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 房间持久化：把已提交的日志条目与最新快照交给 {@link DurableWriteQueue}。
 *
 * 快照写入只保留每个房间最新的一份，重试时写的总是最新版本。
 */
public class RoomPersistence {

    private final RoomRepository rooms;
    private final ActionLogRepository logs;
    private final DurableWriteQueue queue;
    private final Duration roomTtl;
    private final Map<String, RoomRecord> latest = new ConcurrentHashMap<>();

    public RoomPersistence(RoomRepository rooms, ActionLogRepository logs, DurableWriteQueue queue, Duration roomTtl) {
        this.rooms = rooms;
        this.logs = logs;
        this.queue = queue;
        this.roomTtl = roomTtl;
    }

    /** 不做持久化（casino.persistence.mode=none） */
    public static RoomPersistence disabled() {
        return new RoomPersistence(null, null, null, null);
    }

    public boolean enabled() {
        return queue != null;
    }

    public void enqueue(ActionLogEntry entry, CasinoState snapshot, long createdAt) {
        if (!enabled()) {
            return;
        }
        ActionLogRecord record = ActionLogRecord.from(entry);
        queue.submit("log " + entry.roomId() + "#" + entry.sequence(), () -> logs.append(record, roomTtl));
        saveRoom(snapshot, createdAt);
    }

    public void saveRoom(CasinoState snapshot, long createdAt) {
        if (!enabled()) {
            return;
        }
        String roomId = snapshot.getRoomId();
        latest.put(roomId, new RoomRecord(roomId, snapshot.getPhase().name(), snapshot.getVersion(),
                JSON.toJSONString(snapshot), createdAt));
        queue.submit("room " + roomId + "@" + snapshot.getVersion(), () -> {
            RoomRecord r = latest.get(roomId);
            if (r != null) {
                rooms.save(r, roomTtl);
                latest.remove(roomId, r);
            }
        });
    }

    /**
     * 删除房间记录与日志（房间被移除后调用）。
     */
    public void purge(String roomId) {
        if (!enabled()) {
            return;
        }
        latest.remove(roomId);
        queue.submit("purge " + roomId, () -> {
            rooms.delete(roomId);
            logs.delete(roomId);
        });
    }

    public Optional<RoomRecord> loadRoom(String roomId) {
        return enabled() ? rooms.find(roomId) : Optional.empty();
    }

    public List<ActionLogRecord> loadLog(String roomId) {
        return enabled() ? logs.findByRoom(roomId) : List.of();
    }

    /**
     * 同步删除 lastSequence 之后的持久化日志，必须先于该房间之后的任何追加完成。
     */
    public void truncateLog(String roomId, long lastSequence) {
        if (enabled()) {
            logs.truncateAfter(roomId, lastSequence);
        }
    }

    public void flush() {
        if (enabled()) {
            queue.flush();
        }
    }
}

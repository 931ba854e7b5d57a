package com.casinohub.casinoservice.support;

import com.casinohub.casinoservice.games.casino.domain.dto.ActionLogRecord;
import com.casinohub.casinoservice.games.casino.domain.repository.ActionLogRepository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemoryActionLogRepository implements ActionLogRepository {

    private final Map<String, ConcurrentSkipListMap<Long, ActionLogRecord>> logs = new ConcurrentHashMap<>();

    @Override
    public void append(ActionLogRecord record, Duration ttl) {
        logs.computeIfAbsent(record.getRoomId(), k -> new ConcurrentSkipListMap<>()).put(record.getSequence(), record);
    }

    @Override
    public List<ActionLogRecord> findByRoom(String roomId) {
        ConcurrentSkipListMap<Long, ActionLogRecord> log = logs.get(roomId);
        return log == null ? List.of() : new ArrayList<>(log.values());
    }

    @Override
    public void truncateAfter(String roomId, long lastSequence) {
        ConcurrentSkipListMap<Long, ActionLogRecord> log = logs.get(roomId);
        if (log != null) {
            log.tailMap(lastSequence, false).clear();
        }
    }

    @Override
    public void delete(String roomId) {
        logs.remove(roomId);
    }
}

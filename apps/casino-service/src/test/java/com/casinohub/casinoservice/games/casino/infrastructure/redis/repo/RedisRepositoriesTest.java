package com.casinohub.casinoservice.games.casino.infrastructure.redis.repo;

import com.alibaba.fastjson2.JSON;
import com.casinohub.casinoservice.games.casino.domain.action.ActionType;
import com.casinohub.casinoservice.games.casino.domain.action.ReadyAction;
import com.casinohub.casinoservice.games.casino.domain.dto.ActionLogRecord;
import com.casinohub.casinoservice.games.casino.domain.dto.RoomRecord;
import com.casinohub.casinoservice.games.casino.log.ActionLogEntry;
import com.casinohub.casinoservice.infrastructure.redis.RedisOps;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisRepositoriesTest {

    private final RedisOps ops = mock(RedisOps.class);

    @Test
    void roomRecordIsStoredAsJsonWithTtl() {
        RedisRoomRepository repo = new RedisRoomRepository(ops);
        RoomRecord record = new RoomRecord("r1", "ROUND1", 7, "{\"roomId\":\"r1\"}", 1000L);

        repo.save(record, Duration.ofHours(48));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(ops).setEx(eq("casino:room:r1"), json.capture(), eq(Duration.ofHours(48)));
        when(ops.get("casino:room:r1")).thenReturn(json.getValue());
        assertThat(repo.find("r1")).contains(record);
        assertThat(repo.find("r2")).isEmpty();
    }

    @Test
    void logIsKeyedBySequenceAndReadBackInOrder() {
        RedisActionLogRepository repo = new RedisActionLogRepository(ops);
        ActionLogRecord first = record(1);
        ActionLogRecord tenth = record(10);
        ActionLogRecord second = record(2);

        repo.append(second, Duration.ofHours(1));
        verify(ops).hSet("casino:room:r1:log", "2", JSON.toJSONString(second));
        verify(ops).expire("casino:room:r1:log", Duration.ofHours(1));

        when(ops.hGetAll("casino:room:r1:log")).thenReturn(Map.of(
                "10", JSON.toJSONString(tenth), "1", JSON.toJSONString(first), "2", JSON.toJSONString(second)));
        assertThat(repo.findByRoom("r1")).extracting(ActionLogRecord::getSequence).containsExactly(1L, 2L, 10L);

        ActionLogEntry entry = repo.findByRoom("r1").get(0).toEntry();
        assertThat(entry.action()).isEqualTo(new ReadyAction("alice", true, 1L));
        assertThat(entry.actionType()).isEqualTo(ActionType.READY);
    }

    @Test
    void deleteRemovesKeys() {
        new RedisRoomRepository(ops).delete("r1");
        new RedisActionLogRepository(ops).delete("r1");

        verify(ops).del("casino:room:r1");
        verify(ops).del("casino:room:r1:log");
    }

    private static ActionLogRecord record(long seq) {
        ReadyAction action = new ReadyAction("alice", true, seq);
        return new ActionLogRecord("r1", seq, ActionType.READY.name(), ActionType.canonicalPayload(action), seq, 100L * seq);
    }
}

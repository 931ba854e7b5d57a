package com.casinohub.casinoservice.application;

import com.casinohub.casinoservice.games.casino.domain.ai.CasinoMoveAdvisor;
import com.casinohub.casinoservice.games.casino.domain.enums.RoomPhase;
import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.domain.rule.CasinoRules;
import com.casinohub.casinoservice.games.casino.domain.rule.RuleConfig;
import com.casinohub.casinoservice.games.casino.log.ActionLog;
import com.casinohub.casinoservice.games.casino.room.RoomEvent;
import com.casinohub.casinoservice.games.casino.room.RoomPersistence;
import com.casinohub.casinoservice.games.casino.room.RoomStateMachine;
import com.casinohub.casinoservice.games.casino.room.RoomStateStore;
import com.casinohub.casinoservice.games.casino.service.dto.JoinResult;
import com.casinohub.casinoservice.games.casino.service.impl.CasinoGameServiceImpl;
import com.casinohub.casinoservice.platform.broadcast.BroadcastHub;
import com.casinohub.casinoservice.platform.broadcast.LocalBroadcastTransport;
import com.casinohub.casinoservice.platform.transport.MessageType;
import com.casinohub.casinoservice.platform.ws.SessionInvalidatedListener;
import com.casinohub.casinoservice.support.MutableClock;
import com.casinohub.casinoservice.support.RecordingConnection;
import com.casinohub.session.SessionRegistry;
import com.casinohub.session.event.LocalSessionEventNotifier;
import com.casinohub.session.store.InMemorySessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class SessionReaperTest {

    private MutableClock clock;
    private BroadcastHub hub;
    private RoomStateStore store;
    private CasinoGameServiceImpl service;
    private SessionRegistry sessions;
    private ScheduledExecutorService scheduler;
    private SessionReaper reaper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        CasinoRules rules = new CasinoRules(RuleConfig.defaults());
        ActionLog actionLog = new ActionLog(512);
        hub = new BroadcastHub(new LocalBroadcastTransport());
        store = new RoomStateStore(new RoomStateMachine(rules), actionLog, hub, RoomPersistence.disabled(), clock);
        sessions = new SessionRegistry(new InMemorySessionStore(),
                new LocalSessionEventNotifier(List.of(new SessionInvalidatedListener(hub))), clock, Duration.ofHours(24));
        service = new CasinoGameServiceImpl(store, actionLog, sessions, hub, new CasinoMoveAdvisor(rules), clock);
        scheduler = mock(ScheduledExecutorService.class);
        reaper = new SessionReaper(sessions, store, RoomPersistence.disabled(), Duration.ofHours(48),
                scheduler, Duration.ofMinutes(1));
    }

    @Test
    void roomIsAbandonedOnceEverySessionExpired() {
        JoinResult alice = service.createRoom("alice", "Alice");
        JoinResult bob = service.joinRoom(alice.roomId(), "bob", "Bob");
        service.setReady(alice.token(), true);
        service.setReady(bob.token(), true);
        RecordingConnection watcher = new RecordingConnection("w", "observer-token");
        hub.subscribe(alice.roomId(), watcher);

        clock.advance(Duration.ofHours(23));
        service.heartbeat(bob.token());
        clock.advance(Duration.ofHours(2));
        assertThat(reaper.runOnce()).isZero();
        assertThat(store.getSnapshot(alice.roomId()).getPhase()).isEqualTo(RoomPhase.ROUND1);

        clock.advance(Duration.ofHours(23));
        assertThat(reaper.runOnce()).isEqualTo(1);

        assertThat(store.getSnapshot(alice.roomId()).getPhase()).isEqualTo(RoomPhase.ABANDONED);
        assertThat(store.getSnapshot(alice.roomId()).getAbandonReason()).isEqualTo(SessionReaper.ABANDON_REASON);
        assertThat(watcher.received).last().satisfies(env -> {
            assertThat(env.type()).isEqualTo(MessageType.GAME_STATE_SNAPSHOT);
            assertThat(((RoomEvent) env.payload()).state().getPhase()).isEqualTo(RoomPhase.ABANDONED);
        });
        // 已放弃的房间不会重复处理
        assertThat(reaper.runOnce()).isZero();
    }

    @Test
    void playerReseatingDuringScanKeepsRoomAlive() {
        JoinResult alice = service.createRoom("alice", "Alice");
        JoinResult bob = service.joinRoom(alice.roomId(), "bob", "Bob");
        service.setReady(alice.token(), true);
        service.setReady(bob.token(), true);
        clock.advance(Duration.ofHours(25));

        // 第一次查询时 alice 还没有有效会话，查询返回后她立即重新入座
        SessionRegistry racing = spy(sessions);
        doAnswer(inv -> {
            service.joinRoom(alice.roomId(), "alice", "Alice");
            return Optional.empty();
        }).doCallRealMethod().when(racing).liveSession("alice", alice.roomId());
        SessionReaper racingReaper = new SessionReaper(racing, store, RoomPersistence.disabled(),
                Duration.ofHours(48), scheduler, Duration.ofMinutes(1));

        assertThat(racingReaper.runOnce()).isZero();

        CasinoState state = store.getSnapshot(alice.roomId());
        assertThat(state.getPhase()).isEqualTo(RoomPhase.ROUND1);
        assertThat(state.getAbandonReason()).isNull();
        assertThat(sessions.liveSession("alice", alice.roomId())).isPresent();
    }

    @Test
    void abandonedRoomIsEvictedAfterRoomTtl() {
        JoinResult alice = service.createRoom("alice", "Alice");
        clock.advance(Duration.ofHours(25));
        reaper.runOnce();
        assertThat(store.getSnapshot(alice.roomId()).getPhase()).isEqualTo(RoomPhase.ABANDONED);

        clock.advance(Duration.ofHours(49));
        reaper.runOnce();

        assertThat(store.exists(alice.roomId())).isFalse();
    }

    @Test
    void startSchedulesAtInterval() {
        reaper.start();
        reaper.stop();

        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(60_000L), eq(60_000L), eq(TimeUnit.MILLISECONDS));
    }
}

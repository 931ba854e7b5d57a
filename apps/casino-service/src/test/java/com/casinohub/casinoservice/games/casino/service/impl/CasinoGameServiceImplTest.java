package com.casinohub.casinoservice.games.casino.service.impl;

import com.casinohub.casinoservice.common.GameError;
import com.casinohub.casinoservice.common.GameException;
import com.casinohub.casinoservice.games.casino.domain.action.MoveDescriptor;
import com.casinohub.casinoservice.games.casino.domain.ai.CasinoMoveAdvisor;
import com.casinohub.casinoservice.games.casino.domain.enums.RoomPhase;
import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.domain.rule.CasinoRules;
import com.casinohub.casinoservice.games.casino.domain.rule.RejectReason;
import com.casinohub.casinoservice.games.casino.domain.rule.RuleConfig;
import com.casinohub.casinoservice.games.casino.log.ActionLog;
import com.casinohub.casinoservice.games.casino.room.ActionResult;
import com.casinohub.casinoservice.games.casino.room.RoomPersistence;
import com.casinohub.casinoservice.games.casino.room.RoomStateMachine;
import com.casinohub.casinoservice.games.casino.room.RoomStateStore;
import com.casinohub.casinoservice.games.casino.room.StateChecksum;
import com.casinohub.casinoservice.games.casino.service.dto.HeartbeatAck;
import com.casinohub.casinoservice.games.casino.service.dto.JoinResult;
import com.casinohub.casinoservice.games.casino.service.dto.ReconnectResult;
import com.casinohub.casinoservice.games.casino.service.dto.RejectionNotice;
import com.casinohub.casinoservice.platform.broadcast.BroadcastHub;
import com.casinohub.casinoservice.platform.broadcast.LocalBroadcastTransport;
import com.casinohub.casinoservice.platform.transport.Envelope;
import com.casinohub.casinoservice.platform.transport.MessageType;
import com.casinohub.casinoservice.platform.ws.SessionInvalidatedListener;
import com.casinohub.casinoservice.support.Moves;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CasinoGameServiceImplTest {

    private final RoomStateMachine machine = new RoomStateMachine(new CasinoRules(RuleConfig.defaults()));

    private MutableClock clock;
    private ActionLog actionLog;
    private BroadcastHub hub;
    private RoomStateStore store;
    private SessionRegistry sessions;
    private CasinoGameServiceImpl service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        actionLog = new ActionLog(512);
        hub = new BroadcastHub(new LocalBroadcastTransport());
        store = new RoomStateStore(machine, actionLog, hub, RoomPersistence.disabled(), clock);
        LocalSessionEventNotifier notifier = new LocalSessionEventNotifier(List.of(new SessionInvalidatedListener(hub)));
        sessions = new SessionRegistry(new InMemorySessionStore(), notifier, clock, Duration.ofHours(24));
        service = new CasinoGameServiceImpl(store, actionLog, sessions, hub,
                new CasinoMoveAdvisor(machine.rules()), clock);
    }

    @Test
    void playersTakeSeatsInJoinOrderAndThirdIsTurnedAway() {
        JoinResult alice = service.createRoom("alice", "Alice");
        JoinResult bob = service.joinRoom(alice.roomId(), "bob", "Bob");

        assertThat(alice.seat()).isZero();
        assertThat(alice.roomId()).hasSize(12);
        assertThat(bob.seat()).isEqualTo(1);
        assertThat(bob.token()).isNotEqualTo(alice.token());
        assertThat(bob.state().getPlayers()).hasSize(2);

        assertThatThrownBy(() -> service.joinRoom(alice.roomId(), "carol", "Carol"))
                .isInstanceOfSatisfying(GameException.class, e -> assertThat(e.getError()).isEqualTo(GameError.ROOM_FULL));
        assertThat(sessions.liveSession("carol", alice.roomId())).isEmpty();
        assertThatThrownBy(() -> service.joinRoom("missing", "carol", "Carol"))
                .isInstanceOfSatisfying(GameException.class, e -> assertThat(e.getError()).isEqualTo(GameError.ROOM_NOT_FOUND));
    }

    @Test
    void gameStartsWhenBothAreReady() {
        Table t = startTable();

        CasinoState s = service.getStateByToken(t.bob.token());
        assertThat(s.getPhase()).isEqualTo(RoomPhase.ROUND1);
        assertThat(s.getVersion()).isEqualTo(4);
        assertThat(s.player(0).getHand()).hasSize(4);
    }

    @Test
    void thirdPlayerJoiningGameInProgressGetsRoomFull() {
        Table t = startTable();

        assertThatThrownBy(() -> service.joinRoom(t.roomId(), "carol", "Carol"))
                .isInstanceOfSatisfying(GameException.class, e -> assertThat(e.getError()).isEqualTo(GameError.ROOM_FULL));
        assertThat(sessions.liveSession("carol", t.roomId())).isEmpty();
        assertThat(service.getState(t.roomId()).getVersion()).isEqualTo(4);
    }

    @Test
    void attachDeliversSnapshotThenBroadcasts() {
        Table t = startTable();
        RecordingConnection aliceConn = new RecordingConnection("c-a", t.alice.token());
        RecordingConnection bobConn = new RecordingConnection("c-b", t.bob.token());

        Envelope<CasinoState> first = service.attach(t.alice.token(), aliceConn);
        service.attach(t.bob.token(), bobConn);
        assertThat(first.type()).isEqualTo(MessageType.GAME_STATE_SNAPSHOT);
        assertThat(first.sequence()).isEqualTo(4);

        playCurrentTurn(t);

        assertThat(aliceConn.received).extracting(Envelope::type)
                .containsExactly(MessageType.GAME_STATE_SNAPSHOT, MessageType.ACTION_ACCEPTED);
        assertThat(bobConn.sequences()).containsExactly(4L, 5L);

        service.detach(t.roomId(), "c-b");
        playCurrentTurn(t);
        assertThat(bobConn.sequences()).containsExactly(4L, 5L);
    }

    @Test
    void rejectionIsSentOnlyToSubmitter() {
        Table t = startTable();
        RecordingConnection aliceConn = new RecordingConnection("c-a", t.alice.token());
        RecordingConnection bobConn = new RecordingConnection("c-b", t.bob.token());
        service.attach(t.alice.token(), aliceConn);
        service.attach(t.bob.token(), bobConn);
        String bobCard = service.getState(t.roomId()).player(1).getHand().get(0).id();

        ActionResult r = service.submitMove(t.bob.token(), MoveDescriptor.trail(bobCard));

        assertThat(r).isInstanceOfSatisfying(ActionResult.Rejected.class,
                rej -> assertThat(rej.reason()).isEqualTo(RejectReason.NOT_YOUR_TURN));
        assertThat(bobConn.received).last().satisfies(env -> {
            assertThat(env.type()).isEqualTo(MessageType.ACTION_REJECTED);
            assertThat(env.payload()).isEqualTo(new RejectionNotice(GameError.VALIDATION_REJECTED,
                    "NOT_YOUR_TURN", "not your turn"));
        });
        assertThat(aliceConn.received).hasSize(1);
        assertThat(service.getState(t.roomId()).getVersion()).isEqualTo(4);
    }

    @Test
    void malformedMoveIsRejectedBeforeTheRules() {
        Table t = startTable();

        ActionResult r = service.submitMove(t.alice.token(), new MoveDescriptor());
        ActionResult nullMove = service.submitMove(t.alice.token(), null);

        assertThat(r).isInstanceOfSatisfying(ActionResult.Rejected.class, rej -> {
            assertThat(rej.reason()).isEqualTo(RejectReason.MALFORMED_MOVE);
            assertThat(rej.message()).startsWith("malformed move");
        });
        assertThat(nullMove.accepted()).isFalse();
    }

    @Test
    void reconnectReplaysMissedEntries() {
        Table t = startTable();
        CasinoState seen = service.getStateByToken(t.alice.token());
        long lastSeen = seen.getVersion();

        for (int i = 0; i < 3; i++) {
            playCurrentTurn(t);
        }

        ReconnectResult r = service.reconnect(t.alice.token(), lastSeen);
        assertThat(r).isInstanceOfSatisfying(ReconnectResult.Replay.class, replay -> {
            assertThat(replay.entries()).extracting(e -> e.sequence()).containsExactly(5L, 6L, 7L);
            assertThat(machine.replay(seen, replay.entries())).isEqualTo(service.getState(t.roomId()));
        });

        ReconnectResult upToDate = service.reconnect(t.alice.token(), 7);
        assertThat(upToDate).isInstanceOfSatisfying(ReconnectResult.Replay.class,
                replay -> assertThat(replay.entries()).isEmpty());

        ReconnectResult ahead = service.reconnect(t.alice.token(), 99);
        assertThat(ahead).isInstanceOfSatisfying(ReconnectResult.Snapshot.class, snap -> {
            assertThat(snap.sequence()).isEqualTo(7);
            assertThat(snap.state()).isEqualTo(service.getState(t.roomId()));
            assertThat(snap.checksum()).isEqualTo(StateChecksum.of(service.getState(t.roomId())));
        });
    }

    @Test
    void expiredSessionIsRejectedWhileOpponentStaysValid() {
        Table t = startTable();
        RecordingConnection aliceConn = new RecordingConnection("c-a", t.alice.token());
        service.attach(t.alice.token(), aliceConn);
        String aliceCard = service.getState(t.roomId()).player(0).getHand().get(0).id();

        clock.advance(Duration.ofHours(23));
        service.heartbeat(t.bob.token());
        clock.advance(Duration.ofHours(1).plusMillis(1));

        ActionResult r = service.submitMove(t.alice.token(), MoveDescriptor.trail(aliceCard));

        assertThat(r).isInstanceOfSatisfying(ActionResult.Rejected.class, rej -> {
            assertThat(rej.error()).isEqualTo(GameError.SESSION_EXPIRED);
            assertThat(rej.reason()).isEqualTo(RejectReason.SESSION_EXPIRED);
        });
        assertThat(aliceConn.closedReason).isEqualTo("session expired");
        assertThat(service.getStateByToken(t.bob.token()).getPhase()).isEqualTo(RoomPhase.ROUND1);
        assertThat(service.getState(t.roomId()).getVersion()).isEqualTo(4);
        assertThatThrownBy(() -> service.heartbeat(t.alice.token()))
                .isInstanceOfSatisfying(GameException.class, e -> assertThat(e.getError()).isEqualTo(GameError.SESSION_EXPIRED));
    }

    @Test
    void heartbeatExactlyAtTtlStillCounts() {
        Table t = startTable();
        clock.advance(Duration.ofHours(24));

        Envelope<HeartbeatAck> ack = service.heartbeat(t.alice.token());

        assertThat(ack.type()).isEqualTo(MessageType.HEARTBEAT_ACK);
        assertThat(ack.sequence()).isEqualTo(4);
        assertThat(ack.payload().playerId()).isEqualTo("alice");
        assertThat(ack.payload().expiresAt() - ack.payload().lastHeartbeat()).isEqualTo(Duration.ofHours(24).toMillis());
        assertThat(ack.payload().lastHeartbeat()).isEqualTo(clock.millis());
        assertThat(ack.payload().version()).isEqualTo(4);
        assertThat(ack.payload().checksum()).isEqualTo(StateChecksum.of(service.getState(t.roomId())));
    }

    @Test
    void secondJoinSupersedesFirstConnection() {
        Table t = startTable();
        RecordingConnection first = new RecordingConnection("c-1", t.alice.token());
        service.attach(t.alice.token(), first);

        JoinResult again = service.joinRoom(t.roomId(), "alice", "Alice");

        assertThat(again.seat()).isZero();
        assertThat(again.token()).isNotEqualTo(t.alice.token());
        assertThat(first.closedReason).isEqualTo("duplicate connection");
        assertThat(hub.connectionCount(t.roomId())).isZero();
        String card = again.state().player(0).getHand().get(0).id();
        assertThat(service.submitMove(t.alice.token(), MoveDescriptor.trail(card)))
                .isInstanceOfSatisfying(ActionResult.Rejected.class,
                        rej -> assertThat(rej.reason()).isEqualTo(RejectReason.SESSION_EXPIRED));
        assertThat(service.submitMove(again.token(), MoveDescriptor.trail(card)).accepted()).isTrue();
    }

    @Test
    void leavingWhileWaitingFreesTheSeat() {
        JoinResult alice = service.createRoom("alice", "Alice");
        JoinResult bob = service.joinRoom(alice.roomId(), "bob", "Bob");

        service.leave(bob.token());

        assertThat(service.getState(alice.roomId()).getPlayers()).hasSize(1);
        JoinResult carol = service.joinRoom(alice.roomId(), "carol", "Carol");
        assertThat(carol.seat()).isEqualTo(1);
        assertThatThrownBy(() -> service.getStateByToken(bob.token())).isInstanceOf(GameException.class);
    }

    @Test
    void suggestionOnlyForPlayerToMove() {
        Table t = startTable();

        assertThat(service.suggestMove(t.bob.token())).isNull();
        assertThat(service.submitMove(t.alice.token(), Moves.describe(service.suggestMove(t.alice.token()))).accepted())
                .isTrue();
    }

    /* ========== helpers ========== */

    private record Table(JoinResult alice, JoinResult bob) {
        String roomId() {
            return alice.roomId();
        }
    }

    private Table startTable() {
        JoinResult alice = service.createRoom("alice", "Alice");
        JoinResult bob = service.joinRoom(alice.roomId(), "bob", "Bob");
        assertThat(service.setReady(alice.token(), true).accepted()).isTrue();
        assertThat(service.setReady(bob.token(), true).accepted()).isTrue();
        return new Table(alice, bob);
    }

    private void playCurrentTurn(Table t) {
        CasinoState s = service.getState(t.roomId());
        String token = s.getCurrentSeat() == 0 ? t.alice.token() : t.bob.token();
        ActionResult r = service.submitMove(token, Moves.describe(service.suggestMove(token)));
        assertThat(r.accepted()).isTrue();
    }
}

package com.casinohub.casinoservice.games.casino.room;

import com.casinohub.casinoservice.games.casino.domain.action.AbandonAction;
import com.casinohub.casinoservice.games.casino.domain.action.GameAction;
import com.casinohub.casinoservice.games.casino.domain.action.JoinAction;
import com.casinohub.casinoservice.games.casino.domain.action.LeaveAction;
import com.casinohub.casinoservice.games.casino.domain.action.ReadyAction;
import com.casinohub.casinoservice.games.casino.domain.action.TrailMove;
import com.casinohub.casinoservice.games.casino.domain.enums.RoomPhase;
import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.domain.model.PlayerState;
import com.casinohub.casinoservice.games.casino.domain.rule.CasinoRules;
import com.casinohub.casinoservice.games.casino.domain.rule.RejectReason;
import com.casinohub.casinoservice.games.casino.domain.rule.RuleConfig;
import com.casinohub.casinoservice.games.casino.log.ActionLog;
import com.casinohub.casinoservice.platform.transport.MessageType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomStateMachineTest {

    private final RoomStateMachine machine = new RoomStateMachine(new CasinoRules(RuleConfig.defaults()));

    @Test
    void joinFillsSeatsInOrderUntilFull() {
        CasinoState s = CasinoState.empty("r1");

        Transition a = machine.apply(s, new JoinAction("alice", "Alice"));
        assertThat(a.accepted()).isTrue();
        assertThat(a.messageType()).isEqualTo(MessageType.PLAYER_JOINED);
        assertThat(a.state().getVersion()).isEqualTo(1);
        assertThat(machine.apply(a.state(), new JoinAction("alice", "Alice")).reason())
                .isEqualTo(RejectReason.ALREADY_SEATED);

        Transition b = machine.apply(a.state(), new JoinAction("bob", "Bob"));
        assertThat(b.state().seatOf("bob")).isEqualTo(1);
        assertThat(machine.apply(b.state(), new JoinAction("carol", "Carol")).reason())
                .isEqualTo(RejectReason.ROOM_FULL);
        // 入参不被修改
        assertThat(s.getPlayers()).isEmpty();
    }

    @Test
    void dealHappensWhenSecondPlayerIsReady() {
        CasinoState s = seated();

        Transition first = machine.apply(s, new ReadyAction("alice", true, 99L));
        assertThat(first.state().getPhase()).isEqualTo(RoomPhase.WAITING);
        assertThat(first.messageType()).isEqualTo(MessageType.PLAYER_READY);

        Transition second = machine.apply(first.state(), new ReadyAction("bob", true, 5L));
        CasinoState dealt = second.state();
        assertThat(dealt.getPhase()).isEqualTo(RoomPhase.ROUND1);
        assertThat(dealt.getShuffleSeed()).isEqualTo(5L);
        assertThat(dealt.getVersion()).isEqualTo(4);
        assertThat(dealt.cardsInPlay()).isEqualTo(52);
        assertThat(dealt.getCurrentSeat()).isZero();
    }

    @Test
    void readyRequiresSeatAndLeaveOnlyWhileWaiting() {
        CasinoState s = seated();
        assertThat(machine.apply(s, new ReadyAction("mallory", true, 1L)).reason())
                .isEqualTo(RejectReason.PLAYER_NOT_SEATED);

        Transition left = machine.apply(s, new LeaveAction("alice"));
        assertThat(left.accepted()).isTrue();
        assertThat(left.state().getPlayers()).extracting(PlayerState::getPlayerId).containsExactly("bob");

        CasinoState playing = started();
        assertThat(machine.apply(playing, new LeaveAction("alice")).reason()).isEqualTo(RejectReason.WRONG_PHASE);
    }

    @Test
    void thirdPlayerIsTurnedAwayAsFullInEveryPhase() {
        CasinoState playing = started();
        assertThat(machine.apply(playing, new JoinAction("carol", "Carol")).reason()).isEqualTo(RejectReason.ROOM_FULL);
        assertThat(machine.apply(playing, new JoinAction("alice", "Alice")).reason())
                .isEqualTo(RejectReason.ALREADY_SEATED);

        CasinoState abandoned = machine.apply(playing, new AbandonAction("gone")).state();
        assertThat(machine.apply(abandoned, new JoinAction("carol", "Carol")).reason()).isEqualTo(RejectReason.ROOM_FULL);

        // 只有一人的已结束房间：仍按阶段拒绝
        CasinoState lonely = machine.apply(machine.apply(CasinoState.empty("r2"), new JoinAction("alice", "Alice")).state(),
                new AbandonAction("gone")).state();
        assertThat(machine.apply(lonely, new JoinAction("carol", "Carol")).reason()).isEqualTo(RejectReason.WRONG_PHASE);
    }

    @Test
    void movesAreCheckedForSeatAndTurn() {
        CasinoState playing = started();
        String bobCard = playing.player(1).getHand().get(0).id();
        String aliceCard = playing.player(0).getHand().get(0).id();

        assertThat(machine.apply(seated(), new TrailMove("alice", aliceCard)).reason())
                .isEqualTo(RejectReason.WRONG_PHASE);
        assertThat(machine.apply(playing, new TrailMove("mallory", aliceCard)).reason())
                .isEqualTo(RejectReason.PLAYER_NOT_SEATED);
        assertThat(machine.apply(playing, new TrailMove("bob", bobCard)).reason())
                .isEqualTo(RejectReason.NOT_YOUR_TURN);
        assertThat(machine.apply(playing, new TrailMove("alice", bobCard)).reason())
                .isEqualTo(RejectReason.CARD_NOT_IN_HAND);

        Transition ok = machine.apply(playing, new TrailMove("alice", aliceCard));
        assertThat(ok.messageType()).isEqualTo(MessageType.ACTION_ACCEPTED);
        assertThat(ok.state().getVersion()).isEqualTo(playing.getVersion() + 1);
        assertThat(ok.state().getCurrentSeat()).isEqualTo(1);
    }

    @Test
    void abandonedRoomRejectsEverything() {
        Transition t = machine.apply(started(), new AbandonAction("all sessions expired"));
        CasinoState abandoned = t.state();

        assertThat(abandoned.getPhase()).isEqualTo(RoomPhase.ABANDONED);
        assertThat(abandoned.getAbandonReason()).isEqualTo("all sessions expired");
        assertThat(machine.apply(abandoned, new AbandonAction("again")).reason()).isEqualTo(RejectReason.WRONG_PHASE);
    }

    @Test
    void replayRebuildsStateAndFailsOnInconsistentLog() {
        ActionLog log = new ActionLog(16);
        CasinoState s = CasinoState.empty("r1");
        List<GameAction> actions = List.of(new JoinAction("alice", "Alice"), new JoinAction("bob", "Bob"),
                new ReadyAction("alice", true, 0L), new ReadyAction("bob", true, 77L));
        for (GameAction action : actions) {
            s = machine.apply(s, action).state();
            log.append("r1", action, s.getVersion(), 0L);
        }

        assertThat(machine.replay("r1", log.fullLog("r1"))).isEqualTo(s);

        log.append("r1", new JoinAction("carol", "Carol"), 5, 0L);
        assertThatThrownBy(() -> machine.replay("r1", log.fullLog("r1")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("entry 5");
    }

    private CasinoState seated() {
        CasinoState s = machine.apply(CasinoState.empty("r1"), new JoinAction("alice", "Alice")).state();
        return machine.apply(s, new JoinAction("bob", "Bob")).state();
    }

    private CasinoState started() {
        CasinoState s = machine.apply(seated(), new ReadyAction("alice", true, 0L)).state();
        return machine.apply(s, new ReadyAction("bob", true, 2024L)).state();
    }
}

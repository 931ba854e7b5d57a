package com.casinohub.casinoservice.games.casino.room;

import com.casinohub.casinoservice.games.casino.domain.action.AbandonAction;
import com.casinohub.casinoservice.games.casino.domain.action.GameAction;
import com.casinohub.casinoservice.games.casino.domain.action.JoinAction;
import com.casinohub.casinoservice.games.casino.domain.action.LeaveAction;
import com.casinohub.casinoservice.games.casino.domain.action.Move;
import com.casinohub.casinoservice.games.casino.domain.action.ReadyAction;
import com.casinohub.casinoservice.games.casino.domain.enums.RoomPhase;
import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.domain.model.PlayerState;
import com.casinohub.casinoservice.games.casino.domain.rule.CasinoRules;
import com.casinohub.casinoservice.games.casino.domain.rule.RejectReason;
import com.casinohub.casinoservice.games.casino.log.ActionLogEntry;
import com.casinohub.casinoservice.platform.transport.MessageType;

import java.util.List;
import java.util.Optional;

/**
 * 房间状态机（纯函数，无锁、无 IO）。
 *
 * WAITING → DEALING → ROUND1 → ROUND2 → FINISHED，ABANDONED 可由任意未结束阶段进入。
 * DEALING 在双方都准备好的同一个动作内完成发牌，不会停留。
 *
 * 接受的动作使版本号 +1；被拒绝时输入状态保持不变。
 */
public class RoomStateMachine {

    /** 每个房间的座位数 */
    public static final int SEATS = 2;

    private final CasinoRules rules;

    public RoomStateMachine(CasinoRules rules) {
        this.rules = rules;
    }

    public CasinoRules rules() {
        return rules;
    }

    public Transition apply(CasinoState current, GameAction action) {
        if (current.getPhase().terminal() && !(action instanceof JoinAction)) {
            return Transition.reject(RejectReason.WRONG_PHASE);
        }
        Transition t;
        if (action instanceof JoinAction join) {
            t = join(current, join);
        } else if (action instanceof ReadyAction ready) {
            t = ready(current, ready);
        } else if (action instanceof LeaveAction leave) {
            t = leave(current, leave);
        } else if (action instanceof AbandonAction abandon) {
            t = abandon(current, abandon);
        } else if (action instanceof Move move) {
            t = move(current, move);
        } else {
            throw new IllegalArgumentException("unsupported action: " + action);
        }
        if (t.accepted()) {
            t.state().setVersion(current.getVersion() + 1);
        }
        return t;
    }

    /**
     * 从空房间依次重放日志条目。
     *
     * @throws IllegalStateException 某条日志在重放时被拒绝（日志与规则不一致）
     */
    public CasinoState replay(String roomId, List<ActionLogEntry> entries) {
        return replay(CasinoState.empty(roomId), entries);
    }

    public CasinoState replay(CasinoState base, List<ActionLogEntry> entries) {
        CasinoState state = base.copy();
        for (ActionLogEntry e : entries) {
            Transition t = apply(state, e.action());
            if (!t.accepted()) {
                throw new IllegalStateException("log entry " + e.sequence() + " of room " + e.roomId()
                        + " rejected on replay: " + t.reason());
            }
            state = t.state();
        }
        return state;
    }

    /* =========================
     * 各动作
     * ========================= */

    private Transition join(CasinoState current, JoinAction a) {
        if (current.seatOf(a.playerId()) >= 0) {
            return Transition.reject(RejectReason.ALREADY_SEATED);
        }
        // 满员优先于阶段判断，对局中或已结束的满员房间都报 ROOM_FULL
        if (current.getPlayers().size() >= SEATS) {
            return Transition.reject(RejectReason.ROOM_FULL);
        }
        if (current.getPhase() != RoomPhase.WAITING) {
            return Transition.reject(RejectReason.WRONG_PHASE);
        }
        CasinoState next = current.copy();
        next.getPlayers().add(new PlayerState(a.playerId(), a.name()));
        next.setLastAction(a.playerId() + " joined seat " + (next.getPlayers().size() - 1));
        return Transition.ok(next, MessageType.PLAYER_JOINED);
    }

    private Transition ready(CasinoState current, ReadyAction a) {
        if (current.getPhase() != RoomPhase.WAITING) {
            return Transition.reject(RejectReason.WRONG_PHASE);
        }
        int seat = current.seatOf(a.playerId());
        if (seat < 0) {
            return Transition.reject(RejectReason.PLAYER_NOT_SEATED);
        }
        CasinoState next = current.copy();
        next.player(seat).setReady(a.ready());
        next.setLastAction(a.playerId() + (a.ready() ? " is ready" : " is not ready"));
        if (next.getPlayers().size() == SEATS && next.getPlayers().stream().allMatch(PlayerState::isReady)) {
            next = rules.dealInitial(next, a.shuffleSeed());
            next.setLastAction("round 1 dealt");
        }
        return Transition.ok(next, MessageType.PLAYER_READY);
    }

    private Transition leave(CasinoState current, LeaveAction a) {
        if (current.getPhase() != RoomPhase.WAITING) {
            return Transition.reject(RejectReason.WRONG_PHASE);
        }
        int seat = current.seatOf(a.playerId());
        if (seat < 0) {
            return Transition.reject(RejectReason.PLAYER_NOT_SEATED);
        }
        CasinoState next = current.copy();
        next.getPlayers().remove(seat);
        next.setLastAction(a.playerId() + " left");
        return Transition.ok(next, MessageType.ACTION_ACCEPTED);
    }

    private Transition abandon(CasinoState current, AbandonAction a) {
        CasinoState next = current.copy();
        next.setPhase(RoomPhase.ABANDONED);
        next.setAbandonReason(a.reason());
        next.setLastAction("room abandoned");
        return Transition.ok(next, MessageType.GAME_STATE_SNAPSHOT);
    }

    private Transition move(CasinoState current, Move m) {
        if (!current.getPhase().inPlay()) {
            return Transition.reject(RejectReason.WRONG_PHASE);
        }
        int seat = current.seatOf(m.playerId());
        if (seat < 0) {
            return Transition.reject(RejectReason.PLAYER_NOT_SEATED);
        }
        if (seat != current.getCurrentSeat()) {
            return Transition.reject(RejectReason.NOT_YOUR_TURN);
        }
        Optional<RejectReason> invalid = rules.validate(current, seat, m);
        if (invalid.isPresent()) {
            return Transition.reject(invalid.get());
        }
        return Transition.ok(rules.execute(current, seat, m), MessageType.ACTION_ACCEPTED);
    }
}

package com.casinohub.casinoservice.games.casino.service.impl;

import com.casinohub.casinoservice.common.GameError;
import com.casinohub.casinoservice.common.GameException;
import com.casinohub.casinoservice.games.casino.domain.action.JoinAction;
import com.casinohub.casinoservice.games.casino.domain.action.LeaveAction;
import com.casinohub.casinoservice.games.casino.domain.action.Move;
import com.casinohub.casinoservice.games.casino.domain.action.MoveDescriptor;
import com.casinohub.casinoservice.games.casino.domain.action.ReadyAction;
import com.casinohub.casinoservice.games.casino.domain.ai.CasinoMoveAdvisor;
import com.casinohub.casinoservice.games.casino.domain.enums.RoomPhase;
import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.domain.rule.RejectReason;
import com.casinohub.casinoservice.games.casino.log.ActionLog;
import com.casinohub.casinoservice.games.casino.log.LogReplay;
import com.casinohub.casinoservice.games.casino.room.ActionResult;
import com.casinohub.casinoservice.games.casino.room.RoomStateStore;
import com.casinohub.casinoservice.games.casino.room.StateChecksum;
import com.casinohub.casinoservice.games.casino.service.CasinoGameService;
import com.casinohub.casinoservice.games.casino.service.dto.HeartbeatAck;
import com.casinohub.casinoservice.games.casino.service.dto.JoinResult;
import com.casinohub.casinoservice.games.casino.service.dto.ReconnectResult;
import com.casinohub.casinoservice.games.casino.service.dto.RejectionNotice;
import com.casinohub.casinoservice.platform.broadcast.BroadcastHub;
import com.casinohub.casinoservice.platform.broadcast.RoomConnection;
import com.casinohub.casinoservice.platform.transport.Envelope;
import com.casinohub.casinoservice.platform.transport.MessageType;
import com.casinohub.session.SessionExpiredException;
import com.casinohub.session.SessionRegistry;
import com.casinohub.session.model.GameSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.UUID;

@Slf4j
@RequiredArgsConstructor
public class CasinoGameServiceImpl implements CasinoGameService {

    /** 走法提示的计算预算 */
    private static final long SUGGEST_BUDGET_MS = 200;

    private final RoomStateStore store;
    private final ActionLog actionLog;
    private final SessionRegistry sessions;
    private final BroadcastHub hub;
    private final CasinoMoveAdvisor advisor;
    private final Clock clock;

    // 洗牌种子在提交前确定，写入 READY 动作
    private final SecureRandom seedRnd = new SecureRandom();

    @Override
    public JoinResult createRoom(String playerId, String name) {
        requireText(playerId, "playerId");
        String roomId = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        store.createRoom(roomId);
        return seat(roomId, playerId, name);
    }

    @Override
    public JoinResult joinRoom(String roomId, String playerId, String name) {
        requireText(playerId, "playerId");
        CasinoState state = store.getSnapshot(roomId);
        int seat = state.seatOf(playerId);
        if (seat >= 0) {
            return reseat(roomId, playerId, seat);
        }
        return seat(roomId, playerId, name);
    }

    @Override
    public ActionResult setReady(String token, boolean ready) {
        GameSession s = resolveOrThrow(token);
        ActionResult result = store.submitAction(s.getRoomId(), new ReadyAction(s.getPlayerId(), ready, seedRnd.nextLong()));
        if (result instanceof ActionResult.Rejected rejected) {
            notifyRejected(s, rejected);
        }
        return result;
    }

    @Override
    public ActionResult submitMove(String token, MoveDescriptor descriptor) {
        GameSession s;
        try {
            s = sessions.resolve(token);
        } catch (SessionExpiredException e) {
            log.debug("令牌失效，拒绝走法: {}", e.getMessage());
            return ActionResult.Rejected.of(RejectReason.SESSION_EXPIRED);
        }
        Move move;
        try {
            if (descriptor == null) {
                throw new IllegalArgumentException("move is required");
            }
            move = descriptor.toMove(s.getPlayerId());
        } catch (IllegalArgumentException e) {
            ActionResult.Rejected rejected = new ActionResult.Rejected(GameError.VALIDATION_REJECTED,
                    RejectReason.MALFORMED_MOVE, RejectReason.MALFORMED_MOVE.message() + ": " + e.getMessage());
            notifyRejected(s, rejected);
            return rejected;
        }
        ActionResult result = store.submitAction(s.getRoomId(), move);
        if (result instanceof ActionResult.Rejected rejected) {
            notifyRejected(s, rejected);
        }
        return result;
    }

    @Override
    public CasinoState getState(String roomId) {
        return store.getSnapshot(roomId);
    }

    @Override
    public CasinoState getStateByToken(String token) {
        return store.getSnapshot(resolveOrThrow(token).getRoomId());
    }

    @Override
    public ReconnectResult reconnect(String token, long lastSeenSequence) {
        GameSession s = heartbeatOrThrow(token);
        // 先取快照，内存中没有的房间会在这里恢复（连同日志窗口）
        CasinoState snapshot = store.getSnapshot(s.getRoomId());
        LogReplay replay = actionLog.since(s.getRoomId(), lastSeenSequence);
        if (replay instanceof LogReplay.Entries entries) {
            log.debug("重连增量回放: roomId={}, from={}, count={}", s.getRoomId(), lastSeenSequence, entries.entries().size());
            return new ReconnectResult.Replay(entries.entries());
        }
        log.debug("重连需要完整快照: roomId={}, reason={}", s.getRoomId(), ((LogReplay.SnapshotRequired) replay).reason());
        return new ReconnectResult.Snapshot(snapshot, snapshot.getVersion(), StateChecksum.of(snapshot));
    }

    @Override
    public Envelope<HeartbeatAck> heartbeat(String token) {
        GameSession s = heartbeatOrThrow(token);
        long last = s.getLastHeartbeat();
        CasinoState state = store.getSnapshot(s.getRoomId());
        HeartbeatAck ack = new HeartbeatAck(s.getPlayerId(), last, last + sessions.getTtl().toMillis(),
                state.getVersion(), StateChecksum.of(state));
        return Envelope.of(MessageType.HEARTBEAT_ACK, s.getRoomId(), state.getVersion(), ack, clock.millis());
    }

    @Override
    public void leave(String token) {
        GameSession s = resolveOrThrow(token);
        sessions.close(token);
        if (!store.exists(s.getRoomId())) {
            return;
        }
        if (store.getSnapshot(s.getRoomId()).getPhase() == RoomPhase.WAITING) {
            ActionResult result = store.submitAction(s.getRoomId(), new LeaveAction(s.getPlayerId()));
            if (result instanceof ActionResult.Rejected rejected) {
                // 与开局并发时座位保留，由回收器处理
                log.debug("离开时未能让出座位: roomId={}, reason={}", s.getRoomId(), rejected.reason());
            }
        }
    }

    @Override
    public Envelope<CasinoState> attach(String token, RoomConnection connection) {
        GameSession s = resolveOrThrow(token);
        hub.subscribe(s.getRoomId(), connection);
        CasinoState snapshot = store.getSnapshot(s.getRoomId());
        Envelope<CasinoState> env = Envelope.of(MessageType.GAME_STATE_SNAPSHOT, s.getRoomId(),
                snapshot.getVersion(), snapshot, clock.millis());
        connection.deliver(env);
        log.debug("连接已订阅房间: roomId={}, playerId={}, connectionId={}",
                s.getRoomId(), s.getPlayerId(), connection.connectionId());
        return env;
    }

    @Override
    public void detach(String roomId, String connectionId) {
        hub.unsubscribe(roomId, connectionId);
    }

    @Override
    public Move suggestMove(String token) {
        GameSession s = resolveOrThrow(token);
        CasinoState state = store.getSnapshot(s.getRoomId());
        if (!state.getPhase().inPlay() || state.seatOf(s.getPlayerId()) != state.getCurrentSeat()) {
            return null;
        }
        return advisor.suggest(state, SUGGEST_BUDGET_MS);
    }

    /* =========================
     * 内部工具
     * ========================= */

    /**
     * 新玩家入座：先签发会话再提交 JOIN，回收器不会把刚入座的房间判为无人。
     */
    private JoinResult seat(String roomId, String playerId, String name) {
        GameSession session = sessions.createSession(playerId, roomId);
        ActionResult result = store.submitAction(roomId, new JoinAction(playerId, StringUtils.defaultIfBlank(name, playerId)));
        if (result instanceof ActionResult.Accepted accepted) {
            int seat = accepted.snapshot().seatOf(playerId);
            log.info("玩家入座: roomId={}, playerId={}, seat={}", roomId, playerId, seat);
            return new JoinResult(roomId, session.getToken(), seat, accepted.snapshot());
        }
        ActionResult.Rejected rejected = (ActionResult.Rejected) result;
        if (rejected.reason() == RejectReason.ALREADY_SEATED) {
            // 同一玩家并发入座，新会话已顶替旧会话
            CasinoState state = store.getSnapshot(roomId);
            return new JoinResult(roomId, session.getToken(), state.seatOf(playerId), state);
        }
        sessions.close(session.getToken());
        throw new GameException(rejected.error(), rejected.message());
    }

    /**
     * 已在座的玩家重新入座：签发新令牌，旧令牌的连接作为重复连接被关闭。
     */
    private JoinResult reseat(String roomId, String playerId, int seat) {
        GameSession session = sessions.createSession(playerId, roomId);
        log.info("玩家重新入座: roomId={}, playerId={}, seat={}", roomId, playerId, seat);
        return new JoinResult(roomId, session.getToken(), seat, store.getSnapshot(roomId));
    }

    private GameSession resolveOrThrow(String token) {
        try {
            return sessions.resolve(token);
        } catch (SessionExpiredException e) {
            throw new GameException(GameError.SESSION_EXPIRED, e.getMessage());
        }
    }

    private GameSession heartbeatOrThrow(String token) {
        try {
            return sessions.heartbeat(token);
        } catch (SessionExpiredException e) {
            throw new GameException(GameError.SESSION_EXPIRED, e.getMessage());
        }
    }

    private void notifyRejected(GameSession s, ActionResult.Rejected rejected) {
        Envelope<RejectionNotice> env = Envelope.of(MessageType.ACTION_REJECTED, s.getRoomId(),
                actionLog.lastSequence(s.getRoomId()), RejectionNotice.of(rejected), clock.millis());
        hub.sendTo(s.getRoomId(), s.getToken(), env);
    }

    private static void requireText(String value, String field) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}

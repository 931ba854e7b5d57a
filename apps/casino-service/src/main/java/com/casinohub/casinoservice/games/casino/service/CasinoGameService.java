package com.casinohub.casinoservice.games.casino.service;

import com.casinohub.casinoservice.games.casino.domain.action.Move;
import com.casinohub.casinoservice.games.casino.domain.action.MoveDescriptor;
import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.room.ActionResult;
import com.casinohub.casinoservice.games.casino.service.dto.HeartbeatAck;
import com.casinohub.casinoservice.games.casino.service.dto.JoinResult;
import com.casinohub.casinoservice.games.casino.service.dto.ReconnectResult;
import com.casinohub.casinoservice.platform.broadcast.RoomConnection;
import com.casinohub.casinoservice.platform.transport.Envelope;

/**
 * 对外门面：供接入层（WebSocket/HTTP 控制器等）调用。
 * 没有结构化结果的操作以 {@link com.casinohub.casinoservice.common.GameException} 报错。
 */
public interface CasinoGameService {

    /** 新建房间并让创建者坐 0 号位 */
    JoinResult createRoom(String playerId, String name);

    /**
     * 入座；已在座的玩家会拿到新令牌并顶替旧连接（重连路径）。
     * 房间已有两名其他玩家时报 ROOM_FULL。
     */
    JoinResult joinRoom(String roomId, String playerId, String name);

    /** 准备/取消准备；双方都准备好时开局发牌 */
    ActionResult setReady(String token, boolean ready);

    /**
     * 提交走法。令牌失效返回 SESSION_EXPIRED 拒绝，走法结构不完整返回 MALFORMED_MOVE 拒绝。
     */
    ActionResult submitMove(String token, MoveDescriptor move);

    CasinoState getState(String roomId);

    CasinoState getStateByToken(String token);

    /**
     * 断线重连：返回序号大于 lastSeenSequence 的日志，区间已截断时返回完整快照。
     */
    ReconnectResult reconnect(String token, long lastSeenSequence);

    Envelope<HeartbeatAck> heartbeat(String token);

    /** 离开：关闭会话；等待阶段同时让出座位 */
    void leave(String token);

    /**
     * 订阅房间广播，并立即向该连接推送一份完整快照。
     */
    Envelope<CasinoState> attach(String token, RoomConnection connection);

    void detach(String roomId, String connectionId);

    /** 走法提示；不是自己的回合时返回 null */
    Move suggestMove(String token);
}

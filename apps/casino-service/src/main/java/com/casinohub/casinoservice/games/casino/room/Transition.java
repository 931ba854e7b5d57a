package com.casinohub.casinoservice.games.casino.room;

import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.domain.rule.RejectReason;
import com.casinohub.casinoservice.platform.transport.MessageType;

/**
 * 状态机单步结果：接受时带新状态与广播类型，拒绝时带原因。
 */
public record Transition(CasinoState state, MessageType messageType, RejectReason reason) {

    public static Transition ok(CasinoState state, MessageType messageType) {
        return new Transition(state, messageType, null);
    }

    public static Transition reject(RejectReason reason) {
        return new Transition(null, null, reason);
    }

    public boolean accepted() {
        return reason == null;
    }
}

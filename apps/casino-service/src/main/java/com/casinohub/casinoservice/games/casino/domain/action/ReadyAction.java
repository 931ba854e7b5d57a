package com.casinohub.casinoservice.games.casino.domain.action;

/**
 * 准备/取消准备。shuffleSeed 仅在该动作使双方都准备好时用于开局发牌。
 */
public record ReadyAction(String playerId, boolean ready, long shuffleSeed) implements GameAction {

    @Override
    public ActionType type() {
        return ActionType.READY;
    }
}

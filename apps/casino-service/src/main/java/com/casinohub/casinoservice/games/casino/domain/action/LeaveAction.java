package com.casinohub.casinoservice.games.casino.domain.action;

/**
 * 离开座位，只允许在等待阶段。
 */
public record LeaveAction(String playerId) implements GameAction {

    @Override
    public ActionType type() {
        return ActionType.LEAVE;
    }
}

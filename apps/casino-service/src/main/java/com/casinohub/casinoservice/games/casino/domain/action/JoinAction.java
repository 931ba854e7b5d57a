package com.casinohub.casinoservice.games.casino.domain.action;

public record JoinAction(String playerId, String name) implements GameAction {

    @Override
    public ActionType type() {
        return ActionType.JOIN;
    }
}

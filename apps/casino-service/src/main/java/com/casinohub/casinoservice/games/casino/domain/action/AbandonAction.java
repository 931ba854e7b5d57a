package com.casinohub.casinoservice.games.casino.domain.action;

public record AbandonAction(String reason) implements GameAction {

    @Override
    public ActionType type() {
        return ActionType.ABANDON;
    }
}

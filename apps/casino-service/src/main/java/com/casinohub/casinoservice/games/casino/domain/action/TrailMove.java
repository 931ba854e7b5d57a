package com.casinohub.casinoservice.games.casino.domain.action;

/**
 * 弃牌：把一张手牌放到桌面。
 */
public record TrailMove(String playerId, String cardId) implements Move {

    @Override
    public ActionType type() {
        return ActionType.TRAIL;
    }
}

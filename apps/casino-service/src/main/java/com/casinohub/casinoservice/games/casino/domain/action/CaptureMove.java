package com.casinohub.casinoservice.games.casino.domain.action;

import java.util.List;

/**
 * 收牌：用 cardId 收取 targetIds（桌面散牌 id 与墩 id 混合）。
 */
public record CaptureMove(String playerId, String cardId, List<String> targetIds) implements Move {

    public CaptureMove {
        targetIds = targetIds == null ? List.of() : List.copyOf(targetIds);
    }

    @Override
    public ActionType type() {
        return ActionType.CAPTURE;
    }
}

package com.casinohub.casinoservice.games.casino.domain.action;

import java.util.List;

/**
 * 造墩/加墩。
 * - cardId 为 null 表示只用桌面散牌造墩（需规则允许）；
 * - targetIds 中最多包含一个自己的墩，表示加墩。
 */
public record BuildMove(String playerId, String cardId, List<String> targetIds, int declaredValue) implements Move {

    public BuildMove {
        targetIds = targetIds == null ? List.of() : List.copyOf(targetIds);
    }

    @Override
    public ActionType type() {
        return ActionType.BUILD;
    }
}

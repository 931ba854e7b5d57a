package com.casinohub.casinoservice.games.casino.domain.action;

/**
 * 对局中的一步：收牌、造墩或弃牌。
 */
public sealed interface Move extends GameAction permits CaptureMove, BuildMove, TrailMove {

    String playerId();

    /** 打出的手牌 id；仅桌面造墩时为 null */
    String cardId();
}

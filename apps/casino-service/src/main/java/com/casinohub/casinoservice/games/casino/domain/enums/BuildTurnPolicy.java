package com.casinohub.casinoservice.games.casino.domain.enums;

/**
 * 造墩是否结束回合。
 */
public enum BuildTurnPolicy {
    /** 任何造墩/加墩都结束回合；不允许只用桌面散牌造墩 */
    ALWAYS_ENDS_TURN,
    /**
     * 允许每回合一次只用桌面散牌造墩（不出手牌），该动作不结束回合；
     * 用手牌造墩或加墩仍结束回合。
     */
    FREE_TABLE_BUILD
}

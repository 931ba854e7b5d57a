package com.casinohub.casinoservice.games.casino.domain.rule;

/** 对局结果：未结束 / 0 号座位胜 / 1 号座位胜 / 平局 */
public enum Outcome {
    /** 对局进行中 */
    ONGOING,
    SEAT0_WIN,
    SEAT1_WIN,
    /** 总分相同 */
    DRAW;

    public static Outcome winOf(int seat) {
        return seat == 0 ? SEAT0_WIN : SEAT1_WIN;
    }
}

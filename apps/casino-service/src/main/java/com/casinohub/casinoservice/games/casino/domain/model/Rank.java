package com.casinohub.casinoservice.games.casino.domain.model;

import com.casinohub.casinoservice.games.casino.domain.enums.AceMode;

/**
 * 牌点。J/Q/K 固定为 11/12/13，A 的取值由 {@link AceMode} 决定。
 */
public enum Rank {
    ACE("A", 1),
    TWO("2", 2),
    THREE("3", 3),
    FOUR("4", 4),
    FIVE("5", 5),
    SIX("6", 6),
    SEVEN("7", 7),
    EIGHT("8", 8),
    NINE("9", 9),
    TEN("10", 10),
    JACK("J", 11),
    QUEEN("Q", 12),
    KING("K", 13);

    /** A 作为高牌时的取值 */
    public static final int ACE_HIGH = 14;

    private final String symbol;
    private final int baseValue;

    Rank(String symbol, int baseValue) {
        this.symbol = symbol;
        this.baseValue = baseValue;
    }

    public String symbol() {
        return symbol;
    }

    public int baseValue() {
        return baseValue;
    }

    /**
     * 该牌点在给定 A 规则下的所有合法取值（升序）。
     */
    public int[] values(AceMode aceMode) {
        if (this != ACE) {
            return new int[]{baseValue};
        }
        return switch (aceMode) {
            case LOW -> new int[]{1};
            case HIGH -> new int[]{ACE_HIGH};
            case BOTH -> new int[]{1, ACE_HIGH};
        };
    }

    public static Rank ofSymbol(String symbol) {
        for (Rank r : values()) {
            if (r.symbol.equals(symbol)) {
                return r;
            }
        }
        throw new IllegalArgumentException("unknown rank: " + symbol);
    }
}

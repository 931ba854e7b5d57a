package com.casinohub.casinoservice.games.casino.domain.model;

public enum Suit {
    HEARTS("hearts"),
    DIAMONDS("diamonds"),
    CLUBS("clubs"),
    SPADES("spades");

    private final String code;

    Suit(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Suit ofCode(String code) {
        for (Suit s : values()) {
            if (s.code.equals(code)) {
                return s;
            }
        }
        throw new IllegalArgumentException("unknown suit: " + code);
    }
}

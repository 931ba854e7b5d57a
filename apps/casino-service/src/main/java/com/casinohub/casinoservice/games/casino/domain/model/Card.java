package com.casinohub.casinoservice.games.casino.domain.model;

import com.casinohub.casinoservice.games.casino.domain.enums.AceMode;

import java.util.Objects;

/**
 * 一张牌（不可变）。牌的 id 形如 "A_spades"、"10_diamonds"，在一副牌中唯一。
 */
public record Card(Suit suit, Rank rank) {

    public Card {
        Objects.requireNonNull(suit, "suit");
        Objects.requireNonNull(rank, "rank");
    }

    public String id() {
        return rank.symbol() + "_" + suit.code();
    }

    public int[] values(AceMode aceMode) {
        return rank.values(aceMode);
    }

    public boolean hasValue(int value, AceMode aceMode) {
        for (int v : rank.values(aceMode)) {
            if (v == value) {
                return true;
            }
        }
        return false;
    }

    /**
     * 解析牌 id。
     *
     * @throws IllegalArgumentException 格式不正确
     */
    public static Card parse(String id) {
        if (id == null) {
            throw new IllegalArgumentException("card id is null");
        }
        int sep = id.indexOf('_');
        if (sep <= 0 || sep == id.length() - 1) {
            throw new IllegalArgumentException("malformed card id: " + id);
        }
        return new Card(Suit.ofCode(id.substring(sep + 1)), Rank.ofSymbol(id.substring(0, sep)));
    }

    @Override
    public String toString() {
        return id();
    }
}

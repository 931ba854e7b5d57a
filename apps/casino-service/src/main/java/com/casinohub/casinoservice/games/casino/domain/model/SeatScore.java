package com.casinohub.casinoservice.games.casino.domain.model;

/**
 * 某座位在一轮中的计分明细。
 */
public record SeatScore(int aces,
                        int highCard,
                        int lowCard,
                        int mostCards,
                        int mostSuit,
                        int cardCount,
                        int suitCount) {

    public int total() {
        return aces + highCard + lowCard + mostCards + mostSuit;
    }
}

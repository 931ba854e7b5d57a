package com.casinohub.casinoservice.games.casino.domain.rule;

import com.casinohub.casinoservice.games.casino.domain.model.Card;
import com.casinohub.casinoservice.games.casino.domain.model.Rank;
import com.casinohub.casinoservice.games.casino.domain.model.Suit;

/**
 * 计分表。多数类奖励（牌数、花色）只给严格多于对手的一方。
 */
public record ScoringTable(int acePoints,
                           Card highCard,
                           int highCardPoints,
                           Card lowCard,
                           int lowCardPoints,
                           int mostCardsPoints,
                           Suit majoritySuit,
                           int mostSuitPoints) {

    /** 每张 A 1 分，方块 10 记 2 分，黑桃 2 记 1 分，牌数多 2 分，黑桃多 2 分 */
    public static ScoringTable standard() {
        return new ScoringTable(1,
                new Card(Suit.DIAMONDS, Rank.TEN), 2,
                new Card(Suit.SPADES, Rank.TWO), 1,
                2,
                Suit.SPADES, 2);
    }
}

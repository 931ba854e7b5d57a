package com.casinohub.casinoservice.games.casino.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 整副牌的构造与洗牌。
 *
 * 洗牌只依赖 (seed, round)，相同输入得到相同牌序，回放时据此重现发牌。
 */
public final class Deck {

    public static final int SIZE = 52;

    private Deck() {
    }

    /** 标准顺序的 52 张牌 */
    public static List<Card> standard() {
        List<Card> cards = new ArrayList<>(SIZE);
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                cards.add(new Card(suit, rank));
            }
        }
        return cards;
    }

    /** 第 round 轮使用的洗好的牌，牌顶在下标 0 */
    public static List<Card> shuffled(long seed, int round) {
        List<Card> cards = standard();
        Collections.shuffle(cards, new Random(seed ^ (round * 0x9E3779B97F4A7C15L)));
        return cards;
    }

    /**
     * 从牌顶摸 n 张（不足时摸完为止）。
     */
    public static List<Card> draw(List<Card> deck, int n) {
        int count = Math.min(n, deck.size());
        List<Card> top = new ArrayList<>(deck.subList(0, count));
        deck.subList(0, count).clear();
        return top;
    }
}

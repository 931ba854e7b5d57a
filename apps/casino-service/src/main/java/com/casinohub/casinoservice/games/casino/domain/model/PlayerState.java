package com.casinohub.casinoservice.games.casino.domain.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 座位上的玩家：手牌、本轮收牌与累计得分。
 */
@Data
@NoArgsConstructor
public class PlayerState {

    private String playerId;
    private String name;
    private boolean ready;
    private List<Card> hand = new ArrayList<>();
    /** 本轮收到的牌，每轮开始时清空 */
    private List<Card> captured = new ArrayList<>();
    /** 各轮累计得分 */
    private int totalScore;

    public PlayerState(String playerId, String name) {
        this.playerId = playerId;
        this.name = name;
    }

    public Optional<Card> handCard(String cardId) {
        return hand.stream().filter(c -> c.id().equals(cardId)).findFirst();
    }

    public PlayerState copy() {
        PlayerState p = new PlayerState(playerId, name);
        p.ready = ready;
        p.hand = new ArrayList<>(hand);
        p.captured = new ArrayList<>(captured);
        p.totalScore = totalScore;
        return p;
    }
}

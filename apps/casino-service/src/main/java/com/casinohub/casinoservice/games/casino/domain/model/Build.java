package com.casinohub.casinoservice.games.casino.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 桌面上的墩（不可变，加墩时整体替换）。
 *
 * 不变式：cards 可以划分为 groups 组，每组点数之和都等于 value。
 *
 * @param id            墩 id，形如 "b3"，房间内唯一
 * @param cards         墩内的牌
 * @param value         声明的收取点数
 * @param ownerSeat     建墩者座位（加墩不改变）
 * @param groups        组数，大于 1 时不能再提高点数
 * @param sharedCapture 对手是否也可以收取
 */
public record Build(String id, List<Card> cards, int value, int ownerSeat, int groups, boolean sharedCapture) {

    public Build {
        cards = List.copyOf(cards);
    }

    public boolean capturableBy(int seat) {
        return seat == ownerSeat || sharedCapture;
    }

    public Build extend(List<Card> added, int newValue, int newGroups) {
        List<Card> all = new ArrayList<>(cards);
        all.addAll(added);
        return new Build(id, all, newValue, ownerSeat, newGroups, sharedCapture);
    }
}

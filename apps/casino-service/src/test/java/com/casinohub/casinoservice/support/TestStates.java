package com.casinohub.casinoservice.support;

import com.casinohub.casinoservice.games.casino.domain.enums.RoomPhase;
import com.casinohub.casinoservice.games.casino.domain.model.Card;
import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.domain.model.Deck;
import com.casinohub.casinoservice.games.casino.domain.model.PlayerState;

import java.util.ArrayList;
import java.util.List;

/**
 * 手工摆好的对局局面：指定两家手牌与桌面，其余牌留在牌堆，总数保持 52。
 */
public final class TestStates {

    private TestStates() {
    }

    public static List<Card> cards(String... ids) {
        List<Card> out = new ArrayList<>();
        for (String id : ids) {
            out.add(Card.parse(id));
        }
        return out;
    }

    public static CasinoState inPlay(List<Card> hand0, List<Card> hand1, List<Card> table) {
        CasinoState s = CasinoState.empty("room-t");
        PlayerState alice = new PlayerState("alice", "Alice");
        PlayerState bob = new PlayerState("bob", "Bob");
        alice.getHand().addAll(hand0);
        bob.getHand().addAll(hand1);
        s.getPlayers().add(alice);
        s.getPlayers().add(bob);
        s.getTable().addAll(table);

        List<Card> deck = Deck.standard();
        deck.removeAll(hand0);
        deck.removeAll(hand1);
        deck.removeAll(table);
        s.setDeck(deck);

        s.setPhase(RoomPhase.ROUND1);
        s.setRound(1);
        s.setLeadSeat(0);
        s.setCurrentSeat(0);
        return s;
    }
}

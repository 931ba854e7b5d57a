package com.casinohub.casinoservice.games.casino.domain.rule;

import com.casinohub.casinoservice.games.casino.domain.model.Card;
import com.casinohub.casinoservice.games.casino.domain.model.Rank;
import com.casinohub.casinoservice.games.casino.domain.model.RoundResult;
import com.casinohub.casinoservice.games.casino.domain.model.SeatScore;

import java.util.ArrayList;
import java.util.List;

/**
 * 按计分表为一轮的两家收牌计分。
 */
public final class ScoreCalculator {

    private final ScoringTable table;

    public ScoreCalculator(ScoringTable table) {
        this.table = table;
    }

    public RoundResult score(int round, List<List<Card>> capturedBySeat) {
        int seats = capturedBySeat.size();
        int[] cardCounts = new int[seats];
        int[] suitCounts = new int[seats];
        for (int i = 0; i < seats; i++) {
            List<Card> pile = capturedBySeat.get(i);
            cardCounts[i] = pile.size();
            suitCounts[i] = (int) pile.stream().filter(c -> c.suit() == table.majoritySuit()).count();
        }

        List<SeatScore> scores = new ArrayList<>(seats);
        for (int i = 0; i < seats; i++) {
            List<Card> pile = capturedBySeat.get(i);
            int aces = (int) pile.stream().filter(c -> c.rank() == Rank.ACE).count() * table.acePoints();
            int high = pile.contains(table.highCard()) ? table.highCardPoints() : 0;
            int low = pile.contains(table.lowCard()) ? table.lowCardPoints() : 0;
            int most = strictlyMost(cardCounts, i) ? table.mostCardsPoints() : 0;
            int suit = strictlyMost(suitCounts, i) ? table.mostSuitPoints() : 0;
            scores.add(new SeatScore(aces, high, low, most, suit, cardCounts[i], suitCounts[i]));
        }
        return new RoundResult(round, scores);
    }

    /**
     * 总分高者胜，相同为平局。
     */
    public static Outcome determineWinner(int total0, int total1) {
        if (total0 == total1) {
            return Outcome.DRAW;
        }
        return total0 > total1 ? Outcome.SEAT0_WIN : Outcome.SEAT1_WIN;
    }

    private static boolean strictlyMost(int[] counts, int seat) {
        for (int i = 0; i < counts.length; i++) {
            if (i != seat && counts[i] >= counts[seat]) {
                return false;
            }
        }
        return true;
    }
}

package com.casinohub.casinoservice.games.casino.domain.rule;

import com.casinohub.casinoservice.games.casino.domain.model.Card;
import com.casinohub.casinoservice.games.casino.domain.model.Deck;
import com.casinohub.casinoservice.games.casino.domain.model.RoundResult;
import com.casinohub.casinoservice.games.casino.domain.model.SeatScore;
import com.casinohub.casinoservice.games.casino.domain.model.Suit;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreCalculatorTest {

    private final ScoreCalculator calculator = new ScoreCalculator(ScoringTable.standard());

    @Test
    void evenCardSplitAwardsMostCardsToNobody() {
        List<Card> heartsAndClubs = new ArrayList<>();
        List<Card> diamondsAndSpades = new ArrayList<>();
        for (Card c : Deck.standard()) {
            if (c.suit() == Suit.HEARTS || c.suit() == Suit.CLUBS) {
                heartsAndClubs.add(c);
            } else {
                diamondsAndSpades.add(c);
            }
        }

        RoundResult result = calculator.score(1, List.of(heartsAndClubs, diamondsAndSpades));

        SeatScore s0 = result.seats().get(0);
        SeatScore s1 = result.seats().get(1);
        assertThat(s0.cardCount()).isEqualTo(26);
        assertThat(s0.mostCards()).isZero();
        assertThat(s1.mostCards()).isZero();
        assertThat(s0.aces()).isEqualTo(2);
        assertThat(s0.total()).isEqualTo(2);
        // 两张 A + 方块 10 + 黑桃 2 + 黑桃多数
        assertThat(s1.highCard()).isEqualTo(2);
        assertThat(s1.lowCard()).isEqualTo(1);
        assertThat(s1.mostSuit()).isEqualTo(2);
        assertThat(result.totalOf(1)).isEqualTo(7);
    }

    @Test
    void majorityBonusesRequireStrictlyMore() {
        List<Card> a = new ArrayList<>(List.of(Card.parse("3_spades"), Card.parse("4_spades"), Card.parse("5_hearts")));
        List<Card> b = new ArrayList<>(List.of(Card.parse("6_spades"), Card.parse("7_spades"), Card.parse("8_hearts")));

        RoundResult tie = calculator.score(2, List.of(a, b));
        assertThat(tie.totalOf(0)).isZero();
        assertThat(tie.totalOf(1)).isZero();

        b.add(Card.parse("9_spades"));
        RoundResult more = calculator.score(2, List.of(a, b));
        assertThat(more.seats().get(1).mostCards()).isEqualTo(2);
        assertThat(more.seats().get(1).mostSuit()).isEqualTo(2);
        assertThat(more.round()).isEqualTo(2);
    }

    @Test
    void equalTotalsAreADraw() {
        assertThat(ScoreCalculator.determineWinner(11, 11)).isEqualTo(Outcome.DRAW);
        assertThat(ScoreCalculator.determineWinner(12, 11)).isEqualTo(Outcome.SEAT0_WIN);
        assertThat(ScoreCalculator.determineWinner(3, 11)).isEqualTo(Outcome.SEAT1_WIN);
    }
}

package com.casinohub.casinoservice.games.casino.domain.rule;

import com.casinohub.casinoservice.games.casino.domain.enums.AceMode;
import com.casinohub.casinoservice.games.casino.domain.model.Card;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.casinohub.casinoservice.support.TestStates.cards;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class CombinationsTest {

    @Test
    void reachableSumsBranchOnAces() {
        List<Card> hand = cards("A_hearts", "A_spades", "3_clubs");

        assertThat(Combinations.reachableSums(hand, AceMode.BOTH)).containsExactly(5, 18, 31);
        assertThat(Combinations.reachableSums(hand, AceMode.LOW)).containsExactly(5);
        assertThat(Combinations.reachableSums(hand, AceMode.HIGH)).containsExactly(31);
    }

    @Test
    void partitionSplitsIntoGroupsOfTarget() {
        List<Card> table = cards("2_hearts", "6_clubs", "8_diamonds", "5_spades", "3_hearts");

        assertThat(Combinations.partition(table, 8, AceMode.BOTH)).get().satisfies(groups -> {
            assertThat(groups).hasSize(3);
            assertThat(groups).allSatisfy(g -> assertThat(Combinations.canSumTo(g, 8, AceMode.BOTH)).isTrue());
            assertThat(groups.stream().mapToInt(List::size).sum()).isEqualTo(5);
        });
    }

    @Test
    void partitionFailsWhenAnyCardIsLeftOver() {
        assertThat(Combinations.partition(cards("2_hearts", "6_clubs", "4_diamonds"), 8, AceMode.BOTH)).isEmpty();
        assertThat(Combinations.partition(List.of(), 8, AceMode.BOTH)).isEmpty();
    }

    @Test
    void aceMaySumHighInsidePartition() {
        assertThat(Combinations.partition(cards("A_clubs", "K_hearts"), 14, AceMode.BOTH)).isPresent();
        assertThat(Combinations.partition(cards("A_clubs", "K_hearts"), 14, AceMode.HIGH)).isEmpty();
    }

    @Test
    void largeSelectionWithoutReachableMultipleIsRejectedQuickly() {
        // A..5 四种花色共 20 张，总和无论 A 取 1 还是 14 都不是 13 的倍数
        List<Card> table = cards(
                "A_hearts", "A_diamonds", "A_clubs", "A_spades",
                "2_hearts", "2_diamonds", "2_clubs", "2_spades",
                "3_hearts", "3_diamonds", "3_clubs", "3_spades",
                "4_hearts", "4_diamonds", "4_clubs", "4_spades",
                "5_hearts", "5_diamonds", "5_clubs", "5_spades");

        assertTimeoutPreemptively(Duration.ofSeconds(1),
                () -> assertThat(Combinations.partition(table, 13, AceMode.BOTH)).isEmpty());
    }

    @Test
    void largeSelectionWithMatchingTotalButNoPartitionIsRejectedQuickly() {
        // 总和 104 = 8 × 13，但四张 J 只有三张 2 可配
        List<Card> table = cards(
                "J_hearts", "J_diamonds", "J_clubs", "J_spades",
                "2_hearts", "2_diamonds", "2_clubs",
                "3_hearts", "3_diamonds", "3_clubs", "3_spades",
                "4_hearts", "4_diamonds", "4_clubs", "4_spades",
                "5_hearts", "5_diamonds", "5_clubs", "5_spades",
                "6_hearts");

        assertTimeoutPreemptively(Duration.ofSeconds(1),
                () -> assertThat(Combinations.partition(table, 13, AceMode.LOW)).isEmpty());
    }

    @Test
    void largeSelectionIsPartitionedIntoGroupsOfTarget() {
        List<Card> table = cards(
                "A_hearts", "A_diamonds", "A_clubs",
                "2_hearts", "2_diamonds", "2_clubs", "2_spades",
                "3_hearts", "3_diamonds", "3_clubs", "3_spades",
                "4_hearts", "4_diamonds", "4_clubs", "4_spades",
                "5_hearts", "5_diamonds", "5_clubs", "5_spades",
                "6_spades");

        assertTimeoutPreemptively(Duration.ofSeconds(1), () ->
                assertThat(Combinations.partition(table, 13, AceMode.LOW)).get().satisfies(groups -> {
                    assertThat(groups).hasSize(5);
                    assertThat(groups).allSatisfy(g -> assertThat(Combinations.canSumTo(g, 13, AceMode.LOW)).isTrue());
                    assertThat(groups.stream().flatMap(List::stream)).containsExactlyInAnyOrderElementsOf(table);
                }));
    }

    @Test
    void cardAboveTargetCannotBePartitioned() {
        assertThat(Combinations.partition(cards("Q_hearts", "7_clubs", "4_diamonds", "3_spades"), 13, AceMode.BOTH))
                .isEmpty();
        assertThat(Combinations.partition(cards("9_hearts", "2_clubs"), 5, AceMode.BOTH)).isEmpty();
    }
}

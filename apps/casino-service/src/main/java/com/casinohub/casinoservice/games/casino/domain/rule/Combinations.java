package com.casinohub.casinoservice.games.casino.domain.rule;

import com.casinohub.casinoservice.games.casino.domain.enums.AceMode;
import com.casinohub.casinoservice.games.casino.domain.model.Card;
import com.casinohub.casinoservice.games.casino.domain.model.Rank;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * 牌点组合计算。A 可能有两个取值，因此按“可达和”而不是单一总和判断。
 */
public final class Combinations {

    /** 参与划分的牌数上限，超过后直接判定无法划分 */
    private static final int MAX_PARTITION_CARDS = 20;

    private Combinations() {
    }

    /**
     * 每张牌各取一个合法值时，所有可能的点数和。
     */
    public static TreeSet<Integer> reachableSums(List<Card> cards, AceMode aceMode) {
        TreeSet<Integer> sums = new TreeSet<>();
        sums.add(0);
        for (Card c : cards) {
            TreeSet<Integer> next = new TreeSet<>();
            for (int s : sums) {
                for (int v : c.values(aceMode)) {
                    next.add(s + v);
                }
            }
            sums = next;
        }
        return sums;
    }

    public static boolean canSumTo(List<Card> cards, int target, AceMode aceMode) {
        return !cards.isEmpty() && reachableSums(cards, aceMode).contains(target);
    }

    /**
     * 把 cards 全部划分为若干组，每组点数和都等于 target。
     *
     * 同点数的牌可以互换，搜索状态为（各点数剩余张数, 当前未满组的点数和），失败状态记入位图，
     * 因此在房间锁内求值的耗时有上界。
     *
     * @return 划分结果；无法划分或 cards 为空时返回 empty
     */
    public static Optional<List<List<Card>>> partition(List<Card> cards, int target, AceMode aceMode) {
        if (cards.isEmpty() || cards.size() > MAX_PARTITION_CARDS || target <= 0) {
            return Optional.empty();
        }
        for (Card c : cards) {
            if (c.values(aceMode)[0] > target) {
                return Optional.empty();
            }
        }
        boolean multipleReachable = false;
        for (int s : reachableSums(cards, aceMode)) {
            if (s > 0 && s % target == 0) {
                multipleReachable = true;
                break;
            }
        }
        if (!multipleReachable) {
            return Optional.empty();
        }

        Map<Rank, List<Card>> byRank = new EnumMap<>(Rank.class);
        for (Card c : cards) {
            byRank.computeIfAbsent(c.rank(), r -> new ArrayList<>()).add(c);
        }
        Search search = new Search(new ArrayList<>(byRank.values()), target, aceMode);
        if (!search.run()) {
            return Optional.empty();
        }
        return Optional.of(search.groups());
    }

    /**
     * 逐张放牌：当前组凑满 target 即关闭，开始下一组。
     */
    private static final class Search {

        private final List<List<Card>> ranks;
        private final int target;
        private final AceMode aceMode;
        private final int[] remaining;
        private final long[] radix;
        private final BitSet failed;
        private final Deque<Card> path = new ArrayDeque<>();
        private final Deque<Integer> pathValues = new ArrayDeque<>();

        Search(List<List<Card>> ranks, int target, AceMode aceMode) {
            this.ranks = ranks;
            this.target = target;
            this.aceMode = aceMode;
            this.remaining = new int[ranks.size()];
            this.radix = new long[ranks.size()];
            long states = 1;
            for (int i = 0; i < ranks.size(); i++) {
                remaining[i] = ranks.get(i).size();
                radix[i] = states;
                states *= remaining[i] + 1;
            }
            this.failed = new BitSet(Math.toIntExact(states * target));
        }

        boolean run() {
            long index = 0;
            for (int i = 0; i < remaining.length; i++) {
                index += remaining[i] * radix[i];
            }
            return place(index, 0);
        }

        private boolean place(long index, int partial) {
            if (index == 0) {
                return partial == 0;
            }
            int key = Math.toIntExact(index * target + partial);
            if (failed.get(key)) {
                return false;
            }
            for (int i = 0; i < remaining.length; i++) {
                if (remaining[i] == 0) {
                    continue;
                }
                Card card = ranks.get(i).get(remaining[i] - 1);
                for (int v : card.values(aceMode)) {
                    int sum = partial + v;
                    if (sum > target) {
                        continue;
                    }
                    remaining[i]--;
                    path.addLast(card);
                    pathValues.addLast(v);
                    if (place(index - radix[i], sum == target ? 0 : sum)) {
                        return true;
                    }
                    pathValues.removeLast();
                    path.removeLast();
                    remaining[i]++;
                }
            }
            failed.set(key);
            return false;
        }

        List<List<Card>> groups() {
            List<List<Card>> out = new ArrayList<>();
            List<Card> current = new ArrayList<>();
            int sum = 0;
            Iterator<Integer> values = pathValues.iterator();
            for (Card c : path) {
                current.add(c);
                sum += values.next();
                if (sum == target) {
                    out.add(current);
                    current = new ArrayList<>();
                    sum = 0;
                }
            }
            return out;
        }
    }
}

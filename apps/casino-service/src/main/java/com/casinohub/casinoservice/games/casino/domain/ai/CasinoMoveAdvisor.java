package com.casinohub.casinoservice.games.casino.domain.ai;

import com.casinohub.casinoservice.engine.core.AiAdvisor;
import com.casinohub.casinoservice.games.casino.domain.action.BuildMove;
import com.casinohub.casinoservice.games.casino.domain.action.CaptureMove;
import com.casinohub.casinoservice.games.casino.domain.action.Move;
import com.casinohub.casinoservice.games.casino.domain.action.TrailMove;
import com.casinohub.casinoservice.games.casino.domain.model.Build;
import com.casinohub.casinoservice.games.casino.domain.model.Card;
import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.domain.model.PlayerState;
import com.casinohub.casinoservice.games.casino.domain.rule.CasinoRules;
import com.casinohub.casinoservice.games.casino.domain.rule.Combinations;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 走法提示：给当前行动方一个合法走法。
 *
 * 贪心策略，优先级依次为：收走最多牌的收牌 → 造墩 → 弃最小的牌。
 * 每个候选都经过规则引擎校验，返回的走法一定合法；不在对局中时返回 null。
 */
public class CasinoMoveAdvisor implements AiAdvisor<CasinoState, Move> {

    private final CasinoRules rules;

    public CasinoMoveAdvisor(CasinoRules rules) {
        this.rules = rules;
    }

    @Override
    public Move suggest(CasinoState state, long budgetMs) {
        if (!state.getPhase().inPlay()) {
            return null;
        }
        long deadline = System.nanoTime() + Math.max(budgetMs, 1) * 1_000_000L;
        int seat = state.getCurrentSeat();
        PlayerState p = state.player(seat);

        Move capture = bestCapture(state, seat, p, deadline);
        if (capture != null) {
            return capture;
        }
        Move build = firstBuild(state, seat, p);
        if (build != null) {
            return build;
        }
        return lowestTrail(state, seat, p);
    }

    private Move bestCapture(CasinoState state, int seat, PlayerState p, long deadline) {
        Move best = null;
        int bestCount = 0;
        for (Card c : p.getHand()) {
            for (int v : c.values(rules.config().aceMode())) {
                if (System.nanoTime() > deadline && best != null) {
                    return best;
                }
                List<String> targets = captureTargets(state, seat, v);
                if (targets.isEmpty()) {
                    continue;
                }
                CaptureMove m = new CaptureMove(p.getPlayerId(), c.id(), targets);
                int count = capturedCount(state, targets);
                if (count > bestCount && rules.validateCapture(state, seat, m).isEmpty()) {
                    best = m;
                    bestCount = count;
                }
            }
        }
        return best;
    }

    /** 同点数的墩与散牌，再贪心凑两张之和 */
    private List<String> captureTargets(CasinoState state, int seat, int v) {
        List<String> targets = new ArrayList<>();
        for (Build b : state.getBuilds()) {
            if (b.value() == v && b.capturableBy(seat)) {
                targets.add(b.id());
            }
        }
        List<Card> rest = new ArrayList<>();
        for (Card t : state.getTable()) {
            if (t.hasValue(v, rules.config().aceMode())) {
                targets.add(t.id());
            } else {
                rest.add(t);
            }
        }
        boolean[] used = new boolean[rest.size()];
        for (int i = 0; i < rest.size(); i++) {
            for (int j = i + 1; j < rest.size() && !used[i]; j++) {
                if (!used[j] && Combinations.canSumTo(List.of(rest.get(i), rest.get(j)), v, rules.config().aceMode())) {
                    used[i] = true;
                    used[j] = true;
                    targets.add(rest.get(i).id());
                    targets.add(rest.get(j).id());
                }
            }
        }
        return targets;
    }

    private int capturedCount(CasinoState state, List<String> targets) {
        int n = 1;
        for (String id : targets) {
            n += state.build(id).map(b -> b.cards().size()).orElse(1);
        }
        return n;
    }

    private Move firstBuild(CasinoState state, int seat, PlayerState p) {
        for (Card c : p.getHand()) {
            for (Card t : state.getTable()) {
                for (int d : Combinations.reachableSums(List.of(c, t), rules.config().aceMode())) {
                    BuildMove m = new BuildMove(p.getPlayerId(), c.id(), List.of(t.id()), d);
                    if (rules.validateBuild(state, seat, m).isEmpty()) {
                        return m;
                    }
                }
            }
        }
        return null;
    }

    private Move lowestTrail(CasinoState state, int seat, PlayerState p) {
        List<Card> hand = new ArrayList<>(p.getHand());
        hand.sort(Comparator.comparingInt(c -> c.rank().baseValue()));
        for (Card c : hand) {
            TrailMove m = new TrailMove(p.getPlayerId(), c.id());
            if (rules.validateTrail(state, seat, m).isEmpty()) {
                return m;
            }
        }
        return null;
    }
}

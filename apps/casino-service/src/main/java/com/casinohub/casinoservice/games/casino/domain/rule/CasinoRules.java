package com.casinohub.casinoservice.games.casino.domain.rule;

import com.casinohub.casinoservice.games.casino.domain.action.BuildMove;
import com.casinohub.casinoservice.games.casino.domain.action.CaptureMove;
import com.casinohub.casinoservice.games.casino.domain.action.Move;
import com.casinohub.casinoservice.games.casino.domain.action.TrailMove;
import com.casinohub.casinoservice.games.casino.domain.enums.BuildTurnPolicy;
import com.casinohub.casinoservice.games.casino.domain.enums.RoomPhase;
import com.casinohub.casinoservice.games.casino.domain.model.Build;
import com.casinohub.casinoservice.games.casino.domain.model.Card;
import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.domain.model.Deck;
import com.casinohub.casinoservice.games.casino.domain.model.PlayerState;
import com.casinohub.casinoservice.games.casino.domain.model.RoundResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Casino 规则引擎。
 *
 * - validate*：只读校验，返回拒绝原因（合法时为 empty），不修改入参；
 * - execute* / dealInitial：在副本上应用，返回新状态；
 * - 出牌后若两家手牌都已打完，自动补发；牌堆也打完则结算本轮，并开始下一轮或结束整局。
 *
 * 回合推进：收牌、弃牌、用手牌造墩/加墩都结束回合；
 * 只有 {@link BuildTurnPolicy#FREE_TABLE_BUILD} 下只用桌面散牌造墩不结束回合，且每回合限一次。
 */
public final class CasinoRules {

    private final RuleConfig config;
    private final ScoreCalculator scoreCalculator;

    public CasinoRules(RuleConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.scoreCalculator = new ScoreCalculator(config.scoring());
    }

    public RuleConfig config() {
        return config;
    }

    /* =========================
     * 发牌
     * ========================= */

    /**
     * 开局发牌：固定洗牌种子，翻 tableSize 张到桌面，每人发 handSize 张，0 号座位先手。
     */
    public CasinoState dealInitial(CasinoState state, long seed) {
        if (state.getPlayers().size() != 2) {
            throw new IllegalStateException("two seated players are required to deal");
        }
        CasinoState next = state.copy();
        next.setPhase(RoomPhase.DEALING);
        next.setShuffleSeed(seed);
        next.getRoundResults().clear();
        next.setOutcome(Outcome.ONGOING);
        for (PlayerState p : next.getPlayers()) {
            p.setTotalScore(0);
        }
        startRound(next, 1, 0);
        return next;
    }

    /* =========================
     * 校验
     * ========================= */

    public Optional<RejectReason> validate(CasinoState state, int seat, Move move) {
        if (move instanceof CaptureMove capture) {
            return validateCapture(state, seat, capture);
        }
        if (move instanceof BuildMove build) {
            return validateBuild(state, seat, build);
        }
        return validateTrail(state, seat, (TrailMove) move);
    }

    /**
     * 收牌校验：存在打出牌的某个取值 v，使得选中的墩都声明为 v 且可被该玩家收取，
     * 选中的散牌可以划分为若干组、每组之和为 v。
     */
    public Optional<RejectReason> validateCapture(CasinoState state, int seat, CaptureMove move) {
        Optional<Card> played = state.player(seat).handCard(move.cardId());
        if (played.isEmpty()) {
            return Optional.of(RejectReason.CARD_NOT_IN_HAND);
        }
        if (move.targetIds().isEmpty()) {
            return Optional.of(RejectReason.EMPTY_SELECTION);
        }
        Selection sel = Selection.resolve(state, move.targetIds());
        if (sel == null) {
            return Optional.of(RejectReason.TARGET_NOT_ON_TABLE);
        }
        for (Build b : sel.builds()) {
            if (!b.capturableBy(seat)) {
                return Optional.of(RejectReason.BUILD_NOT_CAPTURABLE);
            }
        }
        for (int v : played.get().values(config.aceMode())) {
            if (capturesWith(v, sel)) {
                return Optional.empty();
            }
        }
        return Optional.of(RejectReason.CAPTURE_SUM_MISMATCH);
    }

    public Optional<RejectReason> validateBuild(CasinoState state, int seat, BuildMove move) {
        return planBuild(state, seat, move).rejection();
    }

    /**
     * 弃牌校验：自己有墩且手里有能收它的牌时不能弃牌。
     */
    public Optional<RejectReason> validateTrail(CasinoState state, int seat, TrailMove move) {
        PlayerState p = state.player(seat);
        if (p.handCard(move.cardId()).isEmpty()) {
            return Optional.of(RejectReason.CARD_NOT_IN_HAND);
        }
        for (Build b : state.getBuilds()) {
            if (b.ownerSeat() == seat && holdsValue(p.getHand(), null, b.value())) {
                return Optional.of(RejectReason.MUST_ADDRESS_OWN_BUILD);
            }
        }
        return Optional.empty();
    }

    /* =========================
     * 执行
     * ========================= */

    public CasinoState execute(CasinoState state, int seat, Move move) {
        if (move instanceof CaptureMove capture) {
            return executeCapture(state, seat, capture);
        }
        if (move instanceof BuildMove build) {
            return executeBuild(state, seat, build);
        }
        return executeTrail(state, seat, (TrailMove) move);
    }

    public CasinoState executeCapture(CasinoState state, int seat, CaptureMove move) {
        requireLegal(validateCapture(state, seat, move));
        CasinoState next = state.copy();
        PlayerState p = next.player(seat);
        Selection sel = Selection.resolve(next, move.targetIds());
        Card played = p.handCard(move.cardId()).orElseThrow();

        p.getHand().remove(played);
        p.getCaptured().add(played);
        for (Card c : sel.loose()) {
            next.getTable().remove(c);
            p.getCaptured().add(c);
        }
        for (Build b : sel.builds()) {
            next.getBuilds().remove(b);
            p.getCaptured().addAll(b.cards());
        }
        next.setLastCapturerSeat(seat);
        next.setLastAction("seat " + seat + " captured " + move.targetIds() + " with " + played.id());
        finishMove(next, seat, true);
        return next;
    }

    public CasinoState executeBuild(CasinoState state, int seat, BuildMove move) {
        BuildPlan plan = planBuild(state, seat, move);
        requireLegal(plan.rejection());
        CasinoState next = state.copy();
        PlayerState p = next.player(seat);

        List<Card> added = new ArrayList<>();
        if (plan.played() != null) {
            p.getHand().remove(plan.played());
            added.add(plan.played());
        }
        for (Card c : plan.loose()) {
            next.getTable().remove(c);
            added.add(c);
        }
        List<Build> builds = next.getBuilds();
        if (plan.existing() != null) {
            int idx = builds.indexOf(plan.existing());
            builds.set(idx, plan.existing().extend(added, move.declaredValue(), plan.groups()));
        } else {
            String id = "b" + next.getNextBuildNo();
            next.setNextBuildNo(next.getNextBuildNo() + 1);
            builds.add(new Build(id, added, move.declaredValue(), seat, plan.groups(), config.opponentBuildCapture()));
        }

        boolean endsTurn = plan.played() != null;
        if (!endsTurn) {
            next.setFreeBuildUsed(true);
        }
        next.setLastAction("seat " + seat + " built " + move.declaredValue()
                + (plan.existing() != null ? " on " + plan.existing().id() : ""));
        finishMove(next, seat, endsTurn);
        return next;
    }

    public CasinoState executeTrail(CasinoState state, int seat, TrailMove move) {
        requireLegal(validateTrail(state, seat, move));
        CasinoState next = state.copy();
        PlayerState p = next.player(seat);
        Card played = p.handCard(move.cardId()).orElseThrow();
        p.getHand().remove(played);
        next.getTable().add(played);
        next.setLastAction("seat " + seat + " trailed " + played.id());
        finishMove(next, seat, true);
        return next;
    }

    /* =========================
     * 计分
     * ========================= */

    /**
     * 按当前两家收牌计算本轮得分。
     */
    public RoundResult computeScore(CasinoState state) {
        List<List<Card>> piles = new ArrayList<>();
        for (PlayerState p : state.getPlayers()) {
            piles.add(p.getCaptured());
        }
        return scoreCalculator.score(state.getRound(), piles);
    }

    public Outcome determineWinner(CasinoState state) {
        return ScoreCalculator.determineWinner(state.player(0).getTotalScore(), state.player(1).getTotalScore());
    }

    /* =========================
     * 内部：造墩方案
     * ========================= */

    private BuildPlan planBuild(CasinoState state, int seat, BuildMove move) {
        int d = move.declaredValue();
        if (d < 2 || d > config.maxBuildValue()) {
            return BuildPlan.reject(RejectReason.DECLARED_VALUE_OUT_OF_RANGE);
        }
        PlayerState p = state.player(seat);
        Card played = null;
        if (move.cardId() != null) {
            played = p.handCard(move.cardId()).orElse(null);
            if (played == null) {
                return BuildPlan.reject(RejectReason.CARD_NOT_IN_HAND);
            }
        }
        if (move.targetIds().isEmpty()) {
            return BuildPlan.reject(RejectReason.EMPTY_SELECTION);
        }
        Selection sel = Selection.resolve(state, move.targetIds());
        if (sel == null) {
            return BuildPlan.reject(RejectReason.TARGET_NOT_ON_TABLE);
        }
        if (sel.builds().size() > 1) {
            return BuildPlan.reject(RejectReason.MULTIPLE_BUILDS_SELECTED);
        }

        if (played == null) {
            if (config.buildTurnPolicy() != BuildTurnPolicy.FREE_TABLE_BUILD || !sel.builds().isEmpty()) {
                return BuildPlan.reject(RejectReason.TABLE_BUILD_NOT_ALLOWED);
            }
            if (state.isFreeBuildUsed()) {
                return BuildPlan.reject(RejectReason.FREE_BUILD_USED);
            }
            if (sel.loose().size() < 2) {
                return BuildPlan.reject(RejectReason.BUILD_SUM_MISMATCH);
            }
        }

        List<Card> added = new ArrayList<>();
        if (played != null) {
            added.add(played);
        }
        added.addAll(sel.loose());

        Build existing = sel.builds().isEmpty() ? null : sel.builds().get(0);
        int groups;
        if (existing == null) {
            if (played != null && played.hasValue(d, config.aceMode())) {
                return BuildPlan.reject(RejectReason.BUILD_EQUALS_PLAYED_CARD);
            }
            Optional<List<List<Card>>> parts = Combinations.partition(added, d, config.aceMode());
            if (parts.isEmpty()) {
                return BuildPlan.reject(RejectReason.BUILD_SUM_MISMATCH);
            }
            groups = parts.get().size();
        } else {
            if (existing.ownerSeat() != seat) {
                return BuildPlan.reject(RejectReason.NOT_BUILD_OWNER);
            }
            if (d < existing.value()) {
                return BuildPlan.reject(RejectReason.BUILD_VALUE_DECREASE);
            }
            if (d == existing.value()) {
                // 加一组同点数的牌
                Optional<List<List<Card>>> parts = Combinations.partition(added, d, config.aceMode());
                if (parts.isEmpty()) {
                    return BuildPlan.reject(RejectReason.BUILD_SUM_MISMATCH);
                }
                groups = existing.groups() + parts.get().size();
            } else {
                // 提高点数：只有单组墩可以
                if (existing.groups() > 1) {
                    return BuildPlan.reject(RejectReason.COMPOUND_BUILD_LOCKED);
                }
                if (!Combinations.canSumTo(added, d - existing.value(), config.aceMode())) {
                    return BuildPlan.reject(RejectReason.BUILD_SUM_MISMATCH);
                }
                groups = 1;
            }
        }

        if (!holdsValue(p.getHand(), played, d)) {
            return BuildPlan.reject(RejectReason.NO_CAPTURING_CARD);
        }
        return new BuildPlan(null, played, sel.loose(), existing, groups);
    }

    /* =========================
     * 内部：回合与轮次推进
     * ========================= */

    private void finishMove(CasinoState s, int seat, boolean endsTurn) {
        s.setLastMoverSeat(seat);
        if (!endsTurn) {
            return;
        }
        s.setFreeBuildUsed(false);
        s.setCurrentSeat(1 - seat);
        boolean handsEmpty = s.getPlayers().stream().allMatch(p -> p.getHand().isEmpty());
        if (!handsEmpty) {
            return;
        }
        if (!s.getDeck().isEmpty()) {
            dealHands(s);
        } else {
            endRound(s);
        }
    }

    private void startRound(CasinoState s, int round, int leadSeat) {
        s.setRound(round);
        s.setLeadSeat(leadSeat);
        s.setCurrentSeat(leadSeat);
        for (PlayerState p : s.getPlayers()) {
            p.getHand().clear();
            p.getCaptured().clear();
        }
        s.setDeck(Deck.shuffled(s.getShuffleSeed(), round));
        s.setTable(Deck.draw(s.getDeck(), config.tableSize()));
        s.getBuilds().clear();
        s.setLastCapturerSeat(null);
        s.setLastMoverSeat(null);
        s.setFreeBuildUsed(false);
        dealHands(s);
        s.setPhase(round == 1 ? RoomPhase.ROUND1 : RoomPhase.ROUND2);
    }

    /** 先手方先拿牌；牌堆不足时两家平分剩余 */
    private void dealHands(CasinoState s) {
        int n = Math.min(config.handSize(), s.getDeck().size() / 2);
        for (int i = 0; i < 2; i++) {
            int seat = (s.getLeadSeat() + i) % 2;
            s.player(seat).getHand().addAll(Deck.draw(s.getDeck(), n));
        }
    }

    private void endRound(CasinoState s) {
        Integer collector = s.getLastCapturerSeat() != null ? s.getLastCapturerSeat() : s.getLastMoverSeat();
        if (collector != null) {
            PlayerState p = s.player(collector);
            p.getCaptured().addAll(s.getTable());
            for (Build b : s.getBuilds()) {
                p.getCaptured().addAll(b.cards());
            }
            s.getTable().clear();
            s.getBuilds().clear();
        }

        RoundResult result = computeScore(s);
        s.getRoundResults().add(result);
        for (int seat = 0; seat < s.getPlayers().size(); seat++) {
            PlayerState p = s.player(seat);
            p.setTotalScore(p.getTotalScore() + result.totalOf(seat));
        }

        if (s.getRound() < config.roundsPerGame()) {
            startRound(s, s.getRound() + 1, 1 - s.getLeadSeat());
            return;
        }
        s.setPhase(RoomPhase.FINISHED);
        s.setOutcome(determineWinner(s));
    }

    /* =========================
     * 内部工具
     * ========================= */

    private boolean capturesWith(int v, Selection sel) {
        for (Build b : sel.builds()) {
            if (b.value() != v) {
                return false;
            }
        }
        return sel.loose().isEmpty() || Combinations.partition(sel.loose(), v, config.aceMode()).isPresent();
    }

    /** 手牌中（排除 exclude 这张）是否有取值为 value 的牌 */
    private boolean holdsValue(List<Card> hand, Card exclude, int value) {
        for (Card c : hand) {
            if (!c.equals(exclude) && c.hasValue(value, config.aceMode())) {
                return true;
            }
        }
        return false;
    }

    private static void requireLegal(Optional<RejectReason> rejection) {
        rejection.ifPresent(r -> {
            throw new IllegalStateException("move must be validated before execution: " + r);
        });
    }

    /**
     * 桌面选择：散牌与墩。任一 id 不在桌面上时 resolve 返回 null。
     */
    private record Selection(List<Card> loose, List<Build> builds) {

        static Selection resolve(CasinoState s, List<String> ids) {
            List<Card> loose = new ArrayList<>();
            List<Build> builds = new ArrayList<>();
            for (String id : ids) {
                Optional<Card> card = s.looseCard(id);
                if (card.isPresent()) {
                    if (loose.contains(card.get())) {
                        return null;
                    }
                    loose.add(card.get());
                    continue;
                }
                Optional<Build> build = s.build(id);
                if (build.isEmpty() || builds.contains(build.get())) {
                    return null;
                }
                builds.add(build.get());
            }
            return new Selection(loose, builds);
        }
    }

    private record BuildPlan(RejectReason reason, Card played, List<Card> loose, Build existing, int groups) {

        static BuildPlan reject(RejectReason reason) {
            return new BuildPlan(reason, null, List.of(), null, 0);
        }

        Optional<RejectReason> rejection() {
            return Optional.ofNullable(reason);
        }
    }
}

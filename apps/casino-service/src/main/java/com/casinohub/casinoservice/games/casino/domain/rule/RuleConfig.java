package com.casinohub.casinoservice.games.casino.domain.rule;

import com.casinohub.casinoservice.games.casino.domain.enums.AceMode;
import com.casinohub.casinoservice.games.casino.domain.enums.BuildTurnPolicy;
import com.casinohub.casinoservice.games.casino.domain.model.Deck;

import java.util.Objects;

/**
 * 规则变体配置（规则引擎不依赖 Spring，由配置层转换后注入）。
 *
 * @param handSize             每次发到每人手上的张数
 * @param tableSize            每轮开始时翻到桌面的张数
 * @param roundsPerGame        每局轮数（1 或 2）
 * @param aceMode              A 的取值
 * @param opponentBuildCapture 对手能否收取他人的墩
 * @param buildTurnPolicy      造墩是否结束回合
 * @param scoring              计分表
 */
public record RuleConfig(int handSize,
                         int tableSize,
                         int roundsPerGame,
                         AceMode aceMode,
                         boolean opponentBuildCapture,
                         BuildTurnPolicy buildTurnPolicy,
                         ScoringTable scoring) {

    public RuleConfig {
        Objects.requireNonNull(aceMode, "aceMode");
        Objects.requireNonNull(buildTurnPolicy, "buildTurnPolicy");
        Objects.requireNonNull(scoring, "scoring");
        // 翻桌后剩余的牌要能两家平分
        if (handSize < 1 || tableSize < 0 || tableSize + 2 * handSize > Deck.SIZE || (Deck.SIZE - tableSize) % 2 != 0) {
            throw new IllegalArgumentException("invalid deal sizes: hand=" + handSize + ", table=" + tableSize);
        }
        if (roundsPerGame < 1 || roundsPerGame > 2) {
            throw new IllegalArgumentException("roundsPerGame must be 1 or 2");
        }
    }

    public static RuleConfig defaults() {
        return new RuleConfig(4, 4, 2, AceMode.BOTH, true, BuildTurnPolicy.ALWAYS_ENDS_TURN, ScoringTable.standard());
    }

    public RuleConfig withBuildTurnPolicy(BuildTurnPolicy policy) {
        return new RuleConfig(handSize, tableSize, roundsPerGame, aceMode, opponentBuildCapture, policy, scoring);
    }

    public RuleConfig withAceMode(AceMode mode) {
        return new RuleConfig(handSize, tableSize, roundsPerGame, mode, opponentBuildCapture, buildTurnPolicy, scoring);
    }

    public RuleConfig withOpponentBuildCapture(boolean allowed) {
        return new RuleConfig(handSize, tableSize, roundsPerGame, aceMode, allowed, buildTurnPolicy, scoring);
    }

    public RuleConfig withRoundsPerGame(int rounds) {
        return new RuleConfig(handSize, tableSize, rounds, aceMode, opponentBuildCapture, buildTurnPolicy, scoring);
    }

    /** 造墩允许声明的最大点数 */
    public int maxBuildValue() {
        return aceMode == AceMode.LOW ? 13 : 14;
    }
}

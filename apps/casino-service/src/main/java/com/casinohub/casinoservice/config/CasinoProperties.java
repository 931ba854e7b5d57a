package com.casinohub.casinoservice.config;

import com.casinohub.casinoservice.games.casino.domain.enums.AceMode;
import com.casinohub.casinoservice.games.casino.domain.enums.BuildTurnPolicy;
import com.casinohub.casinoservice.games.casino.domain.model.Card;
import com.casinohub.casinoservice.games.casino.domain.model.Suit;
import com.casinohub.casinoservice.games.casino.domain.rule.RuleConfig;
import com.casinohub.casinoservice.games.casino.domain.rule.ScoringTable;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * casino.* 配置项。
 */
@Data
@ConfigurationProperties(prefix = "casino")
public class CasinoProperties {

    private Rules rules = new Rules();
    private Log log = new Log();
    private Broadcast broadcast = new Broadcast();
    private Persistence persistence = new Persistence();
    private Reaper reaper = new Reaper();

    @Data
    public static class Rules {
        private int handSize = 4;
        private int tableSize = 4;
        private int roundsPerGame = 2;
        private AceMode aceMode = AceMode.BOTH;
        /** 对手能否收取他人的墩 */
        private boolean opponentBuildCapture = true;
        private BuildTurnPolicy buildTurnPolicy = BuildTurnPolicy.ALWAYS_ENDS_TURN;
        private Scoring scoring = new Scoring();

        public RuleConfig toRuleConfig() {
            return new RuleConfig(handSize, tableSize, roundsPerGame, aceMode, opponentBuildCapture,
                    buildTurnPolicy, scoring.toScoringTable());
        }
    }

    @Data
    public static class Scoring {
        private int acePoints = 1;
        /** 牌 id，如 10_diamonds */
        private String highCard = "10_diamonds";
        private int highCardPoints = 2;
        private String lowCard = "2_spades";
        private int lowCardPoints = 1;
        private int mostCardsPoints = 2;
        private Suit majoritySuit = Suit.SPADES;
        private int mostSuitPoints = 2;

        public ScoringTable toScoringTable() {
            return new ScoringTable(acePoints, Card.parse(highCard), highCardPoints, Card.parse(lowCard), lowCardPoints,
                    mostCardsPoints, majoritySuit, mostSuitPoints);
        }
    }

    @Data
    public static class Log {
        /** 每个房间内存中保留的日志条数 */
        private int retainedEntries = 512;
    }

    @Data
    public static class Broadcast {
        /** local | redis */
        private String mode = "local";
        private String channelPrefix = "casino:broadcast:";
    }

    @Data
    public static class Persistence {
        /** none | redis */
        private String mode = "none";
        private Duration roomTtl = Duration.ofHours(48);
    }

    @Data
    public static class Reaper {
        private Duration interval = Duration.ofMinutes(1);
    }
}

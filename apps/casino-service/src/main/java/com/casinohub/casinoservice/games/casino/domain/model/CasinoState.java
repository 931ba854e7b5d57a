package com.casinohub.casinoservice.games.casino.domain.model;

import com.casinohub.casinoservice.engine.core.GameState;
import com.casinohub.casinoservice.games.casino.domain.enums.RoomPhase;
import com.casinohub.casinoservice.games.casino.domain.rule.Outcome;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 房间对局状态：房间内的“单一事实来源”。
 * - 座位与手牌、桌面散牌与墩、牌堆余牌、收牌堆
 * - 当前行动座位、轮次、阶段、版本号
 * 设计说明
 * - 本类不做规则校验，规则在 rule 包；状态机在副本上修改后整体替换。
 * - 不含时间戳等不确定字段，保证同一动作序列回放得到相同状态。
 * - 任意时刻：牌堆 + 两家手牌 + 桌面散牌 + 墩内牌 + 两家收牌 = 52（未开局时为 0）。
 */
@Data
public class CasinoState implements GameState {

    private String roomId;
    private RoomPhase phase = RoomPhase.WAITING;
    /** 已接受动作数，与动作日志序号一致 */
    private long version;

    /** 座位，最多两人，下标即座位号 */
    private List<PlayerState> players = new ArrayList<>();
    private List<Card> deck = new ArrayList<>();
    private List<Card> table = new ArrayList<>();
    private List<Build> builds = new ArrayList<>();

    /** 当前行动座位 */
    private int currentSeat;
    /** 当前轮次（未开局为 0） */
    private int round;
    /** 本轮先手座位 */
    private int leadSeat;
    /**
     * 开局时确定的洗牌种子，后续每一轮的牌序都由它推出。
     * 随快照对外可见，客户端按日志回放跨轮时依赖它重现下一轮发牌；对手可据此推算之后各轮牌序。
     */
    private long shuffleSeed;
    /** 下一个墩 id 的序号 */
    private int nextBuildNo = 1;
    /** 本轮最后一次收牌的座位，无人收牌为 null */
    private Integer lastCapturerSeat;
    /** 最后一次行动的座位 */
    private Integer lastMoverSeat;
    /** 本回合是否已用过不结束回合的桌面造墩 */
    private boolean freeBuildUsed;

    private List<RoundResult> roundResults = new ArrayList<>();
    private Outcome outcome = Outcome.ONGOING;
    /** 最近一次被接受的动作摘要 */
    private String lastAction;
    private String abandonReason;

    public static CasinoState empty(String roomId) {
        CasinoState s = new CasinoState();
        s.setRoomId(roomId);
        return s;
    }

    public int seatOf(String playerId) {
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).getPlayerId().equals(playerId)) {
                return i;
            }
        }
        return -1;
    }

    public PlayerState player(int seat) {
        return players.get(seat);
    }

    public Optional<Card> looseCard(String cardId) {
        return table.stream().filter(c -> c.id().equals(cardId)).findFirst();
    }

    public Optional<Build> build(String buildId) {
        return builds.stream().filter(b -> b.id().equals(buildId)).findFirst();
    }

    /** 当前在场的牌总数（用于守恒校验） */
    public int cardsInPlay() {
        int n = deck.size() + table.size();
        for (Build b : builds) {
            n += b.cards().size();
        }
        for (PlayerState p : players) {
            n += p.getHand().size() + p.getCaptured().size();
        }
        return n;
    }

    /** 深拷贝：列表重建，Card/Build/RoundResult 为不可变 record，引用即可 */
    @Override
    public CasinoState copy() {
        CasinoState s = new CasinoState();
        s.roomId = roomId;
        s.phase = phase;
        s.version = version;
        for (PlayerState p : players) {
            s.players.add(p.copy());
        }
        s.deck = new ArrayList<>(deck);
        s.table = new ArrayList<>(table);
        s.builds = new ArrayList<>(builds);
        s.currentSeat = currentSeat;
        s.round = round;
        s.leadSeat = leadSeat;
        s.shuffleSeed = shuffleSeed;
        s.nextBuildNo = nextBuildNo;
        s.lastCapturerSeat = lastCapturerSeat;
        s.lastMoverSeat = lastMoverSeat;
        s.freeBuildUsed = freeBuildUsed;
        s.roundResults = new ArrayList<>(roundResults);
        s.outcome = outcome;
        s.lastAction = lastAction;
        s.abandonReason = abandonReason;
        return s;
    }
}

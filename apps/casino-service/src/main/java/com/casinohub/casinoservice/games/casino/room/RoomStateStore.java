package com.casinohub.casinoservice.games.casino.room;

import com.casinohub.casinoservice.common.GameError;
import com.casinohub.casinoservice.common.GameException;
import com.casinohub.casinoservice.games.casino.domain.action.AbandonAction;
import com.casinohub.casinoservice.games.casino.domain.action.GameAction;
import com.casinohub.casinoservice.games.casino.domain.dto.ActionLogRecord;
import com.casinohub.casinoservice.games.casino.domain.dto.RoomRecord;
import com.casinohub.casinoservice.games.casino.domain.enums.RoomPhase;
import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.log.ActionLog;
import com.casinohub.casinoservice.games.casino.log.ActionLogEntry;
import com.casinohub.casinoservice.platform.broadcast.BroadcastHub;
import com.casinohub.casinoservice.platform.transport.Envelope;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * 房间状态仓库：roomId -> 串行执行单元。
 *
 * submitAction 是唯一的修改入口，在房间锁内依次完成：
 * 校验并应用 → 版本 +1 → 追加一条日志 → 发布快照 → 广播 → 投递持久化写入。
 * 持久化在写线程上执行，不占用房间锁。
 * 不同房间之间互不阻塞；读快照不加锁。
 */
@Slf4j
public class RoomStateStore {

    private final Map<String, RoomActor> rooms = new ConcurrentHashMap<>();
    private final RoomStateMachine machine;
    private final ActionLog actionLog;
    private final BroadcastHub hub;
    private final RoomPersistence persistence;
    private final Clock clock;

    public RoomStateStore(RoomStateMachine machine, ActionLog actionLog, BroadcastHub hub,
                          RoomPersistence persistence, Clock clock) {
        this.machine = machine;
        this.actionLog = actionLog;
        this.hub = hub;
        this.persistence = persistence;
        this.clock = clock;
    }

    /**
     * 新建空房间（WAITING，版本 0）。
     *
     * @throws IllegalArgumentException roomId 已存在
     */
    public CasinoState createRoom(String roomId) {
        long now = clock.millis();
        RoomActor actor = new RoomActor(CasinoState.empty(roomId), now);
        if (rooms.putIfAbsent(roomId, actor) != null) {
            throw new IllegalArgumentException("room already exists: " + roomId);
        }
        persistence.saveRoom(actor.published(), now);
        log.info("房间创建: roomId={}", roomId);
        return actor.published().copy();
    }

    /**
     * 提交动作。同一房间内同一时刻只有一个动作在求值。
     *
     * @throws GameException ROOM_NOT_FOUND
     */
    public ActionResult submitAction(String roomId, GameAction action) {
        RoomActor actor = actorOf(roomId);
        actor.lock.lock();
        try {
            return applyLocked(roomId, actor, action);
        } finally {
            actor.lock.unlock();
        }
    }

    private ActionResult applyLocked(String roomId, RoomActor actor, GameAction action) {
        CasinoState current = actor.state();
        Transition t = machine.apply(current, action);
        if (!t.accepted()) {
            log.debug("动作被拒绝: roomId={}, type={}, reason={}", roomId, action.type(), t.reason());
            return ActionResult.Rejected.of(t.reason());
        }
        CasinoState next = t.state();
        long now = clock.millis();
        ActionLogEntry entry = actionLog.append(roomId, action, next.getVersion(), now);
        actor.commit(next, now);
        CasinoState snapshot = actor.published().copy();

        RoomEvent event = new RoomEvent(entry.actionType().name(), entry.payload(), entry.version(),
                StateChecksum.of(snapshot), snapshot);
        hub.publish(roomId, Envelope.of(t.messageType(), roomId, entry.sequence(), event, now));
        persistence.enqueue(entry, snapshot, actor.createdAt);

        log.debug("动作已接受: roomId={}, seq={}, type={}", roomId, entry.sequence(), entry.actionType());
        if (current.getPhase() != next.getPhase()) {
            log.info("房间阶段变更: roomId={}, {} -> {}, version={}",
                    roomId, current.getPhase(), next.getPhase(), next.getVersion());
        }
        return new ActionResult.Accepted(entry, snapshot);
    }

    /**
     * 把未结束的房间置为 ABANDONED（会话全部失效时由回收器调用）。
     */
    public ActionResult abandon(String roomId, String reason) {
        return submitAction(roomId, new AbandonAction(reason));
    }

    /**
     * 持房间锁重新判断 orphaned，仍成立时才置为 ABANDONED，判断与提交之间不会插入该房间的其它动作。
     *
     * @return 房间被置为 ABANDONED 时返回 true
     * @throws GameException ROOM_NOT_FOUND
     */
    public boolean abandonIf(String roomId, String reason, Predicate<CasinoState> orphaned) {
        RoomActor actor = actorOf(roomId);
        actor.lock.lock();
        try {
            if (!orphaned.test(actor.state().copy())) {
                log.debug("房间重新检查后仍有玩家在线，放弃置为 ABANDONED: roomId={}", roomId);
                return false;
            }
            return applyLocked(roomId, actor, new AbandonAction(reason)).accepted();
        } finally {
            actor.lock.unlock();
        }
    }

    /**
     * 当前快照的副本（不会看到修改到一半的状态）。
     *
     * @throws GameException ROOM_NOT_FOUND
     */
    public CasinoState getSnapshot(String roomId) {
        return actorOf(roomId).published().copy();
    }

    /**
     * 用房间完整日志从空房间重放，结果应与当前快照一致。
     * 内存窗口已截断时改用持久化日志，持久化日志必须连续覆盖到当前版本。
     *
     * @throws GameException ROOM_NOT_FOUND；完整日志已不可得（未启用持久化或持久化尚未追上）时为 PERSISTENCE_UNAVAILABLE，
     *                       调用方应改用 {@link #getSnapshot}
     */
    public CasinoState replay(String roomId) {
        RoomActor actor = actorOf(roomId);
        List<ActionLogEntry> entries = actionLog.fullLog(roomId);
        if (entries == null) {
            long version = actor.published().getVersion();
            entries = contiguousPrefix(toEntries(persistence.loadLog(roomId)));
            long last = entries.isEmpty() ? 0 : entries.get(entries.size() - 1).sequence();
            if (last < version) {
                throw new GameException(GameError.PERSISTENCE_UNAVAILABLE,
                        "full action log of room " + roomId + " is no longer available (version=" + version
                                + ", durable=" + last + "), use the snapshot");
            }
            entries = entries.subList(0, Math.toIntExact(version));
        }
        return machine.replay(roomId, entries);
    }

    public boolean exists(String roomId) {
        return rooms.containsKey(roomId);
    }

    public Set<String> roomIds() {
        return Set.copyOf(rooms.keySet());
    }

    /**
     * 移除已结束（FINISHED/ABANDONED）或已无人的等待房间：闲置超过 idleTtl 后归档内存日志并删除持久化记录。
     *
     * @return 被移除的房间
     */
    public List<String> evictIdle(Duration idleTtl) {
        long now = clock.millis();
        List<String> evicted = new ArrayList<>();
        for (Map.Entry<String, RoomActor> e : rooms.entrySet()) {
            RoomActor actor = e.getValue();
            CasinoState state = actor.published();
            boolean ended = state.getPhase().terminal()
                    || (state.getPhase() == RoomPhase.WAITING && state.getPlayers().isEmpty());
            if (ended && now - actor.lastActivity() > idleTtl.toMillis()
                    && rooms.remove(e.getKey(), actor)) {
                actionLog.archive(e.getKey());
                hub.dropRoom(e.getKey());
                persistence.purge(e.getKey());
                evicted.add(e.getKey());
            }
        }
        if (!evicted.isEmpty()) {
            log.info("移除闲置房间: {}", evicted);
        }
        return evicted;
    }

    /* =========================
     * 内部工具
     * ========================= */

    private RoomActor actorOf(String roomId) {
        RoomActor actor = rooms.get(roomId);
        if (actor != null) {
            return actor;
        }
        return restore(roomId).orElseThrow(() -> GameException.roomNotFound(roomId));
    }

    /**
     * 内存中没有的房间：按持久化日志重放重建。
     *
     * 只采用从 1 开始连续的日志前缀（写入失败留下的断档之后的条目丢弃），
     * 重放后的版本必须等于前缀最后一个序号，否则视为持久化数据不可用。
     */
    private Optional<RoomActor> restore(String roomId) {
        if (!persistence.enabled()) {
            return Optional.empty();
        }
        Optional<RoomRecord> record;
        List<ActionLogEntry> stored;
        try {
            record = persistence.loadRoom(roomId);
            if (record.isEmpty()) {
                return Optional.empty();
            }
            stored = toEntries(persistence.loadLog(roomId));
        } catch (RuntimeException e) {
            log.warn("{}: 读取持久化房间失败: roomId={}", GameError.PERSISTENCE_UNAVAILABLE, roomId, e);
            return Optional.empty();
        }

        List<ActionLogEntry> entries = contiguousPrefix(stored);
        long lastSequence = entries.isEmpty() ? 0 : entries.get(entries.size() - 1).sequence();
        CasinoState state;
        try {
            state = machine.replay(roomId, entries);
        } catch (IllegalStateException e) {
            log.warn("{}: 持久化日志无法重放: roomId={}", GameError.PERSISTENCE_UNAVAILABLE, roomId, e);
            return Optional.empty();
        }
        if (state.getVersion() != lastSequence) {
            log.warn("{}: 重放版本与日志序号不一致: roomId={}, version={}, lastSequence={}",
                    GameError.PERSISTENCE_UNAVAILABLE, roomId, state.getVersion(), lastSequence);
            return Optional.empty();
        }
        if (entries.size() < stored.size()) {
            log.warn("{}: 持久化日志存在断档，丢弃断档之后的条目: roomId={}, kept={}, dropped={}",
                    GameError.PERSISTENCE_UNAVAILABLE, roomId, entries.size(), stored.size() - entries.size());
            try {
                persistence.truncateLog(roomId, lastSequence);
            } catch (RuntimeException e) {
                log.warn("{}: 清理断档日志失败: roomId={}", GameError.PERSISTENCE_UNAVAILABLE, roomId, e);
                return Optional.empty();
            }
        }

        RoomActor restored = new RoomActor(state, record.get().getCreatedAt());
        // 先持锁再注册，日志恢复完成前其他线程的提交会等待
        restored.lock.lock();
        try {
            RoomActor existing = rooms.putIfAbsent(roomId, restored);
            if (existing != null) {
                return Optional.of(existing);
            }
            actionLog.restore(roomId, entries);
        } finally {
            restored.lock.unlock();
        }
        log.info("房间从持久化日志恢复: roomId={}, version={}", roomId, state.getVersion());
        return Optional.of(restored);
    }

    /**
     * 从序号 1 开始连续的部分（入参按序号升序）。
     */
    static List<ActionLogEntry> contiguousPrefix(List<ActionLogEntry> sorted) {
        List<ActionLogEntry> out = new ArrayList<>(sorted.size());
        long expected = 1;
        for (ActionLogEntry e : sorted) {
            if (e.sequence() != expected) {
                break;
            }
            out.add(e);
            expected++;
        }
        return out;
    }

    private static List<ActionLogEntry> toEntries(List<ActionLogRecord> records) {
        List<ActionLogEntry> out = new ArrayList<>(records.size());
        for (ActionLogRecord r : records) {
            out.add(r.toEntry());
        }
        return out;
    }
}

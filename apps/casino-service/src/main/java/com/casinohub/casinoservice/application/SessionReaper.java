package com.casinohub.casinoservice.application;

import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.domain.model.PlayerState;
import com.casinohub.casinoservice.games.casino.room.RoomPersistence;
import com.casinohub.casinoservice.games.casino.room.RoomStateStore;
import com.casinohub.session.SessionRegistry;
import com.casinohub.session.model.GameSession;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 周期回收任务：
 * 1. 过期超过 TTL 未心跳的会话；
 * 2. 未结束且所有在座玩家都没有有效会话的房间置为 ABANDONED；
 * 3. 移除闲置的已结束房间；
 * 4. 重试失败的持久化写入。
 *
 * 每一步都可以直接调用 {@link #runOnce()}，测试配合可控时钟使用，不依赖真实等待。
 */
@Slf4j
public class SessionReaper {

    static final String ABANDON_REASON = "all sessions expired";

    private final SessionRegistry sessions;
    private final RoomStateStore store;
    private final RoomPersistence persistence;
    private final Duration roomTtl;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private volatile ScheduledFuture<?> task;

    public SessionReaper(SessionRegistry sessions, RoomStateStore store, RoomPersistence persistence,
                         Duration roomTtl, ScheduledExecutorService scheduler, Duration interval) {
        this.sessions = sessions;
        this.store = store;
        this.persistence = persistence;
        this.roomTtl = roomTtl;
        this.scheduler = scheduler;
        this.interval = interval;
    }

    public void start() {
        long period = interval.toMillis();
        task = scheduler.scheduleWithFixedDelay(this::runSafely, period, period, TimeUnit.MILLISECONDS);
        log.info("会话回收任务已启动: interval={}", interval);
    }

    public void stop() {
        ScheduledFuture<?> t = task;
        if (t != null) {
            t.cancel(false);
        }
    }

    /**
     * 执行一轮回收。
     *
     * @return 本轮被置为 ABANDONED 的房间数
     */
    public int runOnce() {
        List<GameSession> expired = sessions.reap();
        int abandoned = 0;
        for (String roomId : store.roomIds()) {
            CasinoState state = store.getSnapshot(roomId);
            if (state.getPhase().terminal() || state.getPlayers().isEmpty()) {
                continue;
            }
            // 快照只做初筛，持房间锁后再确认一次无有效会话
            if (!hasLiveSession(roomId, state)
                    && store.abandonIf(roomId, ABANDON_REASON, current -> !hasLiveSession(roomId, current))) {
                abandoned++;
                log.info("房间内已无有效会话，置为 ABANDONED: roomId={}, phase={}", roomId, state.getPhase());
            }
        }
        store.evictIdle(roomTtl);
        persistence.flush();
        if (!expired.isEmpty() || abandoned > 0) {
            log.info("回收完成: expiredSessions={}, abandonedRooms={}", expired.size(), abandoned);
        }
        return abandoned;
    }

    private boolean hasLiveSession(String roomId, CasinoState state) {
        for (PlayerState p : state.getPlayers()) {
            if (sessions.liveSession(p.getPlayerId(), roomId).isPresent()) {
                return true;
            }
        }
        return false;
    }

    private void runSafely() {
        try {
            runOnce();
        } catch (Exception e) {
            log.error("回收任务执行失败", e);
        }
    }
}

package com.casinohub.casinoservice.games.casino.room;

import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个房间的串行执行单元。
 * state 只在持有 lock 时读写；published 为最近一次提交的副本，读快照不需要加锁。
 */
final class RoomActor {

    final ReentrantLock lock = new ReentrantLock();
    final long createdAt;
    private CasinoState state;
    private volatile CasinoState published;
    private volatile long lastActivity;

    RoomActor(CasinoState initial, long createdAt) {
        this.createdAt = createdAt;
        this.state = initial;
        this.published = initial.copy();
        this.lastActivity = createdAt;
    }

    CasinoState state() {
        return state;
    }

    void commit(CasinoState next, long now) {
        this.state = next;
        this.published = next.copy();
        this.lastActivity = now;
    }

    CasinoState published() {
        return published;
    }

    long lastActivity() {
        return lastActivity;
    }
}

package com.casinohub.casinoservice.games.casino.domain.enums;

public enum RoomPhase {

    WAITING,    // 等待入座与准备
    DEALING,    // 发牌中（两人都准备后的瞬时阶段）
    ROUND1,     // 第一轮
    ROUND2,     // 第二轮
    FINISHED,   // 已结束
    ABANDONED;  // 已放弃（玩家全部断线或主动终止）

    public boolean inPlay() {
        return this == ROUND1 || this == ROUND2;
    }

    public boolean terminal() {
        return this == FINISHED || this == ABANDONED;
    }
}

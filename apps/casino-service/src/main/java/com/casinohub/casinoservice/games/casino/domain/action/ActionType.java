package com.casinohub.casinoservice.games.casino.domain.action;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;

/**
 * 动作类型与规范载荷（JSON，字段排序）之间的映射。
 */
public enum ActionType {
    JOIN(JoinAction.class),
    READY(ReadyAction.class),
    LEAVE(LeaveAction.class),
    ABANDON(AbandonAction.class),
    CAPTURE(CaptureMove.class),
    BUILD(BuildMove.class),
    TRAIL(TrailMove.class);

    private final Class<? extends GameAction> actionClass;

    ActionType(Class<? extends GameAction> actionClass) {
        this.actionClass = actionClass;
    }

    public Class<? extends GameAction> actionClass() {
        return actionClass;
    }

    /** 动作的规范载荷 */
    public static String canonicalPayload(GameAction action) {
        return JSON.toJSONString(action, JSONWriter.Feature.MapSortField, JSONWriter.Feature.WriteNulls);
    }

    /**
     * 从规范载荷还原动作。
     *
     * @throws IllegalArgumentException 载荷无法解析
     */
    public GameAction parse(String payload) {
        GameAction action = JSON.parseObject(payload, actionClass);
        if (action == null) {
            throw new IllegalArgumentException("empty payload for " + this);
        }
        return action;
    }
}

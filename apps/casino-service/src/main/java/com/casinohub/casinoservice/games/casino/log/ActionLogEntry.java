package com.casinohub.casinoservice.games.casino.log;

import com.casinohub.casinoservice.games.casino.domain.action.ActionType;
import com.casinohub.casinoservice.games.casino.domain.action.GameAction;

/**
 * 动作日志条目。
 *
 * @param roomId     房间 ID
 * @param sequence   房间内从 1 开始严格递增、无空洞的序号
 * @param actionType 动作类型
 * @param payload    规范载荷（JSON）
 * @param version    动作应用后的状态版本（与 sequence 相同）
 * @param timestamp  提交时间（epoch 毫秒）
 * @param action     已解析的动作
 */
public record ActionLogEntry(String roomId,
                             long sequence,
                             ActionType actionType,
                             String payload,
                             long version,
                             long timestamp,
                             GameAction action) {

    public static ActionLogEntry of(String roomId, long sequence, GameAction action, long version, long timestamp) {
        return new ActionLogEntry(roomId, sequence, action.type(), ActionType.canonicalPayload(action),
                version, timestamp, action);
    }
}

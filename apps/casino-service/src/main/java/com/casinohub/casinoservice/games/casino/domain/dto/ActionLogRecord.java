package com.casinohub.casinoservice.games.casino.domain.dto;

import com.casinohub.casinoservice.games.casino.domain.action.ActionType;
import com.casinohub.casinoservice.games.casino.log.ActionLogEntry;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 持久化用的动作日志记录：action_log(room_id, sequence, action_type, payload, version, created_at)。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActionLogRecord {
    private String roomId;
    private long sequence;
    private String actionType;
    /** 规范载荷（JSON） */
    private String payload;
    private long version;
    private long createdAt;

    public static ActionLogRecord from(ActionLogEntry e) {
        return new ActionLogRecord(e.roomId(), e.sequence(), e.actionType().name(), e.payload(), e.version(), e.timestamp());
    }

    /**
     * 还原为日志条目（重新解析规范载荷）。
     *
     * @throws IllegalArgumentException 类型或载荷无法解析
     */
    public ActionLogEntry toEntry() {
        ActionType type = ActionType.valueOf(actionType);
        return new ActionLogEntry(roomId, sequence, type, payload, version, createdAt, type.parse(payload));
    }
}

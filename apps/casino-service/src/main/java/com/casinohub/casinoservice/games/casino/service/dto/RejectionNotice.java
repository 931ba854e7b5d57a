package com.casinohub.casinoservice.games.casino.service.dto;

import com.casinohub.casinoservice.common.GameError;
import com.casinohub.casinoservice.games.casino.room.ActionResult;

/**
 * 拒绝通知，只发给提交动作的连接。
 */
public record RejectionNotice(GameError error, String reason, String message) {

    public static RejectionNotice of(ActionResult.Rejected rejected) {
        return new RejectionNotice(rejected.error(), rejected.reason().name(), rejected.message());
    }
}

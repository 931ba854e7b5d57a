package com.casinohub.casinoservice.games.casino.room;

import com.casinohub.casinoservice.common.GameError;
import com.casinohub.casinoservice.games.casino.domain.model.CasinoState;
import com.casinohub.casinoservice.games.casino.domain.rule.RejectReason;
import com.casinohub.casinoservice.games.casino.log.ActionLogEntry;

/**
 * 动作提交结果：接受或拒绝，调用方总能拿到结构化结果。
 */
public sealed interface ActionResult permits ActionResult.Accepted, ActionResult.Rejected {

    boolean accepted();

    /**
     * @param entry    追加的日志条目
     * @param snapshot 应用后的状态快照
     */
    record Accepted(ActionLogEntry entry, CasinoState snapshot) implements ActionResult {
        @Override
        public boolean accepted() {
            return true;
        }
    }

    record Rejected(GameError error, RejectReason reason, String message) implements ActionResult {

        public static Rejected of(RejectReason reason) {
            return new Rejected(reason.error(), reason, reason.message());
        }

        @Override
        public boolean accepted() {
            return false;
        }
    }
}

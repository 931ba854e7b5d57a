package com.casinohub.casinoservice.games.casino.domain.rule;

import com.casinohub.casinoservice.common.GameError;

/**
 * 动作被拒绝的具体原因。message 为稳定的对外文案。
 */
public enum RejectReason {
    // 房间与回合
    ROOM_FULL(GameError.ROOM_FULL, "room is full"),
    ALREADY_SEATED(GameError.VALIDATION_REJECTED, "player is already seated"),
    PLAYER_NOT_SEATED(GameError.VALIDATION_REJECTED, "player is not seated in this room"),
    WRONG_PHASE(GameError.ILLEGAL_PHASE, "action is not allowed in the current phase"),
    NOT_YOUR_TURN(GameError.VALIDATION_REJECTED, "not your turn"),
    SESSION_EXPIRED(GameError.SESSION_EXPIRED, "session expired"),
    MALFORMED_MOVE(GameError.VALIDATION_REJECTED, "malformed move"),

    // 选牌
    CARD_NOT_IN_HAND(GameError.VALIDATION_REJECTED, "card is not in hand"),
    EMPTY_SELECTION(GameError.VALIDATION_REJECTED, "selection is empty"),
    TARGET_NOT_ON_TABLE(GameError.VALIDATION_REJECTED, "target is not on the table"),

    // 收牌
    CAPTURE_SUM_MISMATCH(GameError.VALIDATION_REJECTED, "selected cards do not add up to the played card"),
    BUILD_NOT_CAPTURABLE(GameError.VALIDATION_REJECTED, "build cannot be captured by this player"),

    // 造墩
    DECLARED_VALUE_OUT_OF_RANGE(GameError.VALIDATION_REJECTED, "declared value is out of range"),
    BUILD_EQUALS_PLAYED_CARD(GameError.VALIDATION_REJECTED, "build value cannot equal the played card"),
    BUILD_SUM_MISMATCH(GameError.VALIDATION_REJECTED, "cards do not combine to the declared value"),
    NO_CAPTURING_CARD(GameError.VALIDATION_REJECTED, "no capturing card in hand"),
    NOT_BUILD_OWNER(GameError.VALIDATION_REJECTED, "only the owner may extend a build"),
    MULTIPLE_BUILDS_SELECTED(GameError.VALIDATION_REJECTED, "only one build can be extended at a time"),
    BUILD_VALUE_DECREASE(GameError.VALIDATION_REJECTED, "a build cannot be lowered"),
    COMPOUND_BUILD_LOCKED(GameError.VALIDATION_REJECTED, "a multiple build cannot be raised"),
    TABLE_BUILD_NOT_ALLOWED(GameError.VALIDATION_REJECTED, "building from table cards only is not allowed"),
    FREE_BUILD_USED(GameError.VALIDATION_REJECTED, "table build already used this turn"),

    // 弃牌
    MUST_ADDRESS_OWN_BUILD(GameError.VALIDATION_REJECTED, "cannot trail while holding a card that captures your build");

    private final GameError error;
    private final String message;

    RejectReason(GameError error, String message) {
        this.error = error;
        this.message = message;
    }

    public GameError error() {
        return error;
    }

    public String message() {
        return message;
    }
}

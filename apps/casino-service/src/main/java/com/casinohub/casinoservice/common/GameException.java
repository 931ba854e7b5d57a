package com.casinohub.casinoservice.common;

import lombok.Getter;

/**
 * 没有结构化结果的门面操作（建房、入座、查询、重连等）以此异常报告错误。
 */
@Getter
public class GameException extends RuntimeException {

    private final GameError error;

    public GameException(GameError error, String message) {
        super(message);
        this.error = error;
    }

    public static GameException roomNotFound(String roomId) {
        return new GameException(GameError.ROOM_NOT_FOUND, "room not found: " + roomId);
    }
}

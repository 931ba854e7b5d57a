package com.casinohub.casinoservice.games.casino.domain.enums;

/**
 * A 的取值方式：只算 1、只算 14、或 1/14 任选。
 */
public enum AceMode {
    LOW,
    HIGH,
    BOTH
}

package com.casinohub.casinoservice.games.casino.domain.action;

/**
 * 房间内可被接受并记入动作日志的规范动作。
 *
 * 所有随机性（洗牌种子）在提交前确定并写入动作本身，回放只依赖动作序列。
 */
public sealed interface GameAction permits JoinAction, ReadyAction, LeaveAction, AbandonAction, Move {

    ActionType type();
}

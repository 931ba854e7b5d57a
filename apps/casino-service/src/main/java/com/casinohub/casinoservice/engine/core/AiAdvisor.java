package com.casinohub.casinoservice.engine.core;

/**
 * 提示建议器：根据当前状态给出一个建议的走法。
 * - budgetMs：时间预算（毫秒），实现可以据此限制搜索范围。
 * - 泛型 S、C 保持与具体游戏解耦。
 */
public interface AiAdvisor<S extends GameState, C> {

    C suggest(S state, long budgetMs);
}

package com.casinohub.casinoservice.engine.core;

/**
 * 游戏状态快照接口。
 * - 必须可 copy：规则引擎在副本上应用动作，读者拿到的已发布快照不会被后续动作修改。
 * - 回放、提示搜索同样基于副本进行。
 */
public interface GameState {

    /**
     * 返回当前状态的深拷贝快照。
     */
    GameState copy();
}

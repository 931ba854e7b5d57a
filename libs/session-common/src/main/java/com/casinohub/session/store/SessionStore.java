package com.casinohub.session.store;

import com.casinohub.session.model.GameSession;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 会话存储端口。
 * - 只做数据存取，不承载过期、顶替等规则（规则在 {@link com.casinohub.session.SessionRegistry}）；
 * - 默认实现为内存，配置 session.redis.host 后切换为 Redis。
 */
public interface SessionStore {

    /**
     * 保存或覆盖会话。
     *
     * @param session   会话
     * @param retention 记录保留时长（Redis 实现用作 key TTL）
     */
    void save(GameSession session, Duration retention);

    Optional<GameSession> findByToken(String token);

    /**
     * 查询 (roomId, playerId) 当前绑定的令牌。
     */
    Optional<String> findBoundToken(String roomId, String playerId);

    /**
     * 绑定 (roomId, playerId) -> token，覆盖旧绑定。
     */
    void bind(String roomId, String playerId, String token, Duration retention);

    /**
     * 仅当当前绑定仍是该 token 时解除绑定。
     */
    void unbind(String roomId, String playerId, String token);

    List<GameSession> findByRoom(String roomId);

    List<GameSession> findAll();

    void delete(String token);
}

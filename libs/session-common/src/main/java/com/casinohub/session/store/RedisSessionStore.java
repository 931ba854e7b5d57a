package com.casinohub.session.store;

import com.alibaba.fastjson2.JSON;
import com.casinohub.session.model.GameSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 基于 Redis 的会话存储，键空间如下（前缀见常量）：
 * - session:game:token:{token}              -> GameSession JSON
 * - session:game:room:{roomId}              -> Set<token>
 * - session:game:bind:{roomId}:{playerId}   -> token
 * - session:game:all                        -> Set<token>（供回收器遍历）
 */
@Slf4j
public class RedisSessionStore implements SessionStore {

    /** Redis Key 前缀：会话详情（按 token 存储） */
    private static final String TOKEN_KEY_PREFIX = "session:game:token:";
    /** Redis Key 前缀：某房间下的令牌集合 */
    private static final String ROOM_KEY_PREFIX = "session:game:room:";
    /** Redis Key 前缀：(房间, 玩家) 当前绑定的令牌 */
    private static final String BIND_KEY_PREFIX = "session:game:bind:";
    /** 全部令牌集合 */
    private static final String ALL_KEY = "session:game:all";

    private final RedisTemplate<String, String> redis;

    public RedisSessionStore(RedisTemplate<String, String> redis) {
        this.redis = redis;
    }

    @Override
    public void save(GameSession session, Duration retention) {
        redis.opsForValue().set(TOKEN_KEY_PREFIX + session.getToken(), JSON.toJSONString(session), retention);
        redis.opsForSet().add(ROOM_KEY_PREFIX + session.getRoomId(), session.getToken());
        redis.opsForSet().add(ALL_KEY, session.getToken());
        log.debug("保存会话: playerId={}, roomId={}, status={}", session.getPlayerId(), session.getRoomId(), session.getStatus());
    }

    @Override
    public Optional<GameSession> findByToken(String token) {
        String json = redis.opsForValue().get(TOKEN_KEY_PREFIX + token);
        if (json == null || json.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(JSON.parseObject(json, GameSession.class));
    }

    @Override
    public Optional<String> findBoundToken(String roomId, String playerId) {
        return Optional.ofNullable(redis.opsForValue().get(bindKey(roomId, playerId)));
    }

    @Override
    public void bind(String roomId, String playerId, String token, Duration retention) {
        redis.opsForValue().set(bindKey(roomId, playerId), token, retention);
    }

    @Override
    public void unbind(String roomId, String playerId, String token) {
        String key = bindKey(roomId, playerId);
        if (token.equals(redis.opsForValue().get(key))) {
            redis.delete(key);
        }
    }

    @Override
    public List<GameSession> findByRoom(String roomId) {
        return load(ROOM_KEY_PREFIX + roomId, redis.opsForSet().members(ROOM_KEY_PREFIX + roomId));
    }

    @Override
    public List<GameSession> findAll() {
        return load(ALL_KEY, redis.opsForSet().members(ALL_KEY));
    }

    @Override
    public void delete(String token) {
        findByToken(token).ifPresent(s -> redis.opsForSet().remove(ROOM_KEY_PREFIX + s.getRoomId(), token));
        redis.opsForSet().remove(ALL_KEY, token);
        redis.delete(TOKEN_KEY_PREFIX + token);
    }

    private List<GameSession> load(String setKey, Set<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return Collections.emptyList();
        }
        List<GameSession> result = new ArrayList<>();
        for (String token : tokens) {
            Optional<GameSession> s = findByToken(token);
            if (s.isPresent()) {
                result.add(s.get());
            } else {
                // 详情已过期，清理脏数据
                redis.opsForSet().remove(setKey, token);
            }
        }
        return result;
    }

    private static String bindKey(String roomId, String playerId) {
        return BIND_KEY_PREFIX + roomId + ":" + playerId;
    }
}

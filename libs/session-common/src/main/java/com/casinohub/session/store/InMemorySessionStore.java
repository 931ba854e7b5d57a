package com.casinohub.session.store;

import com.casinohub.session.model.GameSession;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单实例内存会话存储。返回的都是副本，调用方修改后需 save 回写。
 */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, GameSession> byToken = new ConcurrentHashMap<>();
    /** roomId + "|" + playerId -> token */
    private final Map<String, String> bindings = new ConcurrentHashMap<>();

    @Override
    public void save(GameSession session, Duration retention) {
        byToken.put(session.getToken(), session.toBuilder().build());
    }

    @Override
    public Optional<GameSession> findByToken(String token) {
        GameSession s = byToken.get(token);
        return Optional.ofNullable(s).map(v -> v.toBuilder().build());
    }

    @Override
    public Optional<String> findBoundToken(String roomId, String playerId) {
        return Optional.ofNullable(bindings.get(bindingKey(roomId, playerId)));
    }

    @Override
    public void bind(String roomId, String playerId, String token, Duration retention) {
        bindings.put(bindingKey(roomId, playerId), token);
    }

    @Override
    public void unbind(String roomId, String playerId, String token) {
        bindings.remove(bindingKey(roomId, playerId), token);
    }

    @Override
    public List<GameSession> findByRoom(String roomId) {
        List<GameSession> out = new ArrayList<>();
        for (GameSession s : byToken.values()) {
            if (roomId.equals(s.getRoomId())) {
                out.add(s.toBuilder().build());
            }
        }
        return out;
    }

    @Override
    public List<GameSession> findAll() {
        List<GameSession> out = new ArrayList<>(byToken.size());
        byToken.values().forEach(s -> out.add(s.toBuilder().build()));
        return out;
    }

    @Override
    public void delete(String token) {
        byToken.remove(token);
    }

    private static String bindingKey(String roomId, String playerId) {
        return roomId + "|" + playerId;
    }
}

package com.casinohub.session;

import com.casinohub.session.event.SessionEventNotifier;
import com.casinohub.session.event.SessionInvalidatedEvent;
import com.casinohub.session.event.SessionInvalidatedEvent.EventType;
import com.casinohub.session.model.GameSession;
import com.casinohub.session.model.SessionStatus;
import com.casinohub.session.store.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 对局会话注册表。
 *
 * 职责：
 * - 为 (玩家, 房间) 签发令牌；同一玩家在同一房间再次建立会话时，旧令牌标记为 KICKED 并发出 SUPERSEDED 事件。
 * - 心跳续期；校验令牌时按 TTL 惰性判定过期，不依赖回收器是否已经运行。
 * - 定期回收：把超过 TTL 未心跳的 ACTIVE 会话标记为 EXPIRED，并清理已失效的历史记录。
 *
 * 所有写操作串行执行，保证顶替与回收不会交错。
 */
@Slf4j
public class SessionRegistry {

    /** 会话默认 TTL（24 小时） */
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    /** 令牌随机字节数 */
    private static final int TOKEN_BYTES = 24;

    private final SessionStore store;
    private final SessionEventNotifier notifier;
    private final Clock clock;
    private final Duration ttl;
    private final SecureRandom random = new SecureRandom();
    private final Object lock = new Object();

    public SessionRegistry(SessionStore store, SessionEventNotifier notifier, Clock clock, Duration ttl) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ttl = (ttl == null || ttl.isZero() || ttl.isNegative()) ? DEFAULT_TTL : ttl;
    }

    /**
     * 为玩家在房间内创建新会话。若已有 ACTIVE 会话，将其标记为 KICKED 并通知（重复连接）。
     *
     * @return 新会话（状态 ACTIVE）
     */
    public GameSession createSession(String playerId, String roomId) {
        requireText(playerId, "playerId");
        requireText(roomId, "roomId");

        GameSession created;
        GameSession kicked = null;
        synchronized (lock) {
            long now = clock.millis();
            Optional<GameSession> previous = store.findBoundToken(roomId, playerId).flatMap(store::findByToken);
            if (previous.isPresent() && previous.get().isActive()) {
                kicked = previous.get();
                kicked.setStatus(SessionStatus.KICKED);
                store.save(kicked, retention());
            }

            created = GameSession.builder()
                    .token(newToken())
                    .playerId(playerId)
                    .roomId(roomId)
                    .createdAt(now)
                    .lastHeartbeat(now)
                    .status(SessionStatus.ACTIVE)
                    .build();
            store.save(created, retention());
            store.bind(roomId, playerId, created.getToken(), retention());
        }

        if (kicked != null) {
            log.info("同一玩家重复连接，旧会话被顶替: playerId={}, roomId={}", playerId, roomId);
            notifier.notify(SessionInvalidatedEvent.of(kicked.getToken(), playerId, roomId,
                    EventType.SUPERSEDED, clock.millis(), "duplicate connection"));
        }
        log.debug("创建会话: playerId={}, roomId={}", playerId, roomId);
        return created;
    }

    /**
     * 心跳续期。
     *
     * @throws SessionExpiredException 令牌不存在、已失效或已超过 TTL
     */
    public GameSession heartbeat(String token) {
        requireLive(token);
        synchronized (lock) {
            // 校验与续期之间可能被顶替或回收，重新读取
            GameSession current = store.findByToken(token)
                    .filter(GameSession::isActive)
                    .orElseThrow(() -> new SessionExpiredException(token, "session is no longer active"));
            current.setLastHeartbeat(clock.millis());
            store.save(current, retention());
            return current;
        }
    }

    /**
     * 校验令牌并返回其绑定的会话。
     *
     * @throws SessionExpiredException 令牌不存在、已失效或已超过 TTL
     */
    public GameSession resolve(String token) {
        return requireLive(token);
    }

    /**
     * 查询玩家在房间内的有效会话（不抛异常）。
     */
    public Optional<GameSession> liveSession(String playerId, String roomId) {
        return store.findBoundToken(roomId, playerId)
                .flatMap(store::findByToken)
                .filter(s -> s.isActive() && !isStale(s));
    }

    /**
     * 查询房间内所有会话（含非 ACTIVE 的历史记录）。
     */
    public List<GameSession> sessionsOfRoom(String roomId) {
        if (StringUtils.isBlank(roomId)) {
            return List.of();
        }
        return store.findByRoom(roomId);
    }

    /**
     * 玩家主动离开：会话置为 CLOSED。
     *
     * @return 被关闭的会话；令牌本就无效时返回 empty
     */
    public Optional<GameSession> close(String token) {
        if (StringUtils.isBlank(token)) {
            return Optional.empty();
        }
        GameSession closed;
        synchronized (lock) {
            Optional<GameSession> found = store.findByToken(token).filter(GameSession::isActive);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            closed = found.get();
            closed.setStatus(SessionStatus.CLOSED);
            store.save(closed, retention());
            store.unbind(closed.getRoomId(), closed.getPlayerId(), token);
        }
        log.info("会话关闭: playerId={}, roomId={}", closed.getPlayerId(), closed.getRoomId());
        notifier.notify(SessionInvalidatedEvent.of(token, closed.getPlayerId(), closed.getRoomId(),
                EventType.CLOSED, clock.millis(), "player left"));
        return Optional.of(closed);
    }

    /**
     * 回收：把超过 TTL 未心跳的 ACTIVE 会话标记为 EXPIRED 并通知；
     * 非 ACTIVE 且已超过 TTL 的历史记录直接删除。
     *
     * @return 本次被判定过期的会话
     */
    public List<GameSession> reap() {
        List<GameSession> expired = new ArrayList<>();
        int purged = 0;
        synchronized (lock) {
            for (GameSession s : store.findAll()) {
                if (!isStale(s)) {
                    continue;
                }
                if (s.isActive()) {
                    expire(s);
                    expired.add(s);
                } else {
                    store.delete(s.getToken());
                    purged++;
                }
            }
        }
        for (GameSession s : expired) {
            notifier.notify(SessionInvalidatedEvent.of(s.getToken(), s.getPlayerId(), s.getRoomId(),
                    EventType.EXPIRED, clock.millis(), "heartbeat timeout"));
        }
        if (!expired.isEmpty() || purged > 0) {
            log.info("会话回收完成: expired={}, purged={}", expired.size(), purged);
        }
        return expired;
    }

    public Duration getTtl() {
        return ttl;
    }

    /* =========================
     * 内部工具
     * ========================= */

    private GameSession requireLive(String token) {
        if (StringUtils.isBlank(token)) {
            throw new SessionExpiredException(token, "token is blank");
        }
        GameSession s = store.findByToken(token)
                .orElseThrow(() -> new SessionExpiredException(token, "unknown token"));
        if (!s.isActive()) {
            throw new SessionExpiredException(token, "session is " + s.getStatus());
        }
        if (isStale(s)) {
            GameSession expired;
            synchronized (lock) {
                expired = store.findByToken(token).filter(GameSession::isActive).orElse(null);
                if (expired != null) {
                    expire(expired);
                }
            }
            if (expired != null) {
                notifier.notify(SessionInvalidatedEvent.of(token, expired.getPlayerId(), expired.getRoomId(),
                        EventType.EXPIRED, clock.millis(), "heartbeat timeout"));
            }
            throw new SessionExpiredException(token, "session expired");
        }
        return s;
    }

    private void expire(GameSession s) {
        s.setStatus(SessionStatus.EXPIRED);
        store.save(s, retention());
        store.unbind(s.getRoomId(), s.getPlayerId(), s.getToken());
        log.debug("会话过期: playerId={}, roomId={}", s.getPlayerId(), s.getRoomId());
    }

    /** 最近一次心跳距今超过 TTL */
    private boolean isStale(GameSession s) {
        long last = s.getLastHeartbeat() != null ? s.getLastHeartbeat() : 0L;
        return clock.millis() - last > ttl.toMillis();
    }

    /** 记录保留两倍 TTL，回收器有足够时间把 ACTIVE 判定为 EXPIRED */
    private Duration retention() {
        return ttl.multipliedBy(2);
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static void requireText(String value, String field) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}

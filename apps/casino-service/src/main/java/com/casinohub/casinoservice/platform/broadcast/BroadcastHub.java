package com.casinohub.casinoservice.platform.broadcast;

import com.casinohub.casinoservice.platform.transport.Envelope;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 房间广播中心。
 *
 * - publish：先按调用顺序同步投递给本实例上该房间的全部连接，再交给 {@link BroadcastTransport} 转发；
 * - 单个连接投递失败只记日志，不影响其他连接；
 * - 同一房间的 publish 由房间串行锁保证顺序。
 */
@Slf4j
public class BroadcastHub {

    /** roomId -> (connectionId -> 连接)，保持订阅顺序 */
    private final Map<String, Map<String, RoomConnection>> subscribers = new ConcurrentHashMap<>();
    private final BroadcastTransport transport;

    public BroadcastHub(BroadcastTransport transport) {
        this.transport = transport;
        transport.start(this::deliverLocal);
    }

    public void subscribe(String roomId, RoomConnection connection) {
        subscribers.computeIfAbsent(roomId, k -> Collections.synchronizedMap(new LinkedHashMap<>()))
                .put(connection.connectionId(), connection);
        log.debug("订阅房间: roomId={}, connectionId={}", roomId, connection.connectionId());
    }

    public boolean unsubscribe(String roomId, String connectionId) {
        Map<String, RoomConnection> conns = subscribers.get(roomId);
        if (conns == null) {
            return false;
        }
        boolean removed = conns.remove(connectionId) != null;
        if (removed) {
            log.debug("退订房间: roomId={}, connectionId={}", roomId, connectionId);
        }
        return removed;
    }

    /**
     * 广播到房间：本地投递 + 转发。
     */
    public void publish(String roomId, Envelope<?> envelope) {
        deliverLocal(roomId, envelope);
        transport.forward(roomId, envelope);
    }

    /**
     * 只投递给本实例上的连接（其他实例转发来的消息也走这里）。
     */
    public void deliverLocal(String roomId, Envelope<?> envelope) {
        for (RoomConnection c : connectionsOf(roomId)) {
            deliverQuietly(c, envelope);
        }
    }

    /**
     * 只投递给持有该令牌的连接（如拒绝通知、重连快照）。
     */
    public int sendTo(String roomId, String token, Envelope<?> envelope) {
        int n = 0;
        for (RoomConnection c : connectionsOf(roomId)) {
            if (token.equals(c.token())) {
                deliverQuietly(c, envelope);
                n++;
            }
        }
        return n;
    }

    /**
     * 关闭并移除持有该令牌的所有连接。
     *
     * @return 关闭的连接数
     */
    public int closeConnections(String token, String reason) {
        int closed = 0;
        for (Map.Entry<String, Map<String, RoomConnection>> room : subscribers.entrySet()) {
            for (RoomConnection c : connectionsOf(room.getKey())) {
                if (!token.equals(c.token())) {
                    continue;
                }
                room.getValue().remove(c.connectionId());
                try {
                    c.close(reason);
                } catch (Exception e) {
                    log.warn("关闭连接失败: roomId={}, connectionId={}", room.getKey(), c.connectionId(), e);
                }
                closed++;
            }
        }
        if (closed > 0) {
            log.info("已关闭令牌对应的连接: count={}, reason={}", closed, reason);
        }
        return closed;
    }

    public int connectionCount(String roomId) {
        return connectionsOf(roomId).size();
    }

    /** 房间不再存在时清理订阅 */
    public void dropRoom(String roomId) {
        subscribers.remove(roomId);
    }

    public boolean degraded() {
        return transport.degraded();
    }

    private List<RoomConnection> connectionsOf(String roomId) {
        Map<String, RoomConnection> conns = subscribers.get(roomId);
        if (conns == null) {
            return List.of();
        }
        synchronized (conns) {
            return new ArrayList<>(conns.values());
        }
    }

    private void deliverQuietly(RoomConnection c, Envelope<?> envelope) {
        try {
            c.deliver(envelope);
        } catch (Exception e) {
            log.warn("投递消息失败: roomId={}, connectionId={}, type={}",
                    envelope.roomId(), c.connectionId(), envelope.type(), e);
        }
    }
}

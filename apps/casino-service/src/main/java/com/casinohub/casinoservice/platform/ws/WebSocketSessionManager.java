package com.casinohub.casinoservice.platform.ws;

import com.casinohub.casinoservice.common.GameException;
import com.casinohub.casinoservice.games.casino.service.CasinoGameService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 监听 STOMP 连接/断开事件：
 * - CONNECT 帧带 token 头时，把该 STOMP 会话挂到令牌所在房间并推送快照；
 * - 断开时退订。
 */
@Slf4j
@Component
public class WebSocketSessionManager {

    /** CONNECT 帧中携带会话令牌的头 */
    public static final String TOKEN_HEADER = "token";
    /** CONNECT 帧中携带玩家 ID 的头，用于点对点投递 */
    public static final String PLAYER_HEADER = "playerId";

    private final CasinoGameService gameService;
    private final WebSocketDisconnectHelper disconnectHelper;

    /** STOMP sessionId -> roomId */
    private final Map<String, String> attached = new ConcurrentHashMap<>();

    public WebSocketSessionManager(CasinoGameService gameService, WebSocketDisconnectHelper disconnectHelper) {
        this.gameService = gameService;
        this.disconnectHelper = disconnectHelper;
    }

    @EventListener
    public void handleSessionConnected(SessionConnectedEvent event) {
        StompHeaderAccessor connected = StompHeaderAccessor.wrap(event.getMessage());
        Object connectMessage = connected.getHeader(StompHeaderAccessor.CONNECT_MESSAGE_HEADER);
        StompHeaderAccessor accessor = connectMessage instanceof Message<?> m
                ? StompHeaderAccessor.wrap(m) : connected;
        String sessionId = connected.getSessionId();
        String token = accessor.getFirstNativeHeader(TOKEN_HEADER);
        String playerId = accessor.getFirstNativeHeader(PLAYER_HEADER);
        if (sessionId == null || token == null || playerId == null) {
            log.debug("STOMP 连接未携带令牌，忽略: sessionId={}", sessionId);
            return;
        }
        attach(sessionId, playerId, token);
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        detach(event.getSessionId());
    }

    void attach(String sessionId, String playerId, String token) {
        try {
            StompRoomConnection connection = new StompRoomConnection(sessionId, playerId, token, disconnectHelper);
            String roomId = gameService.attach(token, connection).roomId();
            attached.put(sessionId, roomId);
            log.info("STOMP 连接已挂到房间: sessionId={}, playerId={}, roomId={}", sessionId, playerId, roomId);
        } catch (GameException e) {
            log.info("STOMP 连接令牌无效，断开: sessionId={}, error={}", sessionId, e.getError());
            disconnectHelper.sendKickMessage(playerId, sessionId, e.getMessage());
            disconnectHelper.forceDisconnect(sessionId);
        }
    }

    void detach(String sessionId) {
        String roomId = attached.remove(sessionId);
        if (roomId != null) {
            gameService.detach(roomId, sessionId);
            log.debug("STOMP 连接断开并退订: sessionId={}, roomId={}", sessionId, roomId);
        }
    }
}

package com.casinohub.casinoservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * WebSocket 投递与断连工具类。
 *
 * 供 {@link StompRoomConnection} 复用：
 * - 按 STOMP 会话点对点投递房间消息；
 * - 重复连接/会话过期时发送踢人通知并强制断开。
 */
@Slf4j
@Component
public class WebSocketDisconnectHelper {

    /** 房间消息的目标队列地址 */
    public static final String ROOM_DESTINATION = "/queue/casino.room";

    /** 踢人消息的目标队列地址 */
    private static final String KICK_DESTINATION = "/queue/system.kick";

    private final SimpMessagingTemplate messagingTemplate;

    /** 客户端入站消息通道，用于强制断开连接 */
    private final MessageChannel clientInboundChannel;

    public WebSocketDisconnectHelper(
            SimpMessagingTemplate messagingTemplate,
            @Qualifier("clientInboundChannel") MessageChannel clientInboundChannel) {
        this.messagingTemplate = messagingTemplate;
        this.clientInboundChannel = clientInboundChannel;
    }

    /**
     * 向指定 STOMP 会话投递消息。
     */
    public void sendToSession(String playerId, String sessionId, Object payload) {
        messagingTemplate.convertAndSendToUser(playerId, ROOM_DESTINATION, payload, sessionHeaders(sessionId));
    }

    /**
     * 向客户端发送踢人通知。
     */
    public void sendKickMessage(String playerId, String sessionId, String reason) {
        try {
            messagingTemplate.convertAndSendToUser(
                    playerId,
                    KICK_DESTINATION,
                    Map.of("type", "WS_KICK", "reason", reason),
                    sessionHeaders(sessionId)
            );
        } catch (Exception e) {
            log.warn("发送踢人通知失败: playerId={}, sessionId={}", playerId, sessionId, e);
        }
    }

    /**
     * 强制断开 WebSocket 连接。
     */
    public void forceDisconnect(String sessionId) {
        try {
            // 发送 DISCONNECT 命令到客户端入站通道，触发框架断开连接
            StompHeaderAccessor header = StompHeaderAccessor.create(StompCommand.DISCONNECT);
            header.setSessionId(sessionId);
            header.setLeaveMutable(true);
            clientInboundChannel.send(MessageBuilder.createMessage(new byte[0], header.getMessageHeaders()));
        } catch (Exception e) {
            log.warn("强制断开连接失败: sessionId={}", sessionId, e);
        }
    }

    private static MessageHeaders sessionHeaders(String sessionId) {
        SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headerAccessor.setSessionId(sessionId);
        headerAccessor.setLeaveMutable(true);
        return headerAccessor.getMessageHeaders();
    }
}

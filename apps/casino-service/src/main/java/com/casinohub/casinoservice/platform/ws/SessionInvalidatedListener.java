package com.casinohub.casinoservice.platform.ws;

import com.casinohub.casinoservice.platform.broadcast.BroadcastHub;
import com.casinohub.session.event.SessionEventListener;
import com.casinohub.session.event.SessionInvalidatedEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 会话失效事件监听器。
 *
 * 令牌被顶替、过期或主动关闭时，断开本实例上持有该令牌的所有房间连接。
 * 启用 Kafka 通知器时，其他实例上的连接同样会收到事件。
 */
@Slf4j
@Component
public class SessionInvalidatedListener implements SessionEventListener {

    private final BroadcastHub hub;

    public SessionInvalidatedListener(BroadcastHub hub) {
        this.hub = hub;
    }

    @Override
    public void onSessionInvalidated(SessionInvalidatedEvent event) {
        if (StringUtils.isBlank(event.getToken())) {
            return;
        }
        int closed = hub.closeConnections(event.getToken(), getKickReason(event));
        log.debug("会话失效，断开连接: playerId={}, roomId={}, eventType={}, closed={}",
                event.getPlayerId(), event.getRoomId(), event.getEventType(), closed);
    }

    /**
     * 根据事件类型生成踢人原因。
     */
    private String getKickReason(SessionInvalidatedEvent event) {
        if (event.getEventType() == null) {
            return StringUtils.defaultIfBlank(event.getReason(), "session invalidated");
        }
        return switch (event.getEventType()) {
            case SUPERSEDED -> "duplicate connection";
            case EXPIRED -> "session expired";
            case CLOSED -> "player left";
        };
    }
}

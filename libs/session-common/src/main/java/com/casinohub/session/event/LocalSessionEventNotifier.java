package com.casinohub.session.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 进程内投递：依次回调所有监听器，单个监听器异常不影响其他监听器。
 */
@Slf4j
public class LocalSessionEventNotifier implements SessionEventNotifier {

    private final List<SessionEventListener> listeners;

    public LocalSessionEventNotifier(List<SessionEventListener> listeners) {
        this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
    }

    /**
     * @return 全部监听器都处理成功时返回 true
     */
    public boolean dispatch(SessionInvalidatedEvent event) {
        boolean allSuccess = true;
        for (SessionEventListener listener : listeners) {
            try {
                listener.onSessionInvalidated(event);
            } catch (Exception e) {
                log.error("监听器处理会话失效事件失败: listener={}, playerId={}, roomId={}, eventType={}",
                        listener.getClass().getName(), event.getPlayerId(), event.getRoomId(),
                        event.getEventType(), e);
                allSuccess = false;
            }
        }
        return allSuccess;
    }

    @Override
    public void notify(SessionInvalidatedEvent event) {
        log.debug("本地投递会话失效事件: playerId={}, roomId={}, eventType={}",
                event.getPlayerId(), event.getRoomId(), event.getEventType());
        dispatch(event);
    }

    public int listenerCount() {
        return listeners.size();
    }
}

package com.casinohub.session.event;

/**
 * 会话事件监听器接口。
 *
 * 各服务实现此接口，处理会话失效事件（如关闭该令牌对应的房间连接）。
 *
 * 使用方式：
 * <pre>
 * {@code
 * @Component
 * public class RoomConnectionCloser implements SessionEventListener {
 *     @Override
 *     public void onSessionInvalidated(SessionInvalidatedEvent event) {
 *         // 关闭该令牌的连接
 *     }
 * }
 * }
 * </pre>
 */
public interface SessionEventListener {

    /**
     * 处理会话失效事件。
     *
     * @param event 会话失效事件
     */
    void onSessionInvalidated(SessionInvalidatedEvent event);
}

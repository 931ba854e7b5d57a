package com.casinohub.sessionkafkanotifier.publisher;

import com.casinohub.session.event.LocalSessionEventNotifier;
import com.casinohub.session.event.SessionEventNotifier;
import com.casinohub.session.event.SessionInvalidatedEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * 经 Kafka 投递会话失效事件，所有实例（包括本实例）由 {@link com.casinohub.sessionkafkanotifier.listener.SessionEventConsumer} 收到后处理。
 *
 * Kafka 不可用时退化为本地投递，本实例上的连接仍能被关闭。
 */
@Slf4j
public class KafkaSessionEventNotifier implements SessionEventNotifier {

    private final SessionEventPublisher publisher;
    private final LocalSessionEventNotifier fallback;

    public KafkaSessionEventNotifier(SessionEventPublisher publisher, LocalSessionEventNotifier fallback) {
        this.publisher = publisher;
        this.fallback = fallback;
    }

    @Override
    public void notify(SessionInvalidatedEvent event) {
        publisher.publishSessionInvalidated(event).whenComplete((result, ex) -> {
            if (ex != null) {
                log.warn("Kafka 不可用，会话失效事件改为本地投递: playerId={}, roomId={}, eventType={}",
                        event.getPlayerId(), event.getRoomId(), event.getEventType());
                fallback.dispatch(event);
            }
        });
    }
}

package com.casinohub.sessionkafkanotifier.listener;

import com.alibaba.fastjson2.JSON;
import com.casinohub.session.event.LocalSessionEventNotifier;
import com.casinohub.session.event.SessionInvalidatedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * 会话事件消费者。
 *
 * 监听 Kafka 中的会话失效事件，交给本实例的 {@link com.casinohub.session.event.SessionEventListener} 处理。
 *
 * 注意：使用手动提交 offset，只有所有监听器处理成功后才会提交。
 */
@Slf4j
@Component
public class SessionEventConsumer {

    private final LocalSessionEventNotifier localNotifier;

    public SessionEventConsumer(LocalSessionEventNotifier localNotifier) {
        this.localNotifier = localNotifier;
        log.info("会话事件消费者初始化完成，发现 {} 个监听器", localNotifier.listenerCount());
    }

    /**
     * 消费会话失效事件。
     *
     * @param message 消息内容（JSON 字符串）
     * @param ack     手动提交确认对象
     */
    @KafkaListener(topics = "${session.kafka.topic:casino-session-invalidated}",
                   containerFactory = "sessionKafkaListenerContainerFactory")
    public void consumeSessionInvalidated(String message, Acknowledgment ack) {
        SessionInvalidatedEvent event;
        try {
            event = JSON.parseObject(message, SessionInvalidatedEvent.class);
            if (event == null) {
                throw new IllegalArgumentException("empty message");
            }
        } catch (Exception e) {
            // 无法解析的消息重试也没有意义，直接提交
            log.error("会话失效事件解析失败，丢弃: message={}", message, e);
            ack.acknowledge();
            return;
        }
        log.debug("收到会话失效事件: playerId={}, roomId={}, eventType={}",
                event.getPlayerId(), event.getRoomId(), event.getEventType());

        if (localNotifier.listenerCount() == 0) {
            log.warn("收到会话失效事件，但未发现任何 SessionEventListener 实现: roomId={}", event.getRoomId());
            ack.acknowledge();
            return;
        }

        if (localNotifier.dispatch(event)) {
            ack.acknowledge();
            log.debug("会话失效事件处理完成并提交: roomId={}", event.getRoomId());
        } else {
            // 不提交，消息会被重新消费
            log.warn("会话失效事件部分监听器失败，不提交 offset: roomId={}", event.getRoomId());
        }
    }
}

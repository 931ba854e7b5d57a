package com.casinohub.sessionkafkanotifier.publisher;

import com.alibaba.fastjson2.JSON;
import com.casinohub.session.event.SessionInvalidatedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * 会话事件发布器。
 *
 * 将会话失效事件以 JSON 发布到 Kafka，key 为房间 ID（同一房间的事件保持顺序）。
 */
@Slf4j
@Component
public class SessionEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${session.kafka.topic:casino-session-invalidated}")
    private String topic;

    public SessionEventPublisher(@Qualifier("sessionKafkaTemplate") KafkaTemplate<String, String> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    /**
     * 发布会话失效事件。
     *
     * @return 发送结果；序列化或发送前的同步异常也以失败的 future 返回
     */
    public CompletableFuture<SendResult<String, String>> publishSessionInvalidated(SessionInvalidatedEvent event) {
        try {
            String message = JSON.toJSONString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, event.getRoomId(), message);
            return future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("会话失效事件发布成功: roomId={}, eventType={}, offset={}",
                            event.getRoomId(), event.getEventType(), result.getRecordMetadata().offset());
                } else {
                    log.error("会话失效事件发布失败: roomId={}, eventType={}", event.getRoomId(), event.getEventType(), ex);
                }
            });
        } catch (Exception e) {
            log.error("发布会话失效事件异常: roomId={}", event.getRoomId(), e);
            return CompletableFuture.failedFuture(e);
        }
    }

    void setTopic(String topic) {
        this.topic = topic;
    }
}

package com.casinohub.sessionkafkanotifier.config;

import com.casinohub.session.config.SessionCommonAutoConfiguration;
import com.casinohub.session.event.LocalSessionEventNotifier;
import com.casinohub.session.event.SessionEventListener;
import com.casinohub.session.event.SessionEventNotifier;
import com.casinohub.sessionkafkanotifier.publisher.KafkaSessionEventNotifier;
import com.casinohub.sessionkafkanotifier.publisher.SessionEventPublisher;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Primary;

/**
 * 会话 Kafka 通知器自动配置类。
 *
 * 当配置了 session.kafka.bootstrap-servers 时自动启用，并先于 session-common 装配，
 * 使 {@link SessionEventNotifier} 由 Kafka 实现提供。
 *
 * 自动扫描并注册：
 * - {@link SessionKafkaConfig}：Kafka 配置
 * - {@link SessionEventPublisher}：事件发布器
 * - {@link com.casinohub.sessionkafkanotifier.listener.SessionEventConsumer}：事件消费者
 */
@AutoConfiguration(before = SessionCommonAutoConfiguration.class)
@ConditionalOnProperty(prefix = "session.kafka", name = "bootstrap-servers")
@ComponentScan(basePackages = "com.casinohub.sessionkafkanotifier")
public class SessionKafkaNotifierAutoConfiguration {

    /**
     * 本地投递器：Kafka 消费到事件后、或发布失败回退时使用。
     */
    @Bean
    public LocalSessionEventNotifier localSessionEventNotifier(ObjectProvider<SessionEventListener> listeners) {
        return new LocalSessionEventNotifier(listeners.orderedStream().toList());
    }

    @Bean
    @Primary
    public SessionEventNotifier kafkaSessionEventNotifier(SessionEventPublisher publisher,
                                                          LocalSessionEventNotifier localNotifier) {
        return new KafkaSessionEventNotifier(publisher, localNotifier);
    }
}

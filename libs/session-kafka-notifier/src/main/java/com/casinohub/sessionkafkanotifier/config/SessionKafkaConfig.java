package com.casinohub.sessionkafkanotifier.config;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * 会话事件 Kafka 配置。
 *
 * 配置生产者和消费者，支持手动提交 offset。
 *
 * 配置要求（application.yml）：
 * <pre>
 * session:
 *   kafka:
 *     bootstrap-servers: localhost:9092
 *     topic: casino-session-invalidated
 * </pre>
 *
 * 注意：
 * - 每个实例都要收到全部事件（关闭本实例上的连接），因此消费者组默认按实例随机生成。
 * - 条件控制由 {@link SessionKafkaNotifierAutoConfiguration} 统一管理，此处不需要 @ConditionalOnProperty。
 */
@Configuration
public class SessionKafkaConfig {

    /**
     * Kafka 集群地址，从 session.kafka.bootstrap-servers 读取。
     */
    @Value("${session.kafka.bootstrap-servers}")
    private String bootstrapServers;

    /**
     * 消费者组 ID，未配置时每个实例独立成组（广播语义）。
     */
    @Value("${session.kafka.consumer.group-id:casino-session-${random.uuid}}")
    private String consumerGroupId;

    @Bean
    public ProducerFactory<String, String> sessionKafkaProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        // 消息内容为 JSON 字符串
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        // 等待所有副本确认
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        // 启用幂等性时 acks 必须为 all
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        // 投递超时后回退到本地通知，不宜过长
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 10_000);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 5_000);
        return new DefaultKafkaProducerFactory<>(props);
    }

    /**
     * KafkaTemplate（生产者）。
     */
    @Bean
    public KafkaTemplate<String, String> sessionKafkaTemplate() {
        return new KafkaTemplate<>(sessionKafkaProducerFactory());
    }

    /**
     * 消费者配置。
     */
    @Bean
    public ConsumerFactory<String, String> sessionKafkaConsumerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroupId);
        // 手动提交 offset
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        // 只关心启动之后的失效事件
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 50);
        return new DefaultKafkaConsumerFactory<>(props);
    }

    /**
     * 消费者监听器容器工厂（手动提交）。
     */
    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> sessionKafkaListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(sessionKafkaConsumerFactory());
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
        factory.setConcurrency(1);
        return factory;
    }
}

package com.casinohub.session.event;

/**
 * 会话失效事件的投递出口。
 *
 * 默认实现 {@link LocalSessionEventNotifier} 直接回调本进程的监听器；
 * 引入 session-kafka-notifier 并配置 session.kafka.bootstrap-servers 后，改为经 Kafka 投递到所有实例。
 */
public interface SessionEventNotifier {

    void notify(SessionInvalidatedEvent event);
}

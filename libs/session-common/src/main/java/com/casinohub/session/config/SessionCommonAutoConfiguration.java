package com.casinohub.session.config;

import com.casinohub.session.SessionRegistry;
import com.casinohub.session.event.LocalSessionEventNotifier;
import com.casinohub.session.event.SessionEventListener;
import com.casinohub.session.event.SessionEventNotifier;
import com.casinohub.session.store.InMemorySessionStore;
import com.casinohub.session.store.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * 会话管理自动配置入口类。
 *
 * 负责装配 {@link SessionRegistry} 及其默认协作者：
 * - 存储：未配置 session.redis.host 时使用内存存储（见 {@link SessionRedisConfig}）；
 * - 事件投递：未引入 Kafka 通知器时直接回调本进程的 {@link SessionEventListener}；
 * - 时钟：优先使用容器中的 {@link Clock} Bean，便于测试注入。
 */
@Slf4j
@AutoConfiguration(after = SessionRedisConfig.class)
public class SessionCommonAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SessionStore sessionStore() {
        log.info("会话存储使用内存实现（未配置 session.redis.host）");
        return new InMemorySessionStore();
    }

    @Bean
    @ConditionalOnMissingBean(SessionEventNotifier.class)
    public LocalSessionEventNotifier localSessionEventNotifier(ObjectProvider<SessionEventListener> listeners) {
        List<SessionEventListener> all = listeners.orderedStream().toList();
        log.info("会话事件本地投递已启用，发现 {} 个监听器", all.size());
        return new LocalSessionEventNotifier(all);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionRegistry sessionRegistry(SessionStore store,
                                           SessionEventNotifier notifier,
                                           ObjectProvider<Clock> clock,
                                           @Value("${session.ttl:PT24H}") Duration ttl) {
        return new SessionRegistry(store, notifier, clock.getIfAvailable(Clock::systemUTC), ttl);
    }
}

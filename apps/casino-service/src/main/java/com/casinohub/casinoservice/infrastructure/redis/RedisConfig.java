package com.casinohub.casinoservice.infrastructure.redis;

import com.casinohub.casinoservice.config.CasinoProperties;
import com.casinohub.casinoservice.games.casino.domain.repository.ActionLogRepository;
import com.casinohub.casinoservice.games.casino.domain.repository.RoomRepository;
import com.casinohub.casinoservice.games.casino.infrastructure.redis.RedisKeys;
import com.casinohub.casinoservice.games.casino.infrastructure.redis.repo.RedisActionLogRepository;
import com.casinohub.casinoservice.games.casino.infrastructure.redis.repo.RedisRoomRepository;
import com.casinohub.casinoservice.games.casino.room.DurableWriteQueue;
import com.casinohub.casinoservice.platform.broadcast.BroadcastTransport;
import com.casinohub.casinoservice.platform.broadcast.DistributedBroadcastTransport;
import com.casinohub.casinoservice.platform.broadcast.RedisRoomEventBus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * RedisConfig
 * -------------------------------------------------------
 * Redis 相关的基础设施 Bean，按配置开启：
 *  - casino.persistence.mode=redis：房间/日志仓储与持久化写队列；
 *  - casino.broadcast.mode=redis：消息监听容器与跨实例广播总线。
 * 连接工厂与 StringRedisTemplate 由 Spring Boot 自动配置（spring.data.redis.*）。
 */
@Configuration
public class RedisConfig {

    @Configuration
    @ConditionalOnProperty(prefix = "casino.persistence", name = "mode", havingValue = "redis")
    static class PersistenceConfig {

        @Bean
        public RedisOps redisOps(StringRedisTemplate strRedis) {
            return new RedisOps(strRedis);
        }

        @Bean
        public RoomRepository roomRepository(RedisOps ops) {
            return new RedisRoomRepository(ops);
        }

        @Bean
        public ActionLogRepository actionLogRepository(RedisOps ops) {
            return new RedisActionLogRepository(ops);
        }

        @Bean(destroyMethod = "close")
        public DurableWriteQueue durableWriteQueue() {
            return new DurableWriteQueue();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "casino.broadcast", name = "mode", havingValue = "redis")
    static class BroadcastConfig {

        /**
         * Redis消息监听容器，用于订阅房间广播频道
         */
        @Bean
        public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(connectionFactory);
            return container;
        }

        @Bean(destroyMethod = "close")
        public RedisRoomEventBus redisRoomEventBus(StringRedisTemplate redisTemplate,
                                                   RedisMessageListenerContainer container,
                                                   CasinoProperties props) {
            return new RedisRoomEventBus(redisTemplate, container,
                    RedisKeys.broadcastChannel(props.getBroadcast().getChannelPrefix()));
        }

        @Bean
        public BroadcastTransport distributedBroadcastTransport(RedisRoomEventBus bus) {
            return new DistributedBroadcastTransport(bus);
        }
    }
}

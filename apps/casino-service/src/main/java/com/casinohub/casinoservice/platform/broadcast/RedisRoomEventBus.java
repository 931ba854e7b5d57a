package com.casinohub.casinoservice.platform.broadcast;

import com.alibaba.fastjson2.JSON;
import com.casinohub.casinoservice.common.GameError;
import com.casinohub.casinoservice.platform.transport.Envelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 基于 Redis 发布/订阅的房间消息总线。
 *
 * <p>工作原理：</p>
 * <ol>
 *   <li>发布：消息格式为 {@code roomId|json}，由单个发布线程按调用顺序发出，不阻塞房间锁</li>
 *   <li>订阅：所有实例订阅同一频道，收到消息后交给本地投递；本实例发出的消息忽略</li>
 * </ol>
 */
@Slf4j
public class RedisRoomEventBus implements RoomEventBus, MessageListener, AutoCloseable {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer container;
    private final String channel;
    private final String instanceId = UUID.randomUUID().toString();
    private final ExecutorService publisher = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "room-bus-publisher");
        t.setDaemon(true);
        return t;
    });

    private volatile LocalDelivery handler;
    private volatile boolean healthy = true;

    public RedisRoomEventBus(StringRedisTemplate redisTemplate, RedisMessageListenerContainer container, String channel) {
        this.redisTemplate = redisTemplate;
        this.container = container;
        this.channel = channel;
    }

    @Override
    public void subscribe(LocalDelivery handler) {
        this.handler = handler;
        container.addMessageListener(this, new ChannelTopic(channel));
        log.info("已订阅Redis房间广播频道: {}, instanceId={}", channel, instanceId);
    }

    @Override
    public void publish(String roomId, Envelope<?> envelope) {
        String payload = roomId + "|" + JSON.toJSONString(BusMessage.of(instanceId, envelope));
        publisher.execute(() -> {
            try {
                redisTemplate.convertAndSend(channel, payload);
                if (!healthy) {
                    log.info("Redis房间广播已恢复: channel={}", channel);
                }
                healthy = true;
            } catch (Exception e) {
                if (healthy) {
                    log.warn("{}: Redis房间广播发布失败，仅本地投递: roomId={}, sequence={}",
                            GameError.BROADCAST_DEGRADED, roomId, envelope.sequence(), e);
                }
                healthy = false;
            }
        });
    }

    @Override
    public boolean healthy() {
        return healthy;
    }

    /**
     * 接收Redis消息并投递到本地连接
     */
    @Override
    public void onMessage(Message message, byte[] pattern) {
        String payload = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            int separatorIndex = payload.indexOf('|');
            if (separatorIndex <= 0) {
                log.warn("无效的房间广播消息格式: {}", payload);
                return;
            }
            String roomId = payload.substring(0, separatorIndex);
            BusMessage m = JSON.parseObject(payload.substring(separatorIndex + 1), BusMessage.class);
            if (m == null || instanceId.equals(m.getOrigin())) {
                return;
            }
            LocalDelivery h = handler;
            if (h != null) {
                h.deliver(roomId, m.toEnvelope(roomId));
            }
        } catch (Exception e) {
            log.error("处理Redis房间广播消息失败: {}", payload, e);
        }
    }

    String instanceId() {
        return instanceId;
    }

    @Override
    public void close() {
        container.removeMessageListener(this);
        publisher.shutdown();
    }
}

package com.casinohub.casinoservice.platform.broadcast;

import com.alibaba.fastjson2.JSON;
import com.casinohub.casinoservice.platform.transport.Envelope;
import com.casinohub.casinoservice.platform.transport.MessageType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class RedisRoomEventBusTest {

    private static final String CHANNEL = "casino:broadcast:room";

    private StringRedisTemplate redis;
    private RedisMessageListenerContainer container;
    private RedisRoomEventBus bus;
    private final List<Envelope<?>> delivered = new ArrayList<>();

    @BeforeEach
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        container = mock(RedisMessageListenerContainer.class);
        bus = new RedisRoomEventBus(redis, container, CHANNEL);
        bus.subscribe((roomId, env) -> delivered.add(env));
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void subscribeRegistersOnChannel() {
        verify(container).addMessageListener(eq(bus), argThat((Topic t) -> CHANNEL.equals(t.getTopic())));
    }

    @Test
    void publishSendsRoomPrefixedPayload() {
        bus.publish("r1", Envelope.of(MessageType.ACTION_ACCEPTED, "r1", 3, Map.of("k", "v"), 100L));

        verify(redis, timeout(2000)).convertAndSend(eq(CHANNEL), argThat(
                (String s) -> s.startsWith("r1|") && s.contains("\"sequence\":3")));
        assertThat(bus.healthy()).isTrue();
    }

    @Test
    void publishFailureMarksUnhealthy() throws InterruptedException {
        doThrow(new IllegalStateException("redis down")).when(redis).convertAndSend(anyString(), anyString());

        bus.publish("r1", Envelope.of(MessageType.ACTION_ACCEPTED, "r1", 1, "x", 0L));

        verify(redis, timeout(2000)).convertAndSend(anyString(), anyString());
        long deadline = System.currentTimeMillis() + 2000;
        while (bus.healthy() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(bus.healthy()).isFalse();
    }

    @Test
    void ownEchoIsIgnoredAndRemoteIsDelivered() {
        bus.onMessage(message("r1", bus.instanceId(), 1), null);
        bus.onMessage(message("r1", "other-instance", 2), null);
        bus.onMessage(new DefaultMessage(CHANNEL.getBytes(StandardCharsets.UTF_8),
                "garbage".getBytes(StandardCharsets.UTF_8)), null);

        assertThat(delivered).singleElement().satisfies(env -> {
            assertThat(env.sequence()).isEqualTo(2);
            assertThat(env.roomId()).isEqualTo("r1");
            assertThat(env.type()).isEqualTo(MessageType.PLAYER_JOINED);
        });
    }

    private static DefaultMessage message(String roomId, String origin, long seq) {
        BusMessage m = BusMessage.of(origin, Envelope.of(MessageType.PLAYER_JOINED, roomId, seq, Map.of("n", seq), 0L));
        String body = roomId + "|" + JSON.toJSONString(m);
        return new DefaultMessage(CHANNEL.getBytes(StandardCharsets.UTF_8), body.getBytes(StandardCharsets.UTF_8));
    }
}

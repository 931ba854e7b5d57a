package com.casinohub.casinoservice.platform.broadcast;

import com.casinohub.casinoservice.common.GameError;
import com.casinohub.casinoservice.platform.transport.Envelope;
import lombok.extern.slf4j.Slf4j;

/**
 * 未配置分布式总线：只做本地投递，始终处于降级模式。
 */
@Slf4j
public class LocalBroadcastTransport implements BroadcastTransport {

    @Override
    public void start(LocalDelivery localDelivery) {
        log.warn("{}: 未配置分布式广播总线，房间消息只投递到本实例的连接", GameError.BROADCAST_DEGRADED);
    }

    @Override
    public void forward(String roomId, Envelope<?> envelope) {
        // 本地已投递，无需转发
    }

    @Override
    public boolean degraded() {
        return true;
    }
}
